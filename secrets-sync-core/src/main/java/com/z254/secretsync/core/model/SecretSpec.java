package com.z254.secretsync.core.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One secret to keep synchronized: where to read it, how often, and which files to
 * produce from it.
 * <p>
 * Templates and files are paired positionally: the file at index {@code i} receives the
 * rendering of the template whose name is at index {@code i} of
 * {@link #sortedTemplateNames()}. Insertion order of {@code templates} is irrelevant.
 */
public record SecretSpec(
        String name,
        String key,
        String mountPath,
        KvVersion kvVersion,
        String namespace,
        String credentials,
        Duration refreshInterval,
        Map<String, String> templates,
        List<OutputFile> files) {

    public SecretSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(mountPath, "mountPath must not be null");
        Objects.requireNonNull(kvVersion, "kvVersion must not be null");
        Objects.requireNonNull(refreshInterval, "refreshInterval must not be null");
        templates = templates != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(templates))
                : Map.of();
        files = files != null ? List.copyOf(files) : List.of();
    }

    /**
     * Template names in the order used to assign rendered content to files.
     */
    public List<String> sortedTemplateNames() {
        List<String> names = new ArrayList<>(templates.keySet());
        names.sort(null);
        return names;
    }

    /**
     * Whether this secret carries its own namespace, including the explicit root
     * namespace {@code ""}.
     */
    public boolean hasNamespaceOverride() {
        return namespace != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String key;
        private String mountPath = "secret";
        private KvVersion kvVersion = KvVersion.V2;
        private String namespace;
        private String credentials;
        private Duration refreshInterval = Duration.ofMinutes(5);
        private final Map<String, String> templates = new LinkedHashMap<>();
        private final List<OutputFile> files = new ArrayList<>();

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder mountPath(String mountPath) {
            this.mountPath = mountPath;
            return this;
        }

        public Builder kvVersion(KvVersion kvVersion) {
            this.kvVersion = kvVersion;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder credentials(String credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder refreshInterval(Duration refreshInterval) {
            this.refreshInterval = refreshInterval;
            return this;
        }

        public Builder template(String templateName, String text) {
            this.templates.put(templateName, text);
            return this;
        }

        public Builder templates(Map<String, String> templates) {
            this.templates.putAll(templates);
            return this;
        }

        public Builder file(OutputFile file) {
            this.files.add(file);
            return this;
        }

        public Builder files(List<OutputFile> files) {
            this.files.addAll(files);
            return this;
        }

        public SecretSpec build() {
            return new SecretSpec(name, key, mountPath, kvVersion, namespace, credentials,
                    refreshInterval, templates, files);
        }
    }
}
