package com.z254.secretsync.core.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.text.StringSubstitutor;
import org.apache.commons.text.lookup.StringLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders named templates against the flat field map of a secret.
 * <p>
 * The only action is a field reference, {@code {{ .field }}}. Every <code>{{</code> opens
 * an action, so templates are checked when registered and a configuration mistake surfaces
 * before any secret is fetched. A reference to a field that is absent renders as
 * {@value #NO_VALUE} instead of failing. Substituted values are inserted verbatim and never
 * scanned for further actions.
 * <p>
 * Not thread-safe for registration; build one engine per sync.
 */
public class TemplateEngine {

    private static final Logger log = LoggerFactory.getLogger(TemplateEngine.class);

    public static final String NO_VALUE = "<no value>";

    static final String OPEN = "{{";
    static final String CLOSE = "}}";

    private static final Pattern FIELD_REFERENCE = Pattern.compile("\\s*\\.([A-Za-z_][A-Za-z0-9_-]*)\\s*");
    // never appears in configuration text; commons-text requires some escape character
    private static final char NO_ESCAPE = '\u0000';

    private final Map<String, String> templates = new TreeMap<>();
    private final ObjectMapper objectMapper;

    public TemplateEngine() {
        this(new ObjectMapper());
    }

    public TemplateEngine(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Register a template under {@code name}, replacing any previous one.
     *
     * @throws TemplateException if the template text is malformed
     */
    public void register(String name, String text) {
        if (name == null || name.isBlank()) {
            throw new TemplateException(String.valueOf(name), "template name must not be empty");
        }
        if (text == null) {
            throw new TemplateException(name, "template text must not be null");
        }
        parseFieldReferences(name, text);
        templates.put(name, text);
    }

    /**
     * Registered template names in sorted order.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(templates.keySet());
    }

    public int size() {
        return templates.size();
    }

    /**
     * Render one template.
     *
     * @throws TemplateException if no template is registered under {@code name}
     */
    public String render(String name, Map<String, ?> fields) {
        String text = templates.get(name);
        if (text == null) {
            throw new TemplateException(name, "template not found");
        }
        List<String> missing = new ArrayList<>();
        StringSubstitutor substitutor = new StringSubstitutor(fieldLookup(fields, missing), OPEN, CLOSE, NO_ESCAPE);
        substitutor.setDisableSubstitutionInValues(true);
        String rendered = substitutor.replace(text);
        if (!missing.isEmpty()) {
            log.debug("Template {} references missing field(s) {}", name, missing);
        }
        return rendered;
    }

    /**
     * Render every registered template.
     *
     * @return rendered content keyed by template name, iterated in sorted name order
     */
    public Map<String, String> renderAll(Map<String, ?> fields) {
        Map<String, String> rendered = new LinkedHashMap<>();
        for (String name : templates.keySet()) {
            rendered.put(name, render(name, fields));
        }
        return rendered;
    }

    /**
     * Field names referenced by {@code text}, in order of appearance.
     *
     * @throws TemplateException if {@code text} is malformed
     */
    public static List<String> parseFieldReferences(String name, String text) {
        List<String> fields = new ArrayList<>();
        int position = 0;
        while (true) {
            int open = text.indexOf(OPEN, position);
            if (open < 0) {
                return fields;
            }
            int close = text.indexOf(CLOSE, open + OPEN.length());
            if (close < 0) {
                throw new TemplateException(name, "unclosed action at offset " + open);
            }
            String action = text.substring(open + OPEN.length(), close);
            Matcher matcher = FIELD_REFERENCE.matcher(action);
            if (!matcher.matches()) {
                throw new TemplateException(name, "unsupported action '{{" + action + "}}' at offset "
                        + open + ", expected a field reference such as {{ .field }}");
            }
            fields.add(matcher.group(1));
            position = close + CLOSE.length();
        }
    }

    private StringLookup fieldLookup(Map<String, ?> fields, List<String> missing) {
        return action -> {
            Matcher matcher = FIELD_REFERENCE.matcher(action);
            if (!matcher.matches()) {
                return null;
            }
            String field = matcher.group(1);
            Object value = fields.get(field);
            if (value == null) {
                missing.add(field);
                return NO_VALUE;
            }
            return stringify(value);
        };
    }

    private String stringify(Object value) {
        if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return String.valueOf(value);
            }
        }
        return String.valueOf(value);
    }
}
