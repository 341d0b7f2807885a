package com.z254.secretsync.core.model;

import java.util.Objects;

/**
 * Output file target of a secret.
 *
 * @param path  absolute file path
 * @param mode  octal permission string, e.g. {@code 0600}; empty means the default
 * @param owner numeric uid to assign, or {@code null} to keep the process owner
 * @param group numeric gid to assign, or {@code null} to keep the process group
 */
public record OutputFile(String path, String mode, Integer owner, Integer group) {

    public OutputFile {
        Objects.requireNonNull(path, "path must not be null");
    }

    public static OutputFile of(String path, String mode) {
        return new OutputFile(path, mode, null, null);
    }
}
