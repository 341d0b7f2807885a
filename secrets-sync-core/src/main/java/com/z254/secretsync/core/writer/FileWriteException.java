package com.z254.secretsync.core.writer;

/**
 * Raised when a file cannot be committed safely. The target is left untouched.
 */
public class FileWriteException extends RuntimeException {

    /**
     * Why the write was refused or failed.
     */
    public enum Reason {
        /** Content exceeds {@link SecureFileWriter#MAX_CONTENT_BYTES}. */
        SIZE_LIMIT,
        /** Path is relative, too long, contains {@code ..} or uses a reserved form. */
        INVALID_PATH,
        /** Existing target is a symbolic link, directory or special file. */
        UNSAFE_TARGET,
        /** Permission mode is malformed or too permissive. */
        INVALID_MODE,
        /** Filesystem error while writing, chowning or renaming. */
        IO
    }

    private final Reason reason;
    private final String path;

    public FileWriteException(Reason reason, String path, String message) {
        super(message);
        this.reason = reason;
        this.path = path;
    }

    public FileWriteException(Reason reason, String path, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.path = path;
    }

    public Reason getReason() {
        return reason;
    }

    public String getPath() {
        return path;
    }
}
