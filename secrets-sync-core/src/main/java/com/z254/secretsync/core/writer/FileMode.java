package com.z254.secretsync.core.writer;

import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;

/**
 * Validated permission bits for a secret file.
 * <p>
 * The ceiling is {@code 0644} applied as a bit mask: owner may read and write, group and
 * others may at most read. Execute bits, setuid/setgid/sticky and any write bit outside
 * the owner are refused.
 */
public final class FileMode {

    public static final int DEFAULT_BITS = 0600;
    public static final int CEILING_BITS = 0644;

    private static final int WORLD_WRITE = 0002;
    private static final int WORLD_READ = 0004;
    private static final int GROUP_WRITE = 0020;

    private final int bits;

    private FileMode(int bits) {
        this.bits = bits;
    }

    /**
     * Parse an octal mode string such as {@code "0640"}. Blank selects {@code 0600}.
     *
     * @throws FileWriteException with reason {@link FileWriteException.Reason#INVALID_MODE}
     */
    public static FileMode parse(String mode) {
        if (mode == null || mode.isBlank()) {
            return new FileMode(DEFAULT_BITS);
        }
        int bits;
        try {
            bits = Integer.parseInt(mode.trim(), 8);
        } catch (NumberFormatException e) {
            throw new FileWriteException(FileWriteException.Reason.INVALID_MODE, null,
                    "invalid mode '" + mode + "': not an octal number", e);
        }
        return of(bits);
    }

    /**
     * Validate raw permission bits.
     */
    public static FileMode of(int bits) {
        if (bits < 0 || bits > 07777) {
            throw invalid(bits, "out of range");
        }
        if ((bits & WORLD_WRITE) != 0) {
            throw invalid(bits, "world-writable permissions are not allowed");
        }
        if ((bits & GROUP_WRITE) != 0 && (bits & WORLD_READ) != 0) {
            throw invalid(bits, "group-writable with world-readable is too permissive");
        }
        if ((bits & ~CEILING_BITS) != 0) {
            throw invalid(bits, "permissions exceed the maximum of 0644");
        }
        return new FileMode(bits);
    }

    public int bits() {
        return bits;
    }

    public Set<PosixFilePermission> toPosixPermissions() {
        Set<PosixFilePermission> permissions = EnumSet.noneOf(PosixFilePermission.class);
        if ((bits & 0400) != 0) {
            permissions.add(PosixFilePermission.OWNER_READ);
        }
        if ((bits & 0200) != 0) {
            permissions.add(PosixFilePermission.OWNER_WRITE);
        }
        if ((bits & 0040) != 0) {
            permissions.add(PosixFilePermission.GROUP_READ);
        }
        if ((bits & 0004) != 0) {
            permissions.add(PosixFilePermission.OTHERS_READ);
        }
        return permissions;
    }

    private static FileWriteException invalid(int bits, String detail) {
        return new FileWriteException(FileWriteException.Reason.INVALID_MODE, null,
                String.format("invalid mode 0%o: %s", bits, detail));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FileMode other && other.bits == bits;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(bits);
    }

    @Override
    public String toString() {
        return String.format("0%o", bits);
    }
}
