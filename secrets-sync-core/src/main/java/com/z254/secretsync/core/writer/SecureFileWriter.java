package com.z254.secretsync.core.writer;

import com.z254.secretsync.core.model.OutputFile;
import com.z254.secretsync.core.writer.FileWriteException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Commits secret content to disk atomically.
 * <p>
 * Readers of the target path observe either the previous complete content or the new
 * complete content. The writer:
 * <ul>
 *   <li>refuses content larger than {@link #MAX_CONTENT_BYTES}</li>
 *   <li>refuses relative, over-long, {@code ..}-bearing and UNC/device paths</li>
 *   <li>never writes through a symbolic link or onto a special file</li>
 *   <li>stages content in a sibling temp file with an unpredictable suffix and renames
 *       it onto the target</li>
 *   <li>enforces the {@link FileMode} ceiling</li>
 * </ul>
 * Instances are stateless apart from the random source and safe for concurrent use.
 */
public class SecureFileWriter {

    private static final Logger log = LoggerFactory.getLogger(SecureFileWriter.class);

    public static final int MAX_CONTENT_BYTES = 1024 * 1024;

    static final boolean WINDOWS = File.separatorChar == '\\';

    public static final int MAX_PATH_LENGTH = WINDOWS ? 260 : 4096;

    static final String TEMP_MARKER = ".tmp.";
    static final int TEMP_SUFFIX_LENGTH = 8;
    static final Pattern TEMP_FILE_PATTERN =
            Pattern.compile(".+" + Pattern.quote(TEMP_MARKER) + "[a-z0-9]{" + TEMP_SUFFIX_LENGTH + "}");

    private static final char[] SUFFIX_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
    private static final Set<PosixFilePermission> DIRECTORY_PERMISSIONS =
            PosixFilePermissions.fromString("rwxr-x---");

    private final SecureRandom random = new SecureRandom();
    private final boolean posix = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");

    /**
     * Write UTF-8 text to a configured output file.
     */
    public void write(OutputFile target, String content) {
        write(target, content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Write bytes to a configured output file.
     */
    public void write(OutputFile target, byte[] content) {
        FileMode mode;
        try {
            mode = FileMode.parse(target.mode());
        } catch (FileWriteException e) {
            throw new FileWriteException(Reason.INVALID_MODE, target.path(),
                    "invalid mode for " + target.path() + ": " + e.getMessage(), e);
        }
        write(target.path(), mode, target.owner(), target.group(), content);
    }

    /**
     * Write {@code content} to {@code rawPath} atomically.
     *
     * @param owner uid to assign, {@code null} to leave unchanged
     * @param group gid to assign, {@code null} to leave unchanged
     * @throws FileWriteException if the write is refused or fails; the target is unchanged
     */
    public void write(String rawPath, FileMode mode, Integer owner, Integer group, byte[] content) {
        if (content.length > MAX_CONTENT_BYTES) {
            throw new FileWriteException(Reason.SIZE_LIMIT, rawPath, String.format(
                    "content size %d exceeds maximum allowed size %d", content.length, MAX_CONTENT_BYTES));
        }

        Path target = validatePath(rawPath);
        validateExistingTarget(target);

        Path parent = target.getParent();
        ensureDirectory(parent, rawPath);

        Path temp = parent.resolve(target.getFileName() + TEMP_MARKER + randomSuffix());
        createTempFile(temp, mode, rawPath);
        try {
            writeFully(temp, content);
            if (posix) {
                // creation attributes are filtered by the umask
                Files.setPosixFilePermissions(temp, mode.toPosixPermissions());
            }
            applyOwnership(temp, owner, group);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(temp);
            if (e instanceof FileWriteException fwe) {
                throw fwe;
            }
            throw new FileWriteException(Reason.IO, rawPath,
                    "failed to write " + rawPath + ": " + e.getMessage(), e);
        }

        log.debug("Wrote {} bytes to {} with mode {}", content.length, rawPath, mode);
    }

    /**
     * Validate a raw path string and convert it to an absolute {@link Path}.
     *
     * @throws FileWriteException with reason {@link Reason#INVALID_PATH}
     */
    public static Path validatePath(String rawPath) {
        if (rawPath == null || rawPath.isEmpty()) {
            throw invalidPath(rawPath, "path cannot be empty");
        }
        if (rawPath.length() > MAX_PATH_LENGTH) {
            throw invalidPath(rawPath, String.format(
                    "path length %d exceeds maximum %d for this OS", rawPath.length(), MAX_PATH_LENGTH));
        }
        if (rawPath.startsWith("\\\\?\\") || rawPath.startsWith("\\\\.\\")) {
            throw invalidPath(rawPath, "extended (\\\\?\\) and device (\\\\.\\) paths are not allowed");
        }
        if (rawPath.startsWith("\\\\")) {
            throw invalidPath(rawPath, "UNC paths are not allowed, mount the share locally");
        }
        if (rawPath.indexOf('\0') >= 0) {
            throw invalidPath(rawPath, "path contains a NUL character");
        }
        if (rawPath.contains("..")) {
            throw invalidPath(rawPath, "path contains '..' which is not allowed");
        }

        Path path;
        try {
            path = Path.of(rawPath);
        } catch (InvalidPathException e) {
            throw new FileWriteException(Reason.INVALID_PATH, rawPath, "invalid path: " + e.getMessage(), e);
        }
        if (!path.isAbsolute()) {
            throw invalidPath(rawPath, "path must be absolute");
        }
        if (path.getFileName() == null || path.getParent() == null) {
            throw invalidPath(rawPath, "path must name a file below a directory");
        }
        return path.normalize();
    }

    private static void validateExistingTarget(Path target) {
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(target, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (NoSuchFileException e) {
            return;
        } catch (IOException e) {
            throw new FileWriteException(Reason.IO, target.toString(),
                    "failed to stat " + target + ": " + e.getMessage(), e);
        }

        if (attributes.isSymbolicLink()) {
            throw new FileWriteException(Reason.UNSAFE_TARGET, target.toString(),
                    "refusing to write through symbolic link " + target);
        }
        if (!attributes.isRegularFile()) {
            throw new FileWriteException(Reason.UNSAFE_TARGET, target.toString(),
                    "only regular files may be replaced, " + target + " is "
                            + (attributes.isDirectory() ? "a directory" : "a special file"));
        }
    }

    private void ensureDirectory(Path directory, String rawPath) {
        if (Files.isDirectory(directory)) {
            return;
        }
        try {
            if (posix) {
                Files.createDirectories(directory, PosixFilePermissions.asFileAttribute(DIRECTORY_PERMISSIONS));
            } else {
                Files.createDirectories(directory);
            }
            log.info("Created output directory {}", directory);
        } catch (IOException e) {
            throw new FileWriteException(Reason.IO, rawPath,
                    "failed to create directory " + directory + ": " + e.getMessage(), e);
        }
    }

    private void createTempFile(Path temp, FileMode mode, String rawPath) {
        try {
            if (posix) {
                FileAttribute<Set<PosixFilePermission>> permissions =
                        PosixFilePermissions.asFileAttribute(mode.toPosixPermissions());
                Files.createFile(temp, permissions);
            } else {
                Files.createFile(temp);
            }
        } catch (IOException e) {
            throw new FileWriteException(Reason.IO, rawPath,
                    "failed to create temp file for " + rawPath + ": " + e.getMessage(), e);
        }
    }

    private static void writeFully(Path temp, byte[] content) throws IOException {
        OpenOption[] options = {StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING,
                LinkOption.NOFOLLOW_LINKS};
        try (SeekableByteChannel channel = Files.newByteChannel(temp, options)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        }
    }

    private void applyOwnership(Path temp, Integer owner, Integer group) throws IOException {
        if (owner == null && group == null) {
            return;
        }
        if (!posix) {
            throw new FileWriteException(Reason.IO, temp.toString(),
                    "ownership can only be set on POSIX filesystems");
        }
        if (owner != null) {
            Files.setAttribute(temp, "unix:uid", owner, LinkOption.NOFOLLOW_LINKS);
        }
        if (group != null) {
            Files.setAttribute(temp, "unix:gid", group, LinkOption.NOFOLLOW_LINKS);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temp file {}: {}", temp, e.getMessage());
        }
    }

    private String randomSuffix() {
        char[] suffix = new char[TEMP_SUFFIX_LENGTH];
        for (int i = 0; i < suffix.length; i++) {
            suffix[i] = SUFFIX_ALPHABET[random.nextInt(SUFFIX_ALPHABET.length)];
        }
        return new String(suffix);
    }

    private static FileWriteException invalidPath(String rawPath, String message) {
        return new FileWriteException(Reason.INVALID_PATH, rawPath, "invalid path: " + message);
    }
}
