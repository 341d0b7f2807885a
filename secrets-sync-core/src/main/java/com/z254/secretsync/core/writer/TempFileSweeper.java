package com.z254.secretsync.core.writer;

import com.z254.secretsync.core.model.OutputFile;
import com.z254.secretsync.core.model.SecretSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Removes temp files left behind by {@link SecureFileWriter} after an unclean shutdown.
 * <p>
 * Only regular files whose name ends in {@code .tmp.} followed by the writer's random
 * suffix are deleted; running the sweep twice is a no-op the second time.
 */
public class TempFileSweeper {

    private static final Logger log = LoggerFactory.getLogger(TempFileSweeper.class);

    /**
     * Delete orphaned temp files in the given directories. Missing directories are skipped
     * and per-file failures are logged, never thrown.
     *
     * @return number of files removed
     */
    public int sweep(Collection<Path> directories) {
        int removed = 0;
        for (Path directory : directories) {
            if (directory == null || !Files.isDirectory(directory, LinkOption.NOFOLLOW_LINKS)) {
                continue;
            }
            removed += sweepDirectory(directory);
        }
        if (removed > 0) {
            log.info("Temp file cleanup complete: {} orphaned file(s) removed", removed);
        }
        return removed;
    }

    /**
     * Unique parent directories of every output file of the given secrets.
     */
    public static Set<Path> outputDirectories(Collection<SecretSpec> secrets) {
        Set<Path> directories = new TreeSet<>();
        for (SecretSpec secret : secrets) {
            for (OutputFile file : secret.files()) {
                if (file.path() == null || file.path().isEmpty()) {
                    continue;
                }
                Path parent = Path.of(file.path()).getParent();
                if (parent != null) {
                    directories.add(parent);
                }
            }
        }
        return directories;
    }

    static boolean isOrphanedTempName(String fileName) {
        return SecureFileWriter.TEMP_FILE_PATTERN.matcher(fileName).matches();
    }

    private int sweepDirectory(Path directory) {
        int removed = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory,
                entry -> isOrphanedTempName(entry.getFileName().toString()))) {
            for (Path entry : entries) {
                if (deleteIfRegular(entry)) {
                    removed++;
                }
            }
        } catch (IOException e) {
            log.warn("Failed to scan {} for orphaned temp files: {}", directory, e.getMessage());
        }
        return removed;
    }

    private boolean deleteIfRegular(Path entry) {
        try {
            BasicFileAttributes attributes =
                    Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            if (!attributes.isRegularFile()) {
                return false;
            }
            Files.delete(entry);
            log.info("Removed orphaned temp file {}", entry);
            return true;
        } catch (IOException e) {
            log.warn("Failed to remove orphaned temp file {}: {}", entry, e.getMessage());
            return false;
        }
    }
}
