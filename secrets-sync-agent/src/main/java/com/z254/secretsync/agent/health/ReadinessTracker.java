package com.z254.secretsync.agent.health;

import com.z254.secretsync.core.writer.FileMode;
import com.z254.secretsync.core.writer.FileWriteException;
import com.z254.secretsync.core.writer.SecureFileWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks readiness: the agent is ready once at least one secret has synced successfully.
 * <p>
 * When a status file is configured it contains {@code ready} while the agent is ready
 * and is absent otherwise, for exec-style probes.
 */
@Slf4j
public class ReadinessTracker {

    static final String READY_CONTENT = "ready";

    private final int secretCount;
    private final String statusFile;
    private final SecureFileWriter writer;
    private final Set<String> synced = ConcurrentHashMap.newKeySet();

    private volatile boolean ready;

    public ReadinessTracker(int secretCount, String statusFile, SecureFileWriter writer) {
        this.secretCount = secretCount;
        this.statusFile = statusFile == null || statusFile.isBlank() ? null : statusFile;
        this.writer = writer;
    }

    /**
     * Record a successful sync.
     *
     * @return {@code true} if this is the secret's first success
     */
    public synchronized boolean markSynced(String secretName) {
        if (!synced.add(secretName)) {
            return false;
        }
        if (!ready) {
            ready = true;
            log.info("Agent is ready: secret {} synced", secretName);
            writeStatusFile();
        }
        return true;
    }

    /**
     * Drop readiness, e.g. on shutdown.
     */
    public synchronized void reset() {
        synced.clear();
        ready = false;
        removeStatusFile();
    }

    public boolean isReady() {
        return ready;
    }

    public int getSecretCount() {
        return secretCount;
    }

    public int getSyncedCount() {
        return synced.size();
    }

    private void writeStatusFile() {
        if (statusFile == null) {
            return;
        }
        try {
            writer.write(statusFile, FileMode.of(0644), null, null, READY_CONTENT.getBytes(StandardCharsets.UTF_8));
        } catch (FileWriteException e) {
            log.warn("Failed to write status file {}: {}", statusFile, e.getMessage());
        }
    }

    private void removeStatusFile() {
        if (statusFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(Path.of(statusFile));
        } catch (IOException e) {
            log.warn("Failed to remove status file {}: {}", statusFile, e.getMessage());
        }
    }
}
