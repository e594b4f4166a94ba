package io.crawlrelay.stage;

import io.crawlrelay.model.PendingJob;
import io.crawlrelay.model.StagedJob;
import io.crawlrelay.util.AtomicFiles;
import io.crawlrelay.util.Jsons;
import io.crawlrelay.util.SafeNames;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only staging directory owned by one subscription. Each pending job is
 * one JSON file named {@code <ms>_<id>_<random>.json}, so a lexical listing is
 * arrival order.
 */
public final class DurableStage {
    public static final String JOB_SUFFIX = ".json";
    public static final String QUARANTINE_SUFFIX = ".bad";
    private static final int MAX_ID_CHARS = 96;

    private final Path stagingDir;
    private final Logger log;
    private final AtomicLong lastStampMs;

    public DurableStage(Path stagingDir, Logger log) {
        this.stagingDir = stagingDir;
        this.log = log;
        this.lastStampMs = new AtomicLong(0L);
    }

    public Path stagingDir() {
        return stagingDir;
    }

    public StageOutcome stage(String messageId, byte[] data, Map<String, String> attributes) {
        try {
            Files.createDirectories(stagingDir);
        } catch (IOException | SecurityException e) {
            return StageOutcome.stageError("staging dir unavailable: " + stagingDir + " (" + e.getMessage() + ")");
        }
        if (!Files.isDirectory(stagingDir) || !Files.isWritable(stagingDir)) {
            return StageOutcome.stageError("staging dir not writable: " + stagingDir);
        }
        long now = Instant.now().toEpochMilli();
        StagedJob job = StagedJob.received(messageId, data, attributes, now);
        Path target = stagingDir.resolve(fileName(messageId, nextStamp(now)));
        try {
            AtomicFiles.write(target, Jsons.toJsonBytes(job));
        } catch (IOException | RuntimeException e) {
            return StageOutcome.stageError("staging write failed: " + target + " (" + e.getMessage() + ")");
        }
        return StageOutcome.ok(new PendingJob(target, job));
    }

    public StageOutcome load(Path file) {
        StagedJob job;
        try {
            job = Jsons.mapper().readValue(file.toFile(), StagedJob.class);
        } catch (IOException | RuntimeException e) {
            return StageOutcome.malformed("unreadable staged file: " + e.getMessage());
        }
        if (job == null || job.messageId() == null || job.messageId().isBlank()) {
            return StageOutcome.malformed("staged file without messageId");
        }
        if (job.attempts() < 0) {
            return StageOutcome.malformed("negative attempts: " + job.attempts());
        }
        try {
            job.data();
        } catch (IllegalArgumentException e) {
            return StageOutcome.malformed("payload is not valid base64: " + e.getMessage());
        }
        return StageOutcome.ok(new PendingJob(file, job));
    }

    /**
     * Persists one more attempt before the job runs, so a crash during
     * execution shows up as a higher count after recovery.
     */
    public PendingJob markAttempt(PendingJob pending) {
        return rewrite(pending, pending.job().withAttempt(Instant.now().toEpochMilli()));
    }

    public PendingJob recordError(PendingJob pending, String error) {
        return rewrite(pending, pending.job().withError(error, Instant.now().toEpochMilli()));
    }

    public boolean delete(PendingJob pending) {
        try {
            return Files.deleteIfExists(pending.location());
        } catch (IOException e) {
            throw new StageException("Failed to delete staged file: " + pending.location(), e);
        }
    }

    public Path quarantine(Path file) {
        Path bad = file.resolveSibling(file.getFileName().toString() + QUARANTINE_SUFFIX);
        try {
            AtomicFiles.move(file, bad);
            return bad;
        } catch (IOException e) {
            throw new StageException("Failed to quarantine staged file: " + file, e);
        }
    }

    /**
     * Puts a quarantined file back under its original name so the next sweep
     * picks it up again.
     */
    public Path release(String quarantinedName) {
        if (quarantinedName == null || !quarantinedName.endsWith(JOB_SUFFIX + QUARANTINE_SUFFIX)) {
            throw new IllegalArgumentException("Not a quarantined staged file: " + quarantinedName);
        }
        Path bad = stagingDir.resolve(quarantinedName).normalize();
        if (!stagingDir.normalize().equals(bad.getParent()) || !Files.isRegularFile(bad)) {
            throw new IllegalArgumentException("Quarantined file not found in " + stagingDir + ": " + quarantinedName);
        }
        String name = quarantinedName.substring(0, quarantinedName.length() - QUARANTINE_SUFFIX.length());
        Path restored = stagingDir.resolve(name);
        try {
            AtomicFiles.move(bad, restored);
            log.info("Quarantined file released. path={}", restored);
            return restored;
        } catch (IOException e) {
            throw new StageException("Failed to release quarantined file: " + bad, e);
        }
    }

    public List<Path> pendingFiles() {
        return list("*" + JOB_SUFFIX);
    }

    public List<Path> quarantinedFiles() {
        return list("*" + JOB_SUFFIX + QUARANTINE_SUFFIX);
    }

    List<Path> leftoverTempFiles() {
        return list("*" + JOB_SUFFIX + AtomicFiles.TEMP_SUFFIX);
    }

    private PendingJob rewrite(PendingJob pending, StagedJob updated) {
        try {
            AtomicFiles.write(pending.location(), Jsons.toJsonBytes(updated));
            return pending.with(updated);
        } catch (IOException e) {
            throw new StageException("Failed to update staged file: " + pending.location(), e);
        }
    }

    private List<Path> list(String glob) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(stagingDir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(stagingDir, glob)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        } catch (IOException e) {
            log.warn("Failed to list staging dir: {}", stagingDir, e);
            return files;
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    private long nextStamp(long nowMs) {
        return lastStampMs.updateAndGet(last -> Math.max(nowMs, last + 1L));
    }

    private static String fileName(String messageId, long stampMs) {
        String safeId = SafeNames.sanitizeOrDefault(messageId, "msg");
        if (safeId.length() > MAX_ID_CHARS) {
            safeId = safeId.substring(0, MAX_ID_CHARS);
        }
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return String.format("%015d_%s_%s%s", stampMs, safeId, suffix, JOB_SUFFIX);
    }
}
