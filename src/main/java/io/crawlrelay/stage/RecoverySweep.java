package io.crawlrelay.stage;

import io.crawlrelay.model.PendingJob;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup pass over a staging directory: returns every readable staged job in
 * arrival order and quarantines the rest.
 */
public final class RecoverySweep {
    private final DurableStage stage;
    private final Logger log;

    public RecoverySweep(DurableStage stage, Logger log) {
        this.stage = stage;
        this.log = log;
    }

    public List<PendingJob> sweep() {
        removeLeftoverTempFiles();
        List<Path> files = stage.pendingFiles();
        if (files.isEmpty()) {
            return List.of();
        }
        log.info("Processing pending queue. dir={} count={}", stage.stagingDir(), files.size());
        List<PendingJob> jobs = new ArrayList<>(files.size());
        for (Path file : files) {
            StageOutcome outcome = stage.load(file);
            if (outcome.isOk()) {
                jobs.add(outcome.job());
                continue;
            }
            try {
                Path bad = stage.quarantine(file);
                log.warn("Queue file invalid. moved={} reason={}", bad, outcome.error());
            } catch (StageException e) {
                log.error("Queue file invalid and could not be moved. path={} reason={}", file, outcome.error(), e);
            }
        }
        return jobs;
    }

    // A .tmp file is a write that never reached its rename; the job it belonged to
    // is either still staged under its final name or was never acknowledged.
    private void removeLeftoverTempFiles() {
        for (Path temp : stage.leftoverTempFiles()) {
            try {
                Files.deleteIfExists(temp);
                log.info("Leftover temp file removed. path={}", temp);
            } catch (IOException e) {
                log.warn("Leftover temp file could not be removed. path={}", temp, e);
            }
        }
    }
}
