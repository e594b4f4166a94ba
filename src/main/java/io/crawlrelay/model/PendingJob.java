package io.crawlrelay.model;

import java.nio.file.Path;

public record PendingJob(Path location, StagedJob job) {
    public String messageId() {
        return job.messageId();
    }

    public PendingJob with(StagedJob updated) {
        return new PendingJob(location, updated);
    }
}
