package io.crawlrelay.stage;

import io.crawlrelay.model.PendingJob;

/**
 * Result of staging a delivery or loading a staged file. Failures here are
 * expected outcomes, so they are values rather than exceptions.
 */
public record StageOutcome(Status status, PendingJob job, String error) {
    public enum Status {
        OK,
        STAGE_ERROR,
        MALFORMED
    }

    public static StageOutcome ok(PendingJob job) {
        return new StageOutcome(Status.OK, job, null);
    }

    public static StageOutcome stageError(String error) {
        return new StageOutcome(Status.STAGE_ERROR, null, error);
    }

    public static StageOutcome malformed(String error) {
        return new StageOutcome(Status.MALFORMED, null, error);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
