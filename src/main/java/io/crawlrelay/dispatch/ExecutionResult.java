package io.crawlrelay.dispatch;

import java.time.Duration;

/**
 * Outcome of one job process run. {@code failure} is set when the process did
 * not produce a usable exit status (spawn error, timeout); {@code exitStatus}
 * is then {@code null}.
 */
public record ExecutionResult(
        Integer exitStatus,
        String stdout,
        String stderr,
        Duration duration,
        String failure
) {
    public static final String FAILURE_TIMEOUT = "timeout";
    public static final String FAILURE_UNEXPECTED = "unexpected_error";

    public static ExecutionResult exited(int exitStatus, String stdout, String stderr, Duration duration) {
        return new ExecutionResult(exitStatus, stdout, stderr, duration, null);
    }

    public static ExecutionResult failed(String failure, String stdout, String stderr, Duration duration) {
        return new ExecutionResult(null, stdout, stderr, duration, failure);
    }

    public boolean success() {
        return failure == null && exitStatus != null && exitStatus == 0;
    }

    /** Value stored as the staged job's {@code lastError}. */
    public String errorLabel() {
        if (success()) {
            return null;
        }
        if (exitStatus != null) {
            return "subprocess_failed:" + exitStatus;
        }
        return failure;
    }
}
