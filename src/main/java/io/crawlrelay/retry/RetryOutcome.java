package io.crawlrelay.retry;

public enum RetryOutcome {
    /** Republished to the retry channel. */
    PUBLISHED,
    /** Retry budget for the genre is used up. */
    EXHAUSTED,
    /** No retry channel, or max retries is zero. */
    DISABLED,
    /** Publishing threw; the job stays staged. */
    PUBLISH_FAILED,
    /** Interrupted during the cooldown; the job stays staged. */
    INTERRUPTED;

    public boolean releasesStagedFile() {
        return this == PUBLISHED || this == EXHAUSTED || this == DISABLED;
    }
}
