package io.crawlrelay.retry;

public record RetryDecision(boolean allowed, int delaySeconds, int effectiveMaxRetries) {
    public static RetryDecision denied(int effectiveMaxRetries) {
        return new RetryDecision(false, 0, effectiveMaxRetries);
    }
}
