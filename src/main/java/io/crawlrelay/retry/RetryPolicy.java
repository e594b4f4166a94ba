package io.crawlrelay.retry;

import io.crawlrelay.bus.MessageBus;
import io.crawlrelay.config.WorkerConfig;
import io.crawlrelay.model.ErrorGenre;
import io.crawlrelay.model.JobAttributes;
import io.crawlrelay.model.PendingJob;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a failed job goes back to the retry channel, and publishes it.
 *
 * <p>A proxy block is an external rate limit, so it gets up to
 * {@code maxRetries} retries after a fixed cooldown. Every other failure,
 * classified or not, gets one immediate retry.
 */
public final class RetryPolicy {
    public static final int PROXY_BLOCK_RETRY_DELAY_SEC = 300;

    private final WorkerConfig config;
    private final MessageBus bus;
    private final Sleeper sleeper;
    private final Logger log;

    public RetryPolicy(WorkerConfig config, MessageBus bus, Sleeper sleeper, Logger log) {
        this.config = config;
        this.bus = bus;
        this.sleeper = sleeper;
        this.log = log;
    }

    public static RetryDecision decide(Optional<ErrorGenre> genre, int currentRetryCount, int maxRetries) {
        if (maxRetries <= 0) {
            return RetryDecision.denied(0);
        }
        boolean proxyBlock = genre.isPresent() && genre.get() == ErrorGenre.PROXY_BLOCK;
        int effectiveMax = proxyBlock ? maxRetries : 1;
        int delaySeconds = proxyBlock ? PROXY_BLOCK_RETRY_DELAY_SEC : 0;
        if (currentRetryCount >= effectiveMax) {
            return RetryDecision.denied(effectiveMax);
        }
        return new RetryDecision(true, delaySeconds, effectiveMax);
    }

    public RetryOutcome resubmit(PendingJob pending, Optional<ErrorGenre> genre, String reason) {
        String msgId = pending.messageId();
        String genreLabel = genre.map(ErrorGenre::label).orElse(null);
        if (!config.retryEnabled()) {
            log.warn("Retry skipped (retry channel not configured). message_id={} reason={}", msgId, reason);
            return RetryOutcome.DISABLED;
        }
        int retryCount = JobAttributes.retryCount(pending.job().attributes(), log);
        RetryDecision decision = decide(genre, retryCount, config.maxRetries());
        if (!decision.allowed()) {
            log.warn("Retry skipped (max reached). message_id={} retry_count={} max_retries={} reason={} error_genre={}",
                    msgId, retryCount, decision.effectiveMaxRetries(), reason, genreLabel);
            return RetryOutcome.EXHAUSTED;
        }

        int nextCount = retryCount + 1;
        Map<String, String> attributes = pending.job().mutableAttributes();
        attributes.put(JobAttributes.RETRY_COUNT, String.valueOf(nextCount));
        attributes.putIfAbsent(JobAttributes.ORIGIN_MESSAGE_ID, msgId);
        attributes.putIfAbsent(JobAttributes.ORIGIN_SUBSCRIPTION, config.subscriptionName());
        if (genreLabel != null) {
            attributes.putIfAbsent(JobAttributes.ERROR_GENRE, genreLabel);
        }

        if (decision.delaySeconds() > 0) {
            log.warn("Retry delayed. message_id={} delay_sec={} reason={} error_genre={}",
                    msgId, decision.delaySeconds(), reason, genreLabel);
            try {
                sleeper.sleep(Duration.ofSeconds(decision.delaySeconds()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Retry cooldown interrupted; job stays staged. message_id={}", msgId);
                return RetryOutcome.INTERRUPTED;
            }
        }

        try {
            String publishId = bus.publish(config.retryChannel(), pending.job().data(), attributes);
            log.info("Retry published. message_id={} retry_count={} publish_id={} reason={} error_genre={}",
                    msgId, nextCount, publishId, reason, genreLabel);
            return RetryOutcome.PUBLISHED;
        } catch (RuntimeException e) {
            log.error("Retry publish failed. message_id={} retry_count={} reason={}", msgId, nextCount, reason, e);
            return RetryOutcome.PUBLISH_FAILED;
        }
    }
}
