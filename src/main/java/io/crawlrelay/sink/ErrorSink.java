package io.crawlrelay.sink;

import io.crawlrelay.model.ErrorGenre;

import java.time.Instant;

/**
 * Best-effort error bookkeeping. Implementations report their own failures
 * through the return value and never throw for storage problems.
 */
public interface ErrorSink {
    boolean record(String subscription, ErrorGenre genre, Instant at);

    static ErrorSink disabled() {
        return (subscription, genre, at) -> false;
    }
}
