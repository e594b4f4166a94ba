package io.crawlrelay.bus;

import java.time.Duration;

public interface BusSubscription {
    /** Stops taking new deliveries. A handler already running is left to finish. */
    void stop();

    /**
     * Blocks until the subscription is stopped and no handler is running.
     *
     * @return false if the timeout elapsed first
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException;

    boolean isActive();
}
