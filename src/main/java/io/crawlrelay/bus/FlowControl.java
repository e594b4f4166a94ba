package io.crawlrelay.bus;

/**
 * Upper bound on deliveries handed to a handler and not yet returned from it.
 */
public record FlowControl(int maxInFlight) {
    public FlowControl {
        if (maxInFlight < 1) {
            throw new IllegalArgumentException("maxInFlight must be >= 1");
        }
    }

    public static FlowControl singleInFlight() {
        return new FlowControl(1);
    }
}
