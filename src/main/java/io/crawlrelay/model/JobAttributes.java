package io.crawlrelay.model;

import org.slf4j.Logger;

import java.util.Map;

public final class JobAttributes {
    public static final String RETRY_COUNT = "retry_count";
    public static final String ORIGIN_MESSAGE_ID = "origin_message_id";
    public static final String ORIGIN_SUBSCRIPTION = "origin_subscription";
    public static final String ERROR_GENRE = "error_genre";

    private JobAttributes() {
    }

    /**
     * Reads {@code retry_count}; absent means 0, and an unparsable value is
     * logged and also treated as 0.
     */
    public static int retryCount(Map<String, String> attributes, Logger log) {
        if (attributes == null) {
            return 0;
        }
        String raw = attributes.get(RETRY_COUNT);
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid retry_count attribute: {}", raw);
            return 0;
        }
    }
}
