package io.crawlrelay.model;

/**
 * Semantic categories carried by well-known crawler exit statuses.
 */
public enum ErrorGenre {
    PROXY_BLOCK("proxy_block"),
    CHROME_VERSION("chrome_version"),
    OTHER_PROCESS_EXIST("other_process_exist"),
    UNKNOWN("unknown");

    private final String label;

    ErrorGenre(String label) {
        this.label = label;
    }

    /** Value written to the {@code error_genre} attribute and the error log table. */
    public String label() {
        return label;
    }

    public static ErrorGenre fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Error genre cannot be empty");
        }
        for (ErrorGenre value : values()) {
            if (value.label.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown error genre: " + raw);
    }
}
