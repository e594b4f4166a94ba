package io.crawlrelay.util;

public final class SafeNames {
    private SafeNames() {
    }

    /**
     * Keeps ASCII letters, digits, {@code -} and {@code _}. Everything else is dropped,
     * so the result can never contain a path separator or a dot segment.
     */
    public static String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-';
            if (ok) {
                sb.append(ch);
            }
        }
        return sb.toString();
    }

    public static String sanitizeOrDefault(String raw, String fallback) {
        String value = sanitize(raw);
        return value.isEmpty() ? fallback : value;
    }
}
