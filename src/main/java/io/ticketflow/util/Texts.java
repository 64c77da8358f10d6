package io.ticketflow.util;

public final class Texts {
    public static final String TRUNCATION_SUFFIX = "...(truncated)";

    private Texts() {
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * Cuts {@code raw} to at most {@code maxChars} characters and marks the cut.
     * A non-positive limit disables truncation.
     */
    public static String truncate(String raw, int maxChars) {
        if (raw == null) {
            return "";
        }
        if (maxChars <= 0 || raw.length() <= maxChars) {
            return raw;
        }
        return raw.substring(0, maxChars) + TRUNCATION_SUFFIX;
    }

    public static String singleLine(String raw, int maxChars) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxChars) {
            return normalized;
        }
        return normalized.substring(0, maxChars) + "...";
    }
}
