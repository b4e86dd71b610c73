package com.phillippitts.dictavault.util;

/** Utility for privacy-safe logging of user text and detected spans. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Masks a sensitive value, keeping only its first and last character and its length.
     * Values of two characters or fewer are fully masked.
     *
     * <p>Example: {@code "bob@example.com"} becomes {@code "b*************m"}.
     */
    public static String mask(String s) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        if (s.length() <= 2) {
            return "*".repeat(s.length());
        }
        return s.charAt(0) + "*".repeat(s.length() - 2) + s.charAt(s.length() - 1);
    }

    /**
     * Describes a text by its length only, for log lines that must not carry content.
     */
    public static String describe(String s) {
        return s == null ? "<null>" : "<" + s.length() + " chars>";
    }
}
