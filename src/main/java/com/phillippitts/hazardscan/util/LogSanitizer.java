package com.phillippitts.hazardscan.util;

/** Utility for privacy-safe logging of free-text previews and image fingerprints. */
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
     * Describes user-supplied text by length only so notes never reach the logs verbatim.
     */
    public static String describeLength(String s) {
        return s == null ? "<none>" : "<" + s.length() + " chars>";
    }

    /** Short fingerprint prefix suitable for correlating log lines. */
    public static String shortFingerprint(String fingerprint) {
        return truncate(fingerprint, 12);
    }
}
