package com.phillippitts.classmate.util;

/** Utility for privacy-safe logging of transcript and model text. */
public final class LogSanitizer {

    /** Default preview length for transcript snippets in logs. */
    public static final int DEFAULT_PREVIEW_CHARS = 40;

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
     * Single-line preview for logs: newlines collapsed, truncated with an ellipsis marker.
     */
    public static String preview(String s) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        String flat = s.replaceAll("\\s+", " ").trim();
        return flat.length() <= DEFAULT_PREVIEW_CHARS ? flat : truncate(flat, DEFAULT_PREVIEW_CHARS) + "...";
    }
}
