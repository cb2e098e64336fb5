package com.phillippitts.council.util;

/** Utility for privacy-safe logging of query and answer previews. */
public final class LogSanitizer {

    /** Default preview length for query text in logs. */
    public static final int PREVIEW_CHARS = 60;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview: newlines collapsed, truncated to {@link #PREVIEW_CHARS} with an
     * ellipsis when cut.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String oneLine = s.replaceAll("\\s+", " ").trim();
        return oneLine.length() <= PREVIEW_CHARS ? oneLine : oneLine.substring(0, PREVIEW_CHARS) + "...";
    }
}
