package com.phillippitts.driftwatch.util;

/** Utility for log-safe previews of untrusted input lines. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input to at most max characters and replace control characters with a space,
     * so a hostile line cannot forge extra log records. Returns "" for null or non-positive max.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String cut = s.length() <= max ? s : s.substring(0, max) + "...";
        StringBuilder sb = new StringBuilder(cut.length());
        for (int i = 0; i < cut.length(); i++) {
            char c = cut.charAt(i);
            sb.append(Character.isISOControl(c) ? ' ' : c);
        }
        return sb.toString();
    }
}
