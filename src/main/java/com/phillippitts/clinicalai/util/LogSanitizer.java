package com.phillippitts.clinicalai.util;

/**
 * Privacy-safe helpers for logging clinical text and identifiers.
 * Prompt and generated text must only reach logs through {@link #preview(String, int)}.
 */
public final class LogSanitizer {

    private static final String ELLIPSIS = "...";

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
     * Single-line preview: collapses whitespace runs and appends "..." when cut.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replaceAll("\\s+", " ").trim();
        return flat.length() <= max ? flat : flat.substring(0, max) + ELLIPSIS;
    }

    /**
     * Masks all but the last four characters of an identifier (e.g. an API key or org id).
     */
    public static String mask(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return "none";
        }
        if (identifier.length() <= 4) {
            return "****";
        }
        return "****" + identifier.substring(identifier.length() - 4);
    }
}
