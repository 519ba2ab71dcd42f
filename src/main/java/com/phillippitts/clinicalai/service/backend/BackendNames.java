package com.phillippitts.clinicalai.service.backend;

/**
 * Backend identifiers shared by configuration, traces and health reporting.
 */
public final class BackendNames {

    public static final String OLLAMA = "ollama";
    public static final String CLAUDE = "claude";

    private BackendNames() {
        // Utility class - prevent instantiation
    }

    /** Name of a primary/secondary composition, e.g. "ollama+claude". */
    public static String composite(String primary, String secondary) {
        return secondary == null ? primary : primary + "+" + secondary;
    }
}
