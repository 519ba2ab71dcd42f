package com.phillippitts.clinicalai.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Ordered patient-safety risk levels produced by safety screening.
 *
 * <p>{@link #UNKNOWN} is never produced by classification; it marks the substitute
 * assessment used when screening itself could not run.
 */
public enum RiskLevel {
    LOW,
    MODERATE,
    HIGH,
    CRITICAL,
    UNKNOWN;

    /** Only CRITICAL stops the pipeline. */
    public boolean allowsProceeding() {
        return this != CRITICAL;
    }

    public boolean recommendsReferral() {
        return this == HIGH || this == CRITICAL;
    }

    /**
     * Lenient lookup used when parsing backend output ("high", " Critical ").
     */
    public static Optional<RiskLevel> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String v = value.trim().toUpperCase(Locale.ROOT);
        if ("MEDIUM".equals(v)) {
            return Optional.of(MODERATE);
        }
        for (RiskLevel level : values()) {
            if (level != UNKNOWN && level.name().equals(v)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
