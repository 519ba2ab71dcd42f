package com.phillippitts.clinicalai.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Result of the safety screening stage.
 *
 * <p>{@link #mayProceed()} and {@link #recommendReferral()} are derived from the risk level
 * and cannot be set independently.
 *
 * @param riskLevel classified risk level (never null)
 * @param flags     flagged concerns in the order they were found (never null)
 * @param rawText   backend text the assessment was derived from (empty for substitutes)
 * @param source    how the assessment was obtained
 */
public record SafetyAssessment(
        RiskLevel riskLevel,
        Set<String> flags,
        String rawText,
        Source source
) {

    /** How a safety assessment was derived. */
    public enum Source {
        /** Parsed from a structured classification returned by the backend. */
        STRUCTURED,
        /** Derived by scanning free text for risk keywords. */
        KEYWORD,
        /** Substituted because screening could not run. */
        SUBSTITUTE
    }

    public SafetyAssessment {
        Objects.requireNonNull(riskLevel, "riskLevel must not be null");
        Objects.requireNonNull(source, "source must not be null");
        flags = flags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(flags));
        rawText = rawText == null ? "" : rawText;
    }

    public static SafetyAssessment of(RiskLevel riskLevel, Collection<String> flags, String rawText,
                                      Source source) {
        return new SafetyAssessment(riskLevel, flags == null ? null : new LinkedHashSet<>(flags), rawText, source);
    }

    public boolean mayProceed() {
        return riskLevel.allowsProceeding();
    }

    public boolean recommendReferral() {
        return riskLevel.recommendsReferral();
    }

    public boolean isSubstitute() {
        return source == Source.SUBSTITUTE;
    }
}
