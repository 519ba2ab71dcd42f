package com.phillippitts.clinicalai.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-call pipeline toggles.
 *
 * @param organizationId      tenant billed for metered calls (nullable)
 * @param includeDifferential run the differential assessment
 * @param includeLetter       run the letter assessment
 */
public record PipelineOptions(
        String organizationId,
        boolean includeDifferential,
        boolean includeLetter
) {

    public static PipelineOptions clinicalOnly(String organizationId) {
        return new PipelineOptions(organizationId, false, false);
    }

    public static PipelineOptions all(String organizationId) {
        return new PipelineOptions(organizationId, true, true);
    }

    /** Enabled assessment kinds in dispatch order; always contains {@link AssessmentKind#CLINICAL}. */
    public Set<AssessmentKind> enabledAssessments() {
        EnumSet<AssessmentKind> kinds = EnumSet.of(AssessmentKind.CLINICAL);
        if (includeDifferential) {
            kinds.add(AssessmentKind.DIFFERENTIAL);
        }
        if (includeLetter) {
            kinds.add(AssessmentKind.LETTER);
        }
        return kinds;
    }
}
