package com.phillippitts.clinicalai.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregate returned by one pipeline invocation. Never mutated after construction.
 *
 * @param pipelineId      correlation id of the run
 * @param halted          true when safety screening stopped the pipeline
 * @param haltReason      human-readable reason, present iff halted
 * @param safety          safety assessment (never null)
 * @param assessments     successful assessment texts keyed by kind
 * @param synthesis       synthesis text, or null when synthesis did not run or failed
 * @param steps           execution trace in completion order
 * @param totalDurationMs elapsed time from pipeline entry to return
 * @param timedOut        true when the caller-side timeout fired and this is a degraded result
 */
public record PipelineResult(
        String pipelineId,
        boolean halted,
        String haltReason,
        SafetyAssessment safety,
        Map<AssessmentKind, String> assessments,
        String synthesis,
        List<PipelineStep> steps,
        long totalDurationMs,
        boolean timedOut
) {

    public PipelineResult {
        Objects.requireNonNull(pipelineId, "pipelineId");
        Objects.requireNonNull(safety, "safety");
        if (halted && (haltReason == null || haltReason.isBlank())) {
            throw new IllegalArgumentException("Halted result must carry a halt reason");
        }
        if (!halted && haltReason != null) {
            throw new IllegalArgumentException("Halt reason is only allowed on halted results");
        }
        Map<AssessmentKind, String> copy = new EnumMap<>(AssessmentKind.class);
        if (assessments != null) {
            copy.putAll(assessments);
        }
        assessments = Collections.unmodifiableMap(copy);
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public Optional<String> assessment(AssessmentKind kind) {
        return Optional.ofNullable(assessments.get(kind));
    }

    public Optional<String> clinical() {
        return assessment(AssessmentKind.CLINICAL);
    }

    public Optional<String> differential() {
        return assessment(AssessmentKind.DIFFERENTIAL);
    }

    public Optional<String> letter() {
        return assessment(AssessmentKind.LETTER);
    }

    public Optional<String> synthesisText() {
        return Optional.ofNullable(synthesis);
    }

    public Optional<String> haltReasonText() {
        return Optional.ofNullable(haltReason);
    }

    /** Steps with the given name, in trace order. */
    public List<PipelineStep> stepsNamed(StepName name) {
        return steps.stream().filter(s -> s.name() == name).toList();
    }
}
