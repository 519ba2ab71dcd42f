package com.phillippitts.clinicalai.domain;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineResultTest {

    private static final SafetyAssessment LOW =
            SafetyAssessment.of(RiskLevel.LOW, List.of(), "", SafetyAssessment.Source.STRUCTURED);

    @Test
    void haltReasonRequiredIffHalted() {
        assertThatThrownBy(() -> new PipelineResult("p", true, null, LOW, Map.of(), null, List.of(), 0, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PipelineResult("p", false, "why", LOW, Map.of(), null, List.of(), 0, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void assessmentsAreCopiedAndReadOnly() {
        Map<AssessmentKind, String> source = new HashMap<>();
        source.put(AssessmentKind.CLINICAL, "summary");
        PipelineResult result = new PipelineResult("p", false, null, LOW, source, null, null, 5, false);
        source.put(AssessmentKind.LETTER, "late");

        assertThat(result.clinical()).contains("summary");
        assertThat(result.letter()).isEmpty();
        assertThat(result.steps()).isEmpty();
        assertThatThrownBy(() -> result.assessments().put(AssessmentKind.DIFFERENTIAL, "x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void stepsNamedFiltersTrace() {
        List<PipelineStep> steps = List.of(
                PipelineStep.completed(StepName.SAFETY, "ollama", 10),
                PipelineStep.failed(StepName.LETTER, "GenerationFailedException: boom", 4),
                PipelineStep.completed(StepName.CLINICAL, "ollama", 20));
        PipelineResult result = new PipelineResult("p", false, null, LOW, Map.of(), null, steps, 40, false);

        assertThat(result.stepsNamed(StepName.LETTER)).singleElement()
                .satisfies(s -> assertThat(s.isCompleted()).isFalse());
    }

    @Test
    void stepInvariantsAreEnforced() {
        assertThatThrownBy(() -> new PipelineStep(StepName.SAFETY, PipelineStep.Status.COMPLETED, null, null, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(PipelineStep.failed(StepName.SAFETY, null, 1).error()).isEqualTo("unknown error");
    }

    @Test
    void clinicalAssessmentAlwaysEnabled() {
        assertThat(PipelineOptions.clinicalOnly("o").enabledAssessments()).containsExactly(AssessmentKind.CLINICAL);
        assertThat(PipelineOptions.all("o").enabledAssessments())
                .containsExactly(AssessmentKind.CLINICAL, AssessmentKind.DIFFERENTIAL, AssessmentKind.LETTER);
    }

    @Test
    void inputEmptinessIgnoresPatient() {
        assertThat(new ClinicalInput(null, " ", "", null, new PatientContext(40, "Kari")).isEmpty()).isTrue();
        assertThat(new ClinicalInput("back pain", null, null, null, null).patient())
                .isEqualTo(PatientContext.UNKNOWN);
    }
}
