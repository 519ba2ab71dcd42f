package com.phillippitts.clinicalai.service.orchestration;

import com.phillippitts.clinicalai.domain.AssessmentKind;
import com.phillippitts.clinicalai.domain.ClinicalInput;
import com.phillippitts.clinicalai.domain.GenerationOptions;
import com.phillippitts.clinicalai.domain.GenerationRequest;
import com.phillippitts.clinicalai.domain.SafetyAssessment;

import java.util.Map;

/**
 * Formats the generation requests of each pipeline step from the clinical input.
 */
public class ClinicalPromptBuilder {

    public static final String SAFETY_TASK_TYPE = "red_flags";
    public static final String SYNTHESIS_TASK_TYPE = "synthesis";
    static final double SAFETY_TEMPERATURE = 0.2;
    static final int SAFETY_MAX_TOKENS = 400;
    static final double SYNTHESIS_TEMPERATURE = 0.4;
    static final int SYNTHESIS_MAX_TOKENS = 800;

    public GenerationRequest safetyRequest(ClinicalInput input, String organizationId) {
        String prompt = soap(input)
                + "\nScreen the findings above for red flags. Start your answer with a JSON object "
                + "{\"riskLevel\": \"LOW|MODERATE|HIGH|CRITICAL\", \"flags\": [\"...\"]}, then justify it briefly.";
        return GenerationRequest.of(prompt,
                "You screen clinical findings for red flags before any treatment planning.",
                new GenerationOptions(SAFETY_TASK_TYPE, SAFETY_MAX_TOKENS, SAFETY_TEMPERATURE, organizationId));
    }

    public GenerationRequest assessmentRequest(AssessmentKind kind, ClinicalInput input,
                                               SafetyAssessment safety, String organizationId) {
        String instruction = switch (kind) {
            case CLINICAL -> "Write a concise clinical summary of the findings for the patient record.";
            case DIFFERENTIAL -> "List the differential diagnoses in order of likelihood with supporting findings.";
            case LETTER -> "Draft a referral letter to the patient's physician describing findings and assessment.";
        };
        String prompt = soap(input) + "\n\n" + safetyContext(safety) + "\n\n" + instruction;
        return GenerationRequest.of(prompt, null, kind.options(organizationId));
    }

    public GenerationRequest synthesisRequest(ClinicalInput input, Map<AssessmentKind, String> assessments,
                                              SafetyAssessment safety, String organizationId) {
        StringBuilder prompt = new StringBuilder(soap(input)).append("\n\n").append(safetyContext(safety));
        assessments.forEach((kind, text) -> prompt.append("\n\n### ")
                .append(kind.stepName().label())
                .append('\n')
                .append(text));
        prompt.append("\n\nCombine the analyses above into one coherent clinical picture.");
        return GenerationRequest.of(prompt.toString(), null,
                new GenerationOptions(SYNTHESIS_TASK_TYPE, SYNTHESIS_MAX_TOKENS, SYNTHESIS_TEMPERATURE, organizationId));
    }

    String soap(ClinicalInput input) {
        return "Patient: " + input.patient().nameLabel() + ", age " + input.patient().ageLabel()
                + "\nSubjective: " + orNone(input.subjective())
                + "\nObjective: " + orNone(input.objective())
                + "\nAssessment: " + orNone(input.assessment())
                + "\nPlan: " + orNone(input.plan());
    }

    private static String safetyContext(SafetyAssessment safety) {
        String flags = safety.flags().isEmpty() ? "none" : String.join(", ", safety.flags());
        return "Safety screening: risk " + safety.riskLevel() + "; flags: " + flags;
    }

    private static String orNone(String section) {
        return section.isBlank() ? "(none)" : section.trim();
    }
}
