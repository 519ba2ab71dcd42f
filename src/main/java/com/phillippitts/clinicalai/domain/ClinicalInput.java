package com.phillippitts.clinicalai.domain;

/**
 * Structured SOAP input supplied by the clinical record layer.
 *
 * <p>The pipeline does not validate clinical content; it only formats prompts from it.
 * Null sections are treated as empty.
 */
public record ClinicalInput(
        String subjective,
        String objective,
        String assessment,
        String plan,
        PatientContext patient
) {

    public ClinicalInput {
        subjective = subjective == null ? "" : subjective;
        objective = objective == null ? "" : objective;
        assessment = assessment == null ? "" : assessment;
        plan = plan == null ? "" : plan;
        patient = patient == null ? PatientContext.UNKNOWN : patient;
    }

    public boolean isEmpty() {
        return subjective.isBlank() && objective.isBlank() && assessment.isBlank() && plan.isBlank();
    }
}
