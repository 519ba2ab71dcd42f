package com.phillippitts.clinicalai.domain;

/**
 * Independent assessments that run in parallel after safety screening.
 * {@link #CLINICAL} always runs; the others are per-call toggles.
 */
public enum AssessmentKind {
    CLINICAL(StepName.CLINICAL, "clinical_summary", 600, 0.5),
    DIFFERENTIAL(StepName.DIFFERENTIAL, "differential_diagnosis", 600, 0.4),
    LETTER(StepName.LETTER, "letter", 800, 0.6);

    private final StepName stepName;
    private final String taskType;
    private final int maxTokens;
    private final double temperature;

    AssessmentKind(StepName stepName, String taskType, int maxTokens, double temperature) {
        this.stepName = stepName;
        this.taskType = taskType;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
    }

    public StepName stepName() {
        return stepName;
    }

    public String taskType() {
        return taskType;
    }

    public GenerationOptions options(String organizationId) {
        return new GenerationOptions(taskType, maxTokens, temperature, organizationId);
    }
}
