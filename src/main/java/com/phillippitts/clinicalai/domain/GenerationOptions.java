package com.phillippitts.clinicalai.domain;

/**
 * Per-call knobs passed to a generation backend.
 *
 * @param taskType       task-type tag used for prompt-cache lookup and logging (e.g. "red_flags")
 * @param maxTokens      maximum output size in tokens; must be positive
 * @param temperature    creativity knob between 0.0 and 1.0
 * @param organizationId tenant the call is billed to (nullable for unmetered use)
 */
public record GenerationOptions(
        String taskType,
        int maxTokens,
        double temperature,
        String organizationId
) {

    public static final int DEFAULT_MAX_TOKENS = 500;
    public static final double DEFAULT_TEMPERATURE = 0.7;

    /**
     * @throws IllegalArgumentException if maxTokens is not positive or temperature is out of range
     */
    public GenerationOptions {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got: " + maxTokens);
        }
        if (temperature < 0.0 || temperature > 1.0) {
            throw new IllegalArgumentException(
                    "Temperature must be between 0.0 and 1.0, got: " + temperature);
        }
        taskType = taskType == null || taskType.isBlank() ? "general" : taskType;
    }

    public static GenerationOptions defaults() {
        return new GenerationOptions("general", DEFAULT_MAX_TOKENS, DEFAULT_TEMPERATURE, null);
    }

    public GenerationOptions withOrganization(String organizationId) {
        return new GenerationOptions(taskType, maxTokens, temperature, organizationId);
    }
}
