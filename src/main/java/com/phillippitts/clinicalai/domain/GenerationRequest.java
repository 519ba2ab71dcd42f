package com.phillippitts.clinicalai.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable request handed to a {@code GenerationBackend}.
 *
 * @param prompt       user prompt text (must not be blank)
 * @param systemPrompt optional system/instruction text (nullable)
 * @param options      generation options (never null)
 */
public record GenerationRequest(
        String prompt,
        String systemPrompt,
        GenerationOptions options
) {

    /**
     * @throws IllegalArgumentException if prompt is null or blank
     * @throws NullPointerException if options is null
     */
    public GenerationRequest {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt must not be null or blank");
        }
        Objects.requireNonNull(options, "options must not be null");
    }

    public static GenerationRequest of(String prompt) {
        return new GenerationRequest(prompt, null, GenerationOptions.defaults());
    }

    public static GenerationRequest of(String prompt, String systemPrompt, GenerationOptions options) {
        return new GenerationRequest(prompt, systemPrompt, options);
    }

    public Optional<String> system() {
        return systemPrompt == null || systemPrompt.isBlank() ? Optional.empty() : Optional.of(systemPrompt);
    }

    /** Tenant identifier from the options, if any. */
    public String organizationId() {
        return options.organizationId();
    }
}
