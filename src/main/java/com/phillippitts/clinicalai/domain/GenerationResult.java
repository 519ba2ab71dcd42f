package com.phillippitts.clinicalai.domain;

import java.util.Objects;

/**
 * Value returned by a generation backend.
 *
 * <p>Empty text is valid; some models answer a prompt with nothing useful.
 *
 * @param text        generated text (never null)
 * @param backendName identifier of the backend that produced the text (e.g. "ollama", "claude")
 * @param model       model identifier reported by or configured for the backend
 * @param durationMs  wall-clock duration of the call in milliseconds
 * @param usage       token accounting (never null)
 */
public record GenerationResult(
        String text,
        String backendName,
        String model,
        long durationMs,
        TokenUsage usage
) {

    public GenerationResult {
        Objects.requireNonNull(text, "Generated text must not be null");
        Objects.requireNonNull(backendName, "Backend name must not be null");
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must not be negative, got: " + durationMs);
        }
        model = model == null ? "unknown" : model;
        usage = usage == null ? TokenUsage.NONE : usage;
    }

    public static GenerationResult of(String text, String backendName, long durationMs) {
        return new GenerationResult(text, backendName, null, durationMs, TokenUsage.NONE);
    }
}
