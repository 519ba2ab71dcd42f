package com.phillippitts.clinicalai.domain;

/**
 * Token accounting reported by a backend for one call.
 *
 * @param inputTokens         prompt tokens billed at the full input rate
 * @param outputTokens        generated tokens
 * @param cacheReadTokens     prompt tokens served from the provider's prompt cache
 * @param cacheCreationTokens prompt tokens written to the provider's prompt cache
 */
public record TokenUsage(
        long inputTokens,
        long outputTokens,
        long cacheReadTokens,
        long cacheCreationTokens
) {

    public static final TokenUsage NONE = new TokenUsage(0, 0, 0, 0);

    public TokenUsage {
        if (inputTokens < 0 || outputTokens < 0 || cacheReadTokens < 0 || cacheCreationTokens < 0) {
            throw new IllegalArgumentException("Token counts must not be negative");
        }
    }

    public static TokenUsage of(long inputTokens, long outputTokens) {
        return new TokenUsage(inputTokens, outputTokens, 0, 0);
    }

    public long totalTokens() {
        return inputTokens + outputTokens + cacheReadTokens + cacheCreationTokens;
    }
}
