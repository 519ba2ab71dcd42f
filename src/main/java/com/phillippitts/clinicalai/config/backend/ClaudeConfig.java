package com.phillippitts.clinicalai.config.backend;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the metered Claude backend.
 * Binds to properties prefixed with "clinical-ai.backend.claude".
 *
 * <p>The API key is normally supplied through the {@code ANTHROPIC_API_KEY} environment
 * variable. Without it the backend reports itself unavailable and every call fails with
 * {@code BackendUnavailableException}.
 *
 * @param baseUrl API root, without trailing slash
 * @param apiKey API key sent as {@code x-api-key}; blank disables the backend
 * @param model model identifier
 * @param apiVersion value of the {@code anthropic-version} header
 * @param connectTimeoutSeconds TCP connect timeout
 * @param requestTimeoutSeconds maximum time to wait for a complete response
 * @param promptCachingEnabled mark long static system prompt blocks as cacheable
 */
@ConfigurationProperties(prefix = "clinical-ai.backend.claude")
@Validated
public record ClaudeConfig(
        @DefaultValue("https://api.anthropic.com")
        @NotBlank(message = "Claude base URL must not be blank")
        String baseUrl,

        String apiKey,

        @DefaultValue("claude-sonnet-4-20250514")
        @NotBlank(message = "Claude model must not be blank")
        String model,

        @DefaultValue("2023-06-01")
        @NotBlank(message = "Claude API version must not be blank")
        String apiVersion,

        @DefaultValue("10")
        @Positive(message = "Connect timeout must be positive")
        int connectTimeoutSeconds,

        @DefaultValue("60")
        @Positive(message = "Request timeout must be positive")
        int requestTimeoutSeconds,

        @DefaultValue("true")
        boolean promptCachingEnabled
) {

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public static ClaudeConfig of(String baseUrl, String apiKey) {
        return new ClaudeConfig(baseUrl, apiKey, "claude-sonnet-4-20250514", "2023-06-01", 10, 60, true);
    }
}
