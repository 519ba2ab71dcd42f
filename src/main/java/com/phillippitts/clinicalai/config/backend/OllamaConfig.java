package com.phillippitts.clinicalai.config.backend;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the local Ollama backend.
 * Binds to properties prefixed with "clinical-ai.backend.ollama".
 *
 * <p>Example application.properties:
 * <pre>
 * clinical-ai.backend.ollama.base-url=http://localhost:11434
 * clinical-ai.backend.ollama.model=llama3.1:8b
 * clinical-ai.backend.ollama.connect-timeout-seconds=5
 * clinical-ai.backend.ollama.request-timeout-seconds=60
 * </pre>
 *
 * @param baseUrl Ollama server root, without trailing slash
 * @param model model tag passed in every generate call
 * @param connectTimeoutSeconds TCP connect timeout; also bounds the availability check
 * @param requestTimeoutSeconds maximum time to wait for a complete generation
 */
@ConfigurationProperties(prefix = "clinical-ai.backend.ollama")
@Validated
public record OllamaConfig(
        @DefaultValue("http://localhost:11434")
        @NotBlank(message = "Ollama base URL must not be blank")
        String baseUrl,

        @DefaultValue("llama3.1:8b")
        @NotBlank(message = "Ollama model must not be blank")
        String model,

        @DefaultValue("5")
        @Positive(message = "Connect timeout must be positive")
        int connectTimeoutSeconds,

        @DefaultValue("60")
        @Positive(message = "Request timeout must be positive")
        int requestTimeoutSeconds
) {

    public static OllamaConfig defaults() {
        return new OllamaConfig("http://localhost:11434", "llama3.1:8b", 5, 60);
    }

    /** Copy pointing at another server, used when wiring against a test endpoint. */
    public OllamaConfig withBaseUrl(String newBaseUrl) {
        return new OllamaConfig(newBaseUrl, model, connectTimeoutSeconds, requestTimeoutSeconds);
    }
}
