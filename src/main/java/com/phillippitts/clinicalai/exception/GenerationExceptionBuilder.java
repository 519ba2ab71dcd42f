package com.phillippitts.clinicalai.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for backend failures with consistent contextual detail.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw GenerationExceptionBuilder.create("Backend returned error status")
 *         .backend("claude")
 *         .statusCode(429)
 *         .durationMs(812)
 *         .metadata("model", model)
 *         .build();
 *
 * throw GenerationExceptionBuilder.create("Connection refused")
 *         .backend("ollama")
 *         .cause(ioException)
 *         .buildUnavailable();
 * </pre>
 *
 * <p>The final message format is
 * {@code {message} (statusCode={code}, durationMs={ms}, {key1}={val1}, ...)}.
 */
public final class GenerationExceptionBuilder {

    private final String message;
    private String backendName;
    private Throwable cause;
    private Integer statusCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private GenerationExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * @param message base error message (must not be null or empty)
     */
    public static GenerationExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new GenerationExceptionBuilder(message);
    }

    public GenerationExceptionBuilder backend(String backendName) {
        this.backendName = backendName;
        return this;
    }

    public GenerationExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /** HTTP status returned by the backend, when there was one. */
    public GenerationExceptionBuilder statusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    public GenerationExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata pair to the message. Null keys or values are ignored.
     * Never pass prompt or generated text here.
     */
    public GenerationExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public GenerationFailedException build() {
        String detailedMessage = buildDetailedMessage();
        String backend = backendName != null ? backendName : "unknown";
        if (cause != null) {
            return new GenerationFailedException(detailedMessage, backend, cause);
        }
        return new GenerationFailedException(detailedMessage, backend);
    }

    public BackendUnavailableException buildUnavailable() {
        String detailedMessage = buildDetailedMessage();
        String backend = backendName != null ? backendName : "unknown";
        if (cause != null) {
            return new BackendUnavailableException(detailedMessage, backend, cause);
        }
        return new BackendUnavailableException(detailedMessage, backend);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = statusCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (statusCode != null) {
            sb.append("statusCode=").append(statusCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        return sb.append(")").toString();
    }
}
