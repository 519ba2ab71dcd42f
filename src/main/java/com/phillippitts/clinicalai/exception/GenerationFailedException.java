package com.phillippitts.clinicalai.exception;

/**
 * Thrown when a backend reports a failure: rate limit, non-2xx status, malformed
 * response body or request timeout.
 */
public class GenerationFailedException extends ClinicalAiException {

    private final String backendName;

    public GenerationFailedException(String message) {
        super(message);
        this.backendName = "unknown";
    }

    public GenerationFailedException(String message, String backendName) {
        super(message + " (backend: " + backendName + ")");
        this.backendName = backendName;
    }

    public GenerationFailedException(String message, Throwable cause) {
        super(message, cause);
        this.backendName = "unknown";
    }

    public GenerationFailedException(String message, String backendName, Throwable cause) {
        super(message + " (backend: " + backendName + ")", cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
