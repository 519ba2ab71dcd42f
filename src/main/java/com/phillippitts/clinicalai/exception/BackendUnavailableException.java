package com.phillippitts.clinicalai.exception;

/**
 * Thrown when a generation backend cannot be reached (connection refused, DNS failure,
 * missing credentials). Distinct from {@link GenerationFailedException}, which means the
 * backend was reached but reported a failure.
 */
public class BackendUnavailableException extends ClinicalAiException {

    private final String backendName;

    public BackendUnavailableException(String message, String backendName) {
        super(message + " (backend: " + backendName + ")");
        this.backendName = backendName;
    }

    public BackendUnavailableException(String message, String backendName, Throwable cause) {
        super(message + " (backend: " + backendName + ")", cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
