package com.phillippitts.clinicalai.exception;

/**
 * Base exception for all pipeline-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class ClinicalAiException extends RuntimeException {

    public ClinicalAiException(String message) {
        super(message);
    }

    public ClinicalAiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ClinicalAiException(Throwable cause) {
        super(cause);
    }
}
