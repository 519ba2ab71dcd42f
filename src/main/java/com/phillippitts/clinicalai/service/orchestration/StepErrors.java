package com.phillippitts.clinicalai.service.orchestration;

/**
 * Formats step error summaries as {@code SimpleClassName: message}.
 */
final class StepErrors {

    private StepErrors() {}

    static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + ": " + (message == null ? "no message" : message);
    }
}
