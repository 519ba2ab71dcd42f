package com.phillippitts.clinicalai.domain;

import java.util.Objects;

/**
 * One entry of a pipeline execution trace.
 *
 * @param name        step name
 * @param status      completed or error
 * @param backendName backend that served the step (present only when completed)
 * @param error       error message (present only when failed)
 * @param durationMs  step duration in milliseconds
 */
public record PipelineStep(
        StepName name,
        Status status,
        String backendName,
        String error,
        long durationMs
) {

    public enum Status { COMPLETED, ERROR }

    public PipelineStep {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
        if (status == Status.COMPLETED && backendName == null) {
            throw new IllegalArgumentException("Completed step must carry a backend name");
        }
        if (status == Status.ERROR && error == null) {
            throw new IllegalArgumentException("Failed step must carry an error message");
        }
    }

    public static PipelineStep completed(StepName name, String backendName, long durationMs) {
        return new PipelineStep(name, Status.COMPLETED, backendName, null, durationMs);
    }

    public static PipelineStep failed(StepName name, String error, long durationMs) {
        return new PipelineStep(name, Status.ERROR, null, error == null ? "unknown error" : error, durationMs);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
