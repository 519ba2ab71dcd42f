package com.phillippitts.clinicalai.service.orchestration;

import com.phillippitts.clinicalai.domain.PipelineStep;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only, thread-safe step log of one run. Steps are kept in completion order.
 */
public final class ExecutionTrace {

    private final List<PipelineStep> steps = new ArrayList<>();

    public void append(PipelineStep step) {
        Objects.requireNonNull(step, "step");
        synchronized (steps) {
            steps.add(step);
        }
    }

    public List<PipelineStep> snapshot() {
        synchronized (steps) {
            return List.copyOf(steps);
        }
    }

    public int size() {
        synchronized (steps) {
            return steps.size();
        }
    }
}
