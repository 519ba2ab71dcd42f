package com.phillippitts.clinicalai.service.orchestration;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe guard over {@link PipelineStage} transitions for a single run.
 *
 * <p>Illegal transitions throw {@link IllegalStateException}; the stage is unchanged.
 */
public final class PipelineStageTracker {

    private final Lock lock = new ReentrantLock();
    private final List<PipelineStage> history = new ArrayList<>();
    private PipelineStage current = PipelineStage.NOT_STARTED;

    public PipelineStageTracker() {
        history.add(PipelineStage.NOT_STARTED);
    }

    /**
     * Moves to {@code next}.
     *
     * @throws IllegalStateException if {@code next} is not a successor of the current stage
     */
    public void advance(PipelineStage next) {
        Objects.requireNonNull(next, "next");
        lock.lock();
        try {
            if (!current.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal pipeline transition " + current + " -> " + next);
            }
            current = next;
            history.add(next);
        } finally {
            lock.unlock();
        }
    }

    public PipelineStage current() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }

    /** Stages visited so far, in order, starting with NOT_STARTED. */
    public List<PipelineStage> history() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }
}
