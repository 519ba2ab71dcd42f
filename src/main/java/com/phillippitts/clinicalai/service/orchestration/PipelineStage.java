package com.phillippitts.clinicalai.service.orchestration;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one pipeline run.
 *
 * <pre>
 * NOT_STARTED → SAFETY_SCREENING → HALTED → DONE
 *                                → ASSESSING → SYNTHESIZING → DONE
 *                                            → DONE
 * </pre>
 */
public enum PipelineStage {
    NOT_STARTED,
    SAFETY_SCREENING,
    HALTED,
    ASSESSING,
    SYNTHESIZING,
    DONE;

    public Set<PipelineStage> successors() {
        return switch (this) {
            case NOT_STARTED -> EnumSet.of(SAFETY_SCREENING);
            case SAFETY_SCREENING -> EnumSet.of(HALTED, ASSESSING);
            case HALTED, SYNTHESIZING -> EnumSet.of(DONE);
            case ASSESSING -> EnumSet.of(SYNTHESIZING, DONE);
            case DONE -> EnumSet.noneOf(PipelineStage.class);
        };
    }

    public boolean canTransitionTo(PipelineStage next) {
        return successors().contains(next);
    }
}
