package com.phillippitts.clinicalai.service.metrics;

import com.phillippitts.clinicalai.domain.PipelineResult;
import com.phillippitts.clinicalai.domain.PipelineStep;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link PipelineMetrics} used by the fallback wrapper and the orchestrator.
 *
 * <p>{@link #NOOP} lets both run without a meter registry in tests.
 */
@Component
public final class PipelineMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(PipelineMetricsPublisher.class);

    public static final PipelineMetricsPublisher NOOP = new PipelineMetricsPublisher(null);

    private final PipelineMetrics metrics;

    public PipelineMetricsPublisher(PipelineMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("PipelineMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordStep(PipelineStep step) {
        if (metrics == null) {
            return;
        }
        if (step.isCompleted()) {
            metrics.recordStepLatency(step.name().label(), step.backendName(), step.durationMs());
            metrics.incrementStepSuccess(step.name().label(), step.backendName());
        } else {
            metrics.incrementStepFailure(step.name().label(), categorize(step.error()));
        }
    }

    public void recordRun(PipelineResult result) {
        if (metrics == null) {
            return;
        }
        String outcome = result.timedOut() ? "timed_out" : result.halted() ? "halted" : "completed";
        metrics.recordRun(outcome, result.totalDurationMs());
    }

    public void recordFallback(String from, String to) {
        if (metrics != null) {
            metrics.incrementFallback(from, to);
        }
    }

    public void recordBudgetDenial(String reason) {
        if (metrics != null) {
            metrics.incrementBudgetDenial(reason);
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }

    /** Low-cardinality tag derived from an error summary of the form "Type: message". */
    static String categorize(String error) {
        if (error == null || error.isBlank()) {
            return "unknown";
        }
        int colon = error.indexOf(':');
        return colon > 0 ? error.substring(0, colon) : "error";
    }
}
