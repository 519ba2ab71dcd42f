package com.phillippitts.clinicalai.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for pipeline runs and backend calls.
 *
 * <p>Provides:
 * <ul>
 *   <li>Latency per pipeline step and backend</li>
 *   <li>Step success/failure counts</li>
 *   <li>Backend fallbacks and budget denials</li>
 *   <li>Pipeline outcomes (completed, halted, timed out)</li>
 * </ul>
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "clinicalai.pipeline";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStepLatency(String step, String backend, long durationMs) {
        Timer.builder(METRIC_PREFIX + ".step.latency")
                .description("Time taken by a pipeline step")
                .tag("step", step)
                .tag("backend", backend)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void incrementStepSuccess(String step, String backend) {
        Counter.builder(METRIC_PREFIX + ".step.success")
                .description("Number of completed pipeline steps")
                .tag("step", step)
                .tag("backend", backend)
                .register(registry)
                .increment();
    }

    public void incrementStepFailure(String step, String reason) {
        Counter.builder(METRIC_PREFIX + ".step.failure")
                .description("Number of failed pipeline steps")
                .tag("step", step)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementFallback(String from, String to) {
        Counter.builder(METRIC_PREFIX + ".fallback")
                .description("Number of calls served by the secondary backend")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void incrementBudgetDenial(String reason) {
        Counter.builder(METRIC_PREFIX + ".budget.denied")
                .description("Number of metered calls denied by admission control")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome one of "completed", "halted", "timed_out"
     */
    public void recordRun(String outcome, long durationMs) {
        Timer.builder(METRIC_PREFIX + ".run")
                .description("End-to-end pipeline duration by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }
}
