package com.phillippitts.clinicalai.service.orchestration;

import com.phillippitts.clinicalai.config.properties.PipelineProperties;
import com.phillippitts.clinicalai.domain.AssessmentKind;
import com.phillippitts.clinicalai.domain.ClinicalInput;
import com.phillippitts.clinicalai.domain.GenerationResult;
import com.phillippitts.clinicalai.domain.PipelineOptions;
import com.phillippitts.clinicalai.domain.PipelineResult;
import com.phillippitts.clinicalai.domain.PipelineStep;
import com.phillippitts.clinicalai.domain.RiskLevel;
import com.phillippitts.clinicalai.domain.SafetyAssessment;
import com.phillippitts.clinicalai.domain.StepName;
import com.phillippitts.clinicalai.exception.PipelineException;
import com.phillippitts.clinicalai.service.backend.GenerationBackend;
import com.phillippitts.clinicalai.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.clinicalai.service.orchestration.event.PipelineCompletedEvent;
import com.phillippitts.clinicalai.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Default pipeline implementation over a single {@link GenerationBackend} capability.
 *
 * <p>The backend is whatever topology was configured at startup (a local backend, a metered one,
 * or a fallback composition); the orchestrator never knows which.
 *
 * <p><b>Flow:</b>
 * <ol>
 *   <li>Safety screening at low temperature. A failed call is replaced by the configured
 *       {@link SafetyFailurePolicy} substitute and recorded as an error step.</li>
 *   <li>CRITICAL risk halts the run; no assessment is dispatched.</li>
 *   <li>Enabled assessments run concurrently via {@link ParallelAssessmentService}.</li>
 *   <li>Synthesis runs when enabled and more than one assessment succeeded.</li>
 * </ol>
 *
 * <p>Each run gets a {@code pipelineId} in the Log4j2 {@link ThreadContext}; executors copy it
 * to worker threads. A {@link PipelineCompletedEvent} is published for every run.
 */
public class DefaultPipelineOrchestrator implements PipelineOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultPipelineOrchestrator.class);

    static final String MDC_PIPELINE_ID = "pipelineId";
    static final String MDC_ORGANIZATION_ID = "organizationId";
    public static final String TIMED_OUT_FLAG = "pipeline timed out";
    public static final String CAPACITY_EXHAUSTED_FLAG = "pipeline capacity exhausted";

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private final GenerationBackend backend;
    private final ClinicalPromptBuilder promptBuilder;
    private final SafetyClassifier safetyClassifier;
    private final ParallelAssessmentService assessments;
    private final PipelineProperties properties;
    private final AsyncTaskExecutor pipelineExecutor;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetricsPublisher metrics;

    public DefaultPipelineOrchestrator(GenerationBackend backend,
                                       ClinicalPromptBuilder promptBuilder,
                                       SafetyClassifier safetyClassifier,
                                       ParallelAssessmentService assessments,
                                       PipelineProperties properties,
                                       AsyncTaskExecutor pipelineExecutor,
                                       ApplicationEventPublisher publisher,
                                       PipelineMetricsPublisher metrics) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder");
        this.safetyClassifier = Objects.requireNonNull(safetyClassifier, "safetyClassifier");
        this.assessments = Objects.requireNonNull(assessments, "assessments");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.pipelineExecutor = Objects.requireNonNull(pipelineExecutor, "pipelineExecutor");
        this.publisher = publisher;
        this.metrics = metrics == null ? PipelineMetricsPublisher.NOOP : metrics;
    }

    @Override
    public PipelineResult execute(ClinicalInput input, PipelineOptions options) {
        validate(input, options);
        String pipelineId = newPipelineId();
        putContext(pipelineId, options);
        try {
            return doExecute(input, options, pipelineId, new ExecutionTrace(), NEVER_CANCELLED);
        } finally {
            clearContext();
        }
    }

    @Override
    public PipelineResult run(ClinicalInput input, PipelineOptions options, Duration timeout) {
        validate(input, options);
        Duration deadline = timeout == null || timeout.isZero() || timeout.isNegative()
                ? Duration.ofSeconds(properties.getTimeoutSeconds())
                : timeout;
        String pipelineId = newPipelineId();
        ExecutionTrace trace = new ExecutionTrace();
        AtomicBoolean cancelled = new AtomicBoolean(false);
        long t0 = System.nanoTime();

        AtomicBoolean claimed = new AtomicBoolean(false);
        CountDownLatch finished = new CountDownLatch(1);

        putContext(pipelineId, options);
        try {
            Future<PipelineResult> future;
            try {
                future = pipelineExecutor.submit(() -> {
                    if (!claimed.compareAndSet(false, true)) {
                        throw new PipelineException("Pipeline abandoned before start", pipelineId, null);
                    }
                    try {
                        return doExecute(input, options, pipelineId, trace, cancelled::get);
                    } finally {
                        finished.countDown();
                    }
                });
            } catch (RejectedExecutionException re) {
                LOG.warn("Pipeline executor saturated; returning degraded result: {}", re.getMessage());
                return publish(degradedResult(pipelineId, trace, t0, CAPACITY_EXHAUSTED_FLAG), options.organizationId());
            }
            try {
                return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException te) {
                cancelled.set(true);
                future.cancel(true);
                awaitStopped(claimed, finished);
                LOG.warn("Pipeline timed out after {} ms; returning degraded result", deadline.toMillis());
                return publish(degradedResult(pipelineId, trace, t0, TIMED_OUT_FLAG), options.organizationId());
            } catch (InterruptedException ie) {
                cancelled.set(true);
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new PipelineException("Pipeline interrupted", pipelineId, ie);
            } catch (ExecutionException ee) {
                Throwable cause = ee.getCause();
                if (cause instanceof RuntimeException re) {
                    throw re;
                }
                throw new PipelineException("Pipeline failed", pipelineId, cause);
            }
        } finally {
            clearContext();
        }
    }

    /**
     * Waits up to the configured grace period for a cancelled run to stop calling backends.
     * A run that never started is claimed here so it can no longer start.
     */
    private void awaitStopped(AtomicBoolean claimed, CountDownLatch finished) {
        if (claimed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (!finished.await(properties.getCancelGraceMs(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Cancelled pipeline still running after {} ms grace", properties.getCancelGraceMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private PipelineResult doExecute(ClinicalInput input, PipelineOptions options, String pipelineId,
                                     ExecutionTrace trace, BooleanSupplier cancelled) {
        long t0 = System.nanoTime();
        String org = options.organizationId();
        PipelineStageTracker tracker = new PipelineStageTracker();
        LOG.info("Pipeline started: assessments={}", options.enabledAssessments());

        tracker.advance(PipelineStage.SAFETY_SCREENING);
        SafetyAssessment safety = screen(input, org, trace);

        if (!safety.mayProceed()) {
            tracker.advance(PipelineStage.HALTED);
            String reason = haltReason(safety);
            LOG.warn("Pipeline halted: {}", reason);
            tracker.advance(PipelineStage.DONE);
            return complete(new PipelineResult(pipelineId, true, reason, safety, Map.of(), null,
                    trace.snapshot(), TimeUtils.elapsedMillis(t0), false), org, cancelled);
        }
        checkCancelled(cancelled, pipelineId);

        tracker.advance(PipelineStage.ASSESSING);
        Map<AssessmentKind, String> texts = assessments.runAll(options.enabledAssessments(),
                kind -> promptBuilder.assessmentRequest(kind, input, safety, org), trace);
        checkCancelled(cancelled, pipelineId);

        String synthesis = null;
        if (properties.isSynthesisEnabled() && texts.size() > 1) {
            tracker.advance(PipelineStage.SYNTHESIZING);
            synthesis = synthesize(input, texts, safety, org, trace);
        } else {
            LOG.info("Synthesis skipped (enabled={}, successfulAssessments={})",
                    properties.isSynthesisEnabled(), texts.size());
        }

        tracker.advance(PipelineStage.DONE);
        return complete(new PipelineResult(pipelineId, false, null, safety, texts, synthesis,
                trace.snapshot(), TimeUtils.elapsedMillis(t0), false), org, cancelled);
    }

    private SafetyAssessment screen(ClinicalInput input, String org, ExecutionTrace trace) {
        long t0 = System.nanoTime();
        try {
            GenerationResult result = backend.generate(promptBuilder.safetyRequest(input, org));
            SafetyAssessment safety = safetyClassifier.classify(result.text());
            record(trace, PipelineStep.completed(StepName.SAFETY, result.backendName(), TimeUtils.elapsedMillis(t0)));
            LOG.info("Safety screening: risk={}, source={}, flags={}",
                    safety.riskLevel(), safety.source(), safety.flags().size());
            return safety;
        } catch (RuntimeException e) {
            SafetyFailurePolicy policy = properties.getSafetyFailurePolicy();
            LOG.warn("Safety screening failed, applying {}: {}", policy, e.getMessage());
            record(trace, PipelineStep.failed(StepName.SAFETY, StepErrors.describe(e), TimeUtils.elapsedMillis(t0)));
            return policy.substitute();
        }
    }

    private String synthesize(ClinicalInput input, Map<AssessmentKind, String> texts, SafetyAssessment safety,
                              String org, ExecutionTrace trace) {
        long t0 = System.nanoTime();
        try {
            GenerationResult result = backend.generate(promptBuilder.synthesisRequest(input, texts, safety, org));
            record(trace, PipelineStep.completed(StepName.SYNTHESIS, result.backendName(), TimeUtils.elapsedMillis(t0)));
            return result.text();
        } catch (RuntimeException e) {
            LOG.warn("Synthesis failed: {}", e.getMessage());
            record(trace, PipelineStep.failed(StepName.SYNTHESIS, StepErrors.describe(e), TimeUtils.elapsedMillis(t0)));
            return null;
        }
    }

    private void record(ExecutionTrace trace, PipelineStep step) {
        trace.append(step);
        metrics.recordStep(step);
    }

    private PipelineResult complete(PipelineResult result, String org, BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            LOG.debug("Discarding result of cancelled run");
            return result;
        }
        LOG.info("Pipeline finished: halted={}, assessments={}, synthesis={}, durationMs={}",
                result.halted(), result.assessments().keySet(), result.synthesis() != null,
                result.totalDurationMs());
        return publish(result, org);
    }

    private PipelineResult publish(PipelineResult result, String org) {
        metrics.recordRun(result);
        if (publisher != null) {
            publisher.publishEvent(new PipelineCompletedEvent(result, org, Instant.now()));
        }
        return result;
    }

    private static PipelineResult degradedResult(String pipelineId, ExecutionTrace trace, long t0, String flag) {
        SafetyAssessment degraded = SafetyAssessment.of(RiskLevel.HIGH, List.of(flag), "",
                SafetyAssessment.Source.SUBSTITUTE);
        return new PipelineResult(pipelineId, false, null, degraded, Map.of(), null,
                trace.snapshot(), TimeUtils.elapsedMillis(t0), true);
    }

    static String haltReason(SafetyAssessment safety) {
        if (safety.flags().isEmpty()) {
            return "Critical risk identified by safety screening";
        }
        return "Critical red flags identified: " + String.join(", ", safety.flags());
    }

    private static void checkCancelled(BooleanSupplier cancelled, String pipelineId) {
        if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
            throw new PipelineException("Pipeline cancelled", pipelineId, null);
        }
    }

    private static void validate(ClinicalInput input, PipelineOptions options) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(options, "options must not be null");
        if (input.isEmpty()) {
            throw new PipelineException("Clinical input has no content", "none", null);
        }
    }

    private static String newPipelineId() {
        return UUID.randomUUID().toString();
    }

    private static void putContext(String pipelineId, PipelineOptions options) {
        ThreadContext.put(MDC_PIPELINE_ID, pipelineId);
        if (options.organizationId() != null) {
            ThreadContext.put(MDC_ORGANIZATION_ID, options.organizationId());
        }
    }

    private static void clearContext() {
        ThreadContext.remove(MDC_PIPELINE_ID);
        ThreadContext.remove(MDC_ORGANIZATION_ID);
    }
}
