package com.phillippitts.clinicalai.service.orchestration;

import com.phillippitts.clinicalai.domain.AssessmentKind;
import com.phillippitts.clinicalai.domain.GenerationRequest;
import com.phillippitts.clinicalai.domain.GenerationResult;
import com.phillippitts.clinicalai.domain.PipelineStep;
import com.phillippitts.clinicalai.service.backend.GenerationBackend;
import com.phillippitts.clinicalai.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.clinicalai.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Runs the independent assessments of one pipeline run concurrently.
 *
 * <p>Every kind is dispatched once on the bounded executor and the call joins on all of them
 * settling. A failure is recorded as an error step and never cancels its siblings. Steps are
 * appended to the trace as each task completes.
 *
 * <p><b>Thread Model:</b> blocks the calling thread until every task has finished. If the
 * caller is interrupted while waiting, running tasks are interrupted, queued ones are dropped,
 * and the call still waits for the interrupted ones to return before restoring the interrupt
 * flag. No backend call outlives {@code runAll}.
 */
public class ParallelAssessmentService {

    private static final Logger LOG = LogManager.getLogger(ParallelAssessmentService.class);

    private final GenerationBackend backend;
    private final Executor executor;
    private final PipelineMetricsPublisher metrics;

    public ParallelAssessmentService(GenerationBackend backend, Executor executor, PipelineMetricsPublisher metrics) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = metrics == null ? PipelineMetricsPublisher.NOOP : metrics;
    }

    /**
     * @param kinds          assessments to run
     * @param requestFactory builds the request for each kind
     * @param trace          receives one step per kind
     * @return texts of the assessments that succeeded
     */
    public Map<AssessmentKind, String> runAll(Set<AssessmentKind> kinds,
                                              Function<AssessmentKind, GenerationRequest> requestFactory,
                                              ExecutionTrace trace) {
        Map<AssessmentKind, AssessmentTask> tasks = new LinkedHashMap<>();
        for (AssessmentKind kind : kinds) {
            AssessmentTask task = new AssessmentTask(() -> runOne(kind, requestFactory, trace));
            tasks.put(kind, task);
            executor.execute(task);
        }

        try {
            for (AssessmentTask task : tasks.values()) {
                task.future.get();
            }
        } catch (InterruptedException ie) {
            LOG.warn("Assessment join interrupted; cancelling {} tasks", tasks.size());
            tasks.values().forEach(AssessmentTask::cancel);
            tasks.values().forEach(AssessmentTask::awaitFinished);
            Thread.currentThread().interrupt();
        } catch (ExecutionException ee) {
            LOG.warn("Assessment task failed unexpectedly", ee);
            tasks.values().forEach(AssessmentTask::awaitFinished);
        }

        Map<AssessmentKind, String> texts = new EnumMap<>(AssessmentKind.class);
        tasks.forEach((kind, task) -> {
            String text = getResultSilently(task.future);
            if (text != null) {
                texts.put(kind, text);
            }
        });
        return texts;
    }

    private String runOne(AssessmentKind kind, Function<AssessmentKind, GenerationRequest> requestFactory,
                          ExecutionTrace trace) {
        long t0 = System.nanoTime();
        try {
            GenerationResult result = backend.generate(requestFactory.apply(kind));
            PipelineStep step = PipelineStep.completed(kind.stepName(), result.backendName(), TimeUtils.elapsedMillis(t0));
            trace.append(step);
            metrics.recordStep(step);
            return result.text();
        } catch (RuntimeException e) {
            LOG.warn("Assessment {} failed: {}", kind.stepName(), e.getMessage());
            PipelineStep step = PipelineStep.failed(kind.stepName(), StepErrors.describe(e), TimeUtils.elapsedMillis(t0));
            trace.append(step);
            metrics.recordStep(step);
            return null;
        }
    }

    private static String getResultSilently(FutureTask<String> f) {
        if (!f.isDone() || f.isCancelled()) {
            return null;
        }
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException e) {
            return null;
        }
    }

    /**
     * One assessment submitted to the executor. Cancelling interrupts it while it runs; a task
     * cancelled before a worker picked it up never runs. {@link #awaitFinished()} returns once
     * the task can no longer call the backend.
     */
    private static final class AssessmentTask implements Runnable {

        private final FutureTask<String> future;
        private final AtomicBoolean claimed = new AtomicBoolean(false);
        private final CountDownLatch finished = new CountDownLatch(1);

        private AssessmentTask(Callable<String> work) {
            this.future = new FutureTask<>(work);
        }

        @Override
        public void run() {
            if (!claimed.compareAndSet(false, true)) {
                return;
            }
            try {
                future.run();
            } finally {
                finished.countDown();
            }
        }

        private void cancel() {
            boolean neverStarted = claimed.compareAndSet(false, true);
            future.cancel(true);
            if (neverStarted) {
                finished.countDown();
            }
        }

        private void awaitFinished() {
            boolean interrupted = Thread.interrupted();
            while (true) {
                try {
                    finished.await();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
