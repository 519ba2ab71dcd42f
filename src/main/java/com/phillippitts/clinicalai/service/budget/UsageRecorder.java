package com.phillippitts.clinicalai.service.budget;

import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accounting boundary for metered usage.
 *
 * <p>{@link #submit(UsageRecord)} writes the record to the {@link BudgetController} on the
 * calling thread, so the next {@code canSpend} already sees the spend. A write that throws is
 * handed to a bounded retry queue drained by a single daemon worker, which tries it once more
 * and then counts it as failed. A full retry queue drops the record with a WARN log.
 * Nothing thrown by the controller ever reaches the caller.
 *
 * <p>Counters are exposed for metrics and tests. {@code submitted = recorded + dropped +
 * failed + pending} holds at quiescence.
 */
public class UsageRecorder {

    private static final Logger LOG = LogManager.getLogger(UsageRecorder.class);
    private static final long POLL_MILLIS = 200;

    private final BudgetController budgetController;
    private final BlockingQueue<UsageRecord> retryQueue;
    private final Thread worker;
    private volatile boolean running = true;

    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong recorded = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public UsageRecorder(BudgetController budgetController, int capacity) {
        this.budgetController = Objects.requireNonNull(budgetController, "budgetController");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.retryQueue = new ArrayBlockingQueue<>(capacity);
        this.worker = new Thread(this::drainLoop, "usage-recorder");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    /**
     * Records usage now, or queues it for one retry when the write fails.
     *
     * @return false when the record was dropped (recorder stopped or retry queue full)
     */
    public boolean submit(UsageRecord record) {
        Objects.requireNonNull(record, "record");
        submitted.incrementAndGet();
        if (!running) {
            return drop(record, "recorder stopped");
        }
        try {
            budgetController.recordUsage(record);
            recorded.incrementAndGet();
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Usage write failed for backend {}, queued for retry: {}", record.backendName(), e.getMessage());
        }
        if (!retryQueue.offer(record)) {
            return drop(record, "retry queue full");
        }
        return true;
    }

    private boolean drop(UsageRecord record, String reason) {
        dropped.incrementAndGet();
        LOG.warn("Usage record dropped for backend {} ({}, capacity={})",
                record.backendName(), reason, retryQueue.size() + retryQueue.remainingCapacity());
        return false;
    }

    private void drainLoop() {
        while (running || !retryQueue.isEmpty()) {
            try {
                UsageRecord record = retryQueue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (record != null) {
                    retry(record);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private void retry(UsageRecord record) {
        try {
            budgetController.recordUsage(record);
            recorded.incrementAndGet();
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            LOG.error("Usage write failed after retry for backend {}: {}", record.backendName(), e.getMessage(), e);
        }
    }

    /**
     * Stops accepting records and drains the retry queue, waiting at most {@code timeout}.
     * Records still queued after the timeout are retried on the calling thread.
     */
    public void shutdown(Duration timeout) {
        running = false;
        try {
            worker.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (worker.isAlive()) {
            worker.interrupt();
        }
        List<UsageRecord> leftovers = new ArrayList<>();
        retryQueue.drainTo(leftovers);
        leftovers.forEach(this::retry);
        LOG.info("Usage recorder stopped: submitted={}, recorded={}, dropped={}, failed={}",
                submitted.get(), recorded.get(), dropped.get(), failed.get());
    }

    @PreDestroy
    public void close() {
        shutdown(Duration.ofSeconds(5));
    }

    public long submittedCount() {
        return submitted.get();
    }

    public long recordedCount() {
        return recorded.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    public long failedCount() {
        return failed.get();
    }

    public int pendingCount() {
        return retryQueue.size();
    }
}
