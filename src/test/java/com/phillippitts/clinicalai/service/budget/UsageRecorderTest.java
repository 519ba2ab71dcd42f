package com.phillippitts.clinicalai.service.budget;

import com.phillippitts.clinicalai.config.properties.BudgetProperties;
import com.phillippitts.clinicalai.domain.TokenUsage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.awaitility.Awaitility.await;

class UsageRecorderTest {

    private UsageRecorder recorder;

    @AfterEach
    void tearDown() {
        if (recorder != null) {
            recorder.shutdown(Duration.ofSeconds(1));
        }
    }

    private static UsageRecord record(String org) {
        return new UsageRecord(org, "claude", "m", TokenUsage.of(10, 5), Instant.now());
    }

    @Test
    void writesOnTheCallingThread() {
        RecordingController controller = new RecordingController();
        recorder = new UsageRecorder(controller, 10);

        assertThat(recorder.submit(record("a"))).isTrue();
        assertThat(recorder.submit(record("b"))).isTrue();

        assertThat(recorder.recordedCount()).isEqualTo(2);
        assertThat(controller.records).extracting(UsageRecord::organizationId).containsExactly("a", "b");
        assertThat(controller.threads).containsOnly(Thread.currentThread().getName());
        assertThat(recorder.pendingCount()).isZero();
    }

    @Test
    void spendIsVisibleToTheNextAdmissionCheck() {
        BudgetProperties props = new BudgetProperties();
        props.setDailyCeilingUsd(0.0001);
        props.setInputPricePerMillion(1.0);
        props.setOutputPricePerMillion(0.0);
        InMemoryBudgetController controller = new InMemoryBudgetController(props,
                new CostCalculator(1.0, 0.0), Clock.systemUTC());
        recorder = new UsageRecorder(controller, 10);

        assertThat(controller.canSpend("clinic-1").allowed()).isTrue();
        recorder.submit(new UsageRecord("clinic-1", "claude", "m", TokenUsage.of(100, 0), Instant.now()));

        assertThat(controller.canSpend("clinic-1").allowed()).isFalse();
    }

    @Test
    void failedWriteIsRetriedOnceInBackground() {
        FlakyController controller = new FlakyController(1);
        recorder = new UsageRecorder(controller, 10);

        assertThat(recorder.submit(record("a"))).isTrue();

        await().atMost(Duration.ofSeconds(2)).until(() -> recorder.recordedCount() == 1);
        assertThat(controller.attempts.get()).isEqualTo(2);
        assertThat(recorder.failedCount()).isZero();
    }

    @Test
    void countsFailureAfterRetry() {
        FlakyController controller = new FlakyController(Integer.MAX_VALUE);
        recorder = new UsageRecorder(controller, 10);

        assertThatCode(() -> recorder.submit(record("a"))).doesNotThrowAnyException();

        await().atMost(Duration.ofSeconds(2)).until(() -> recorder.failedCount() == 1);
        assertThat(controller.attempts.get()).isEqualTo(2);
        assertThat(recorder.recordedCount()).isZero();
    }

    @Test
    void dropsWhenRetryQueueIsFull() throws InterruptedException {
        StalledRetryController controller = new StalledRetryController();
        recorder = new UsageRecorder(controller, 1);

        recorder.submit(record("first"));
        assertThat(controller.retryEntered.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(recorder.submit(record("queued"))).isTrue();
        boolean accepted = recorder.submit(record("overflow"));

        assertThat(accepted).isFalse();
        assertThat(recorder.droppedCount()).isEqualTo(1);
        controller.release.countDown();
        await().atMost(Duration.ofSeconds(2)).until(() -> recorder.recordedCount() == 2);
        assertThat(recorder.submittedCount()).isEqualTo(3);
    }

    @Test
    void rejectsSubmissionsAfterShutdown() {
        RecordingController controller = new RecordingController();
        recorder = new UsageRecorder(controller, 10);
        recorder.shutdown(Duration.ofSeconds(1));

        assertThat(recorder.submit(record("late"))).isFalse();
        assertThat(recorder.droppedCount()).isEqualTo(1);
        assertThat(controller.records).isEmpty();
    }

    // --- Test doubles ---

    static class RecordingController implements BudgetController {
        final List<UsageRecord> records = new CopyOnWriteArrayList<>();
        final List<String> threads = new CopyOnWriteArrayList<>();

        @Override public BudgetDecision canSpend(String organizationId) { return BudgetDecision.allow(); }
        @Override public BudgetSnapshot snapshot(String organizationId) { return null; }

        @Override
        public void recordUsage(UsageRecord record) {
            records.add(record);
            threads.add(Thread.currentThread().getName());
        }
    }

    static class FlakyController extends RecordingController {
        final AtomicInteger attempts = new AtomicInteger();
        private final int failures;

        FlakyController(int failures) {
            this.failures = failures;
        }

        @Override
        public void recordUsage(UsageRecord record) {
            if (attempts.incrementAndGet() <= failures) {
                throw new IllegalStateException("store unavailable");
            }
            super.recordUsage(record);
        }
    }

    /** Fails every inline write; retries block until released, then succeed. */
    static class StalledRetryController extends RecordingController {
        final CountDownLatch retryEntered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        @Override
        public void recordUsage(UsageRecord record) {
            if (!"usage-recorder".equals(Thread.currentThread().getName())) {
                throw new IllegalStateException("store unavailable");
            }
            retryEntered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            super.recordUsage(record);
        }
    }
}
