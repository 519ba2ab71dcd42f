package com.phillippitts.clinicalai.service.watchdog;

import com.phillippitts.clinicalai.config.properties.WatchdogProperties;
import com.phillippitts.clinicalai.testutil.EventCapturingPublisher;
import com.phillippitts.clinicalai.testutil.FakeGenerationBackend;
import com.phillippitts.clinicalai.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BackendWatchdogTest {

    private WatchdogProperties props;
    private MutableClock clock;
    private FakeGenerationBackend ollama;
    private FakeGenerationBackend claude;
    private EventCapturingPublisher publisher;
    private BackendWatchdog watchdog;

    @BeforeEach
    void setUp() {
        props = new WatchdogProperties();
        props.setWindowMinutes(10);
        props.setMaxFailuresPerWindow(3);
        props.setCooldownMinutes(5);
        clock = new MutableClock(Instant.parse("2026-03-02T08:00:00Z"));
        ollama = new FakeGenerationBackend("ollama");
        claude = FakeGenerationBackend.metered("claude");
        publisher = new EventCapturingPublisher();
        watchdog = new BackendWatchdog(List.of(ollama, claude), props, publisher, clock);
    }

    private void fail(String backend) {
        watchdog.onFailure(new BackendFailureEvent(backend, clock.instant(), "call failed", null, Map.of()));
    }

    @Test
    void startsHealthy() {
        assertThat(watchdog.states()).containsExactly(
                Map.entry("ollama", BackendWatchdog.BackendState.HEALTHY),
                Map.entry("claude", BackendWatchdog.BackendState.HEALTHY));
    }

    @Test
    void firstFailureDegrades() {
        fail("ollama");

        assertThat(watchdog.getState("ollama")).isEqualTo(BackendWatchdog.BackendState.DEGRADED);
        assertThat(watchdog.isBackendEnabled("ollama")).isTrue();
        assertThat(watchdog.getState("claude")).isEqualTo(BackendWatchdog.BackendState.HEALTHY);
    }

    @Test
    void failureBudgetDisablesUntilCooldown() {
        fail("ollama");
        fail("ollama");
        fail("ollama");

        assertThat(watchdog.getState("ollama")).isEqualTo(BackendWatchdog.BackendState.DISABLED);
        assertThat(watchdog.isBackendEnabled("ollama")).isFalse();

        clock.advance(Duration.ofMinutes(5));
        assertThat(watchdog.isBackendEnabled("ollama")).isTrue();
    }

    @Test
    void failuresOutsideWindowDoNotCount() {
        fail("ollama");
        fail("ollama");
        clock.advance(Duration.ofMinutes(11));
        fail("ollama");

        assertThat(watchdog.getState("ollama")).isEqualTo(BackendWatchdog.BackendState.DEGRADED);
    }

    @Test
    void recoveryResetsStateAndWindow() {
        fail("ollama");
        fail("ollama");
        watchdog.onRecovered(new BackendRecoveredEvent("ollama", clock.instant()));

        assertThat(watchdog.getState("ollama")).isEqualTo(BackendWatchdog.BackendState.HEALTHY);
        fail("ollama");
        fail("ollama");
        assertThat(watchdog.getState("ollama")).isEqualTo(BackendWatchdog.BackendState.DEGRADED);
    }

    @Test
    void untrackedBackendIsIgnored() {
        fail("unknown");

        assertThat(watchdog.getState("unknown")).isNull();
        assertThat(watchdog.isBackendEnabled("unknown")).isTrue();
    }

    @Test
    void recheckPublishesRecoveryForAvailableBackend() {
        fail("ollama");

        watchdog.recheckUnhealthy();

        assertThat(publisher.eventsOf(BackendRecoveredEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.backend()).isEqualTo("ollama"));
        assertThat(ollama.callCount()).isZero();
    }

    @Test
    void recheckSkipsDisabledBackendDuringCooldown() {
        fail("ollama");
        fail("ollama");
        fail("ollama");

        watchdog.recheckUnhealthy();

        assertThat(publisher.events).isEmpty();
    }

    @Test
    void recheckLeavesStillFailingBackendAlone() {
        ollama.available = false;
        fail("ollama");

        watchdog.recheckUnhealthy();

        assertThat(publisher.events).isEmpty();
        assertThat(watchdog.getState("ollama")).isEqualTo(BackendWatchdog.BackendState.DEGRADED);
    }

    @Test
    void recheckWithoutPublisherRecoversDirectly() {
        BackendWatchdog standalone = new BackendWatchdog(List.of(ollama), props, null, clock);
        standalone.onFailure(new BackendFailureEvent("ollama", clock.instant(), "x", null, null));

        standalone.recheckUnhealthy();

        assertThat(standalone.getState("ollama")).isEqualTo(BackendWatchdog.BackendState.HEALTHY);
    }
}
