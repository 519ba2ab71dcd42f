package com.phillippitts.clinicalai.service.watchdog;

import com.phillippitts.clinicalai.config.properties.WatchdogProperties;
import com.phillippitts.clinicalai.service.backend.BackendEventPublisher;
import com.phillippitts.clinicalai.service.backend.GenerationBackend;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Event-driven watchdog tracking backend health from real traffic.
 *
 * Detection model:
 * - Backends publish {@link BackendFailureEvent} on every failed call and
 *   {@link BackendRecoveredEvent} on the first success after a failure.
 * - The first failure marks a backend DEGRADED. Reaching the failure budget inside the sliding
 *   window marks it DISABLED until the cooldown has elapsed.
 * - A scheduled sweep rechecks non-healthy backends whose cooldown has passed and publishes a
 *   recovery event when the check succeeds.
 *
 * State is reported to health checks and logs only. Routing never consults it.
 */
public class BackendWatchdog {

    private static final Logger LOG = LogManager.getLogger(BackendWatchdog.class);

    public enum BackendState { HEALTHY, DEGRADED, DISABLED }

    private final WatchdogProperties props;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final Map<String, GenerationBackend> backendsByName = new LinkedHashMap<>();
    private final ConcurrentMap<String, Deque<Instant>> failureWindow = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, BackendState> state = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Instant> disabledUntil = new ConcurrentHashMap<>();

    public BackendWatchdog(List<GenerationBackend> backends,
                           WatchdogProperties props,
                           ApplicationEventPublisher publisher,
                           Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = publisher;
        this.clock = Objects.requireNonNull(clock, "clock");
        for (GenerationBackend backend : backends) {
            backendsByName.put(backend.getBackendName(), backend);
            state.put(backend.getBackendName(), BackendState.HEALTHY);
            failureWindow.put(backend.getBackendName(), new ArrayDeque<>());
        }
        LOG.info("Watchdog initialized for backends={}", backendsByName.keySet());
    }

    public BackendState getState(String backend) {
        return state.get(backend);
    }

    /** Snapshot of every tracked backend's state, in registration order. */
    public Map<String, BackendState> states() {
        Map<String, BackendState> snapshot = new LinkedHashMap<>();
        backendsByName.keySet().forEach(name -> snapshot.put(name, state.get(name)));
        return snapshot;
    }

    /**
     * @return false while the backend is DISABLED and its cooldown has not elapsed
     */
    public boolean isBackendEnabled(String backend) {
        if (state.get(backend) != BackendState.DISABLED) {
            return true;
        }
        Instant until = disabledUntil.get(backend);
        return until != null && !clock.instant().isBefore(until);
    }

    @EventListener
    public void onFailure(BackendFailureEvent event) {
        String backend = event.backend();
        Deque<Instant> window = failureWindow.get(backend);
        if (window == null) {
            LOG.debug("BackendFailureEvent for untracked backend: {}", backend);
            return;
        }
        int failures;
        synchronized (window) {
            pruneOld(window);
            window.addLast(event.at());
            failures = window.size();
        }
        if (failures >= props.getMaxFailuresPerWindow()) {
            disable(backend, failures);
        } else if (state.get(backend) == BackendState.HEALTHY) {
            state.put(backend, BackendState.DEGRADED);
            LOG.warn("Backend {} degraded: {}", backend, event.message());
        }
    }

    @EventListener
    public void onRecovered(BackendRecoveredEvent event) {
        String backend = event.backend();
        Deque<Instant> window = failureWindow.get(backend);
        if (window == null) {
            return;
        }
        synchronized (window) {
            window.clear();
        }
        disabledUntil.remove(backend);
        if (state.put(backend, BackendState.HEALTHY) != BackendState.HEALTHY) {
            LOG.info("Backend recovered: {}", backend);
        }
    }

    /**
     * Rechecks non-healthy backends whose cooldown has elapsed. Successful checks are turned
     * into recovery events.
     */
    @Scheduled(fixedRateString = "${clinical-ai.watchdog.recheck-interval-ms:60000}")
    public void recheckUnhealthy() {
        if (!props.isRecheckEnabled()) {
            return;
        }
        backendsByName.forEach((name, backend) -> {
            if (state.get(name) == BackendState.HEALTHY || !isBackendEnabled(name)) {
                return;
            }
            if (backend.isAvailable()) {
                BackendEventPublisher.publishRecovered(publisher, name);
                if (publisher == null) {
                    onRecovered(new BackendRecoveredEvent(name, clock.instant()));
                }
            } else {
                LOG.debug("Recheck for {} still failing", name);
            }
        });
    }

    @Scheduled(fixedRate = 300_000)
    void logHealthSummary() {
        StringBuilder sb = new StringBuilder("Watchdog states: ");
        state.forEach((name, st) -> sb.append(name).append('=').append(st).append(' '));
        LOG.info(sb.toString().trim());
    }

    private void disable(String backend, int failures) {
        Instant until = clock.instant().plus(Duration.ofMinutes(props.getCooldownMinutes()));
        BackendState previous = state.put(backend, BackendState.DISABLED);
        disabledUntil.put(backend, until);
        if (previous != BackendState.DISABLED) {
            LOG.error("Backend {} disabled after {} failures within {}m; cooldown until {}",
                    backend, failures, props.getWindowMinutes(), until);
        }
    }

    private void pruneOld(Deque<Instant> window) {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(props.getWindowMinutes()));
        while (!window.isEmpty() && window.peekFirst().isBefore(cutoff)) {
            window.removeFirst();
        }
    }
}
