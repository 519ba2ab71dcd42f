package com.phillippitts.clinicalai.service.health;

import com.phillippitts.clinicalai.service.backend.BackendStatus;
import com.phillippitts.clinicalai.service.backend.GenerationBackend;
import com.phillippitts.clinicalai.service.watchdog.BackendWatchdog;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator over the configured generation backends.
 *
 * <ul>
 *   <li>UP: every backend available and enabled by the watchdog</li>
 *   <li>DEGRADED: at least one backend ready</li>
 *   <li>DOWN: no backend ready</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
public class GenerationBackendHealthIndicator implements HealthIndicator {

    private final GenerationBackend pipelineBackend;
    private final BackendWatchdog watchdog;

    /**
     * @param pipelineBackend the backend composition used by the pipeline
     * @param watchdog        watchdog state (nullable when the watchdog is disabled)
     */
    public GenerationBackendHealthIndicator(GenerationBackend pipelineBackend, BackendWatchdog watchdog) {
        this.pipelineBackend = pipelineBackend;
        this.watchdog = watchdog;
    }

    @Override
    public Health health() {
        BackendStatus composite = pipelineBackend.getStatus();
        List<BackendStatus> members = composite.members().isEmpty() ? List.of(composite) : composite.members();

        int ready = 0;
        Map<String, Object> details = new LinkedHashMap<>();
        for (BackendStatus member : members) {
            boolean enabled = watchdog == null || watchdog.isBackendEnabled(member.backendName());
            if (enabled && member.available()) {
                ready++;
            }
            details.put(member.backendName(), describe(member, enabled));
        }

        Health.Builder builder;
        if (ready == members.size()) {
            builder = Health.up().withDetail("status", "All backends operational");
        } else if (ready > 0) {
            builder = Health.status("DEGRADED").withDetail("status", "Partial backend availability");
        } else {
            builder = Health.down().withDetail("status", "No backends available");
        }
        return builder.withDetail("topology", composite.backendName()).withDetails(details).build();
    }

    private Map<String, Object> describe(BackendStatus status, boolean enabled) {
        Map<String, Object> detail = new LinkedHashMap<>(status.summary());
        detail.put("state", !enabled ? "disabled" : status.available() ? "ready" : "unavailable");
        if (watchdog != null && watchdog.getState(status.backendName()) != null) {
            detail.put("watchdog", watchdog.getState(status.backendName()).name());
        }
        if (!status.models().isEmpty()) {
            detail.put("models", status.models());
        }
        return detail;
    }
}
