package com.phillippitts.clinicalai.service.backend;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Human/machine-readable snapshot of a backend.
 *
 * @param backendName backend identifier
 * @param available   result of the liveness check at snapshot time
 * @param metered     whether calls are billed
 * @param model       configured model identifier
 * @param lastError   summary of the most recent failure, or null
 * @param models      models installed on the backend, when it can list them
 * @param members     statuses of wrapped backends for compositions (empty for leaf backends)
 */
public record BackendStatus(
        String backendName,
        boolean available,
        boolean metered,
        String model,
        String lastError,
        List<String> models,
        List<BackendStatus> members
) {

    public BackendStatus {
        Objects.requireNonNull(backendName, "backendName");
        models = models == null ? List.of() : List.copyOf(models);
        members = members == null ? List.of() : List.copyOf(members);
    }

    public static BackendStatus leaf(String backendName, boolean available, boolean metered,
                                     String model, String lastError) {
        return new BackendStatus(backendName, available, metered, model, lastError, List.of(), List.of());
    }

    /** Flat view used by health endpoints and log lines. */
    public Map<String, Object> summary() {
        return Map.of(
                "available", available,
                "metered", metered,
                "model", model == null ? "unknown" : model,
                "lastError", lastError == null ? "none" : lastError);
    }
}
