package com.phillippitts.clinicalai.service.watchdog;

import java.time.Instant;

/**
 * Published when a backend that previously failed completes a call successfully.
 */
public record BackendRecoveredEvent(String backend, Instant at) {
    public BackendRecoveredEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
