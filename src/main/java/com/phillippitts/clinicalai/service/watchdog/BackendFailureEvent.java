package com.phillippitts.clinicalai.service.watchdog;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a generation backend call fails (unreachable, error status, malformed body).
 *
 * <p>PII note: Do not include prompt or generated text in context. Restrict to technical diagnostics.
 */
public record BackendFailureEvent(
        String backend,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public BackendFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
