package com.phillippitts.clinicalai.service.backend;

import com.phillippitts.clinicalai.service.watchdog.BackendFailureEvent;
import com.phillippitts.clinicalai.service.watchdog.BackendRecoveredEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

/**
 * Null-tolerant helpers for publishing backend failure and recovery events.
 *
 * <p>A null publisher is ignored so backends can be constructed in tests without a
 * Spring context.
 */
public final class BackendEventPublisher {

    private BackendEventPublisher() {
        // Utility class - prevent instantiation
    }

    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String backendName,
                                      String message,
                                      Throwable cause,
                                      Map<String, String> context) {
        if (publisher != null) {
            publisher.publishEvent(new BackendFailureEvent(backendName, Instant.now(), message, cause, context));
        }
    }

    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String backendName,
                                      String message,
                                      Throwable cause) {
        publishFailure(publisher, backendName, message, cause, null);
    }

    public static void publishRecovered(ApplicationEventPublisher publisher, String backendName) {
        if (publisher != null) {
            publisher.publishEvent(new BackendRecoveredEvent(backendName, Instant.now()));
        }
    }
}
