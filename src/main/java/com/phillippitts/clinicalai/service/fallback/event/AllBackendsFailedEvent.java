package com.phillippitts.clinicalai.service.fallback.event;

import java.time.Instant;

/** Published when neither backend of a composition produced a result. */
public record AllBackendsFailedEvent(String primary, String secondary, String reason, Instant at) { }
