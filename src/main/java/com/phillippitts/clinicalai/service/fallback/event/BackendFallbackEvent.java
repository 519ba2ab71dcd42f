package com.phillippitts.clinicalai.service.fallback.event;

import java.time.Instant;

/** Published when a call is routed from the primary to the secondary backend. */
public record BackendFallbackEvent(String from, String to, String reason, Instant at) { }
