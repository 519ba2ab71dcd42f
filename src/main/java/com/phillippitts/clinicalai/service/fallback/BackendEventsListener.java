package com.phillippitts.clinicalai.service.fallback;

import com.phillippitts.clinicalai.service.fallback.event.AllBackendsFailedEvent;
import com.phillippitts.clinicalai.service.fallback.event.BackendFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Logs backend fallback events succinctly (no prompt text). */
@Component
class BackendEventsListener {
    private static final Logger LOG = LogManager.getLogger(BackendEventsListener.class);

    @EventListener
    void onFallback(BackendFallbackEvent e) {
        LOG.warn("Backend fallback: {} -> {}, reason={}", e.from(), e.to(), e.reason());
    }

    @EventListener
    void onAllFailed(AllBackendsFailedEvent e) {
        LOG.error("All backends failed: primary={}, secondary={}, reason={}", e.primary(), e.secondary(), e.reason());
    }
}
