package com.phillippitts.erasemark.service.events;

import com.phillippitts.erasemark.service.backend.BackendNames;
import com.phillippitts.erasemark.service.backend.event.AllBackendsExhaustedEvent;
import com.phillippitts.erasemark.service.backend.event.BackendFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing summary of backend degradation. Throttled to avoid log spam when a
 * backend is persistently unavailable.
 */
@Component
class BackendEventsListener {
    private static final Logger LOG = LogManager.getLogger(BackendEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onFallback(BackendFallbackEvent e) {
        String key = "fallback-" + e.backend() + '-' + e.outcome();
        if (shouldLog(key)) {
            LOG.warn("Backend {} {}: {}. {}", e.backend(), e.outcome().toLowerCase(), e.reason(), hint(e));
        }
    }

    @EventListener
    void onExhausted(AllBackendsExhaustedEvent e) {
        if (shouldLog("exhausted")) {
            LOG.error("All inpainting backends failed ({} attempts): {}", e.attempts().size(), e.attempts());
        }
    }

    private static String hint(BackendFallbackEvent e) {
        return switch (e.backend()) {
            case BackendNames.LOCAL -> "Check inpaint.local.model-path.";
            case BackendNames.CLOUD -> "Check inpaint.cloud.api-token and inpaint.chain.mode.";
            default -> "";
        };
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
