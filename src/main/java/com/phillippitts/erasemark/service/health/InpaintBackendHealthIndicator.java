package com.phillippitts.erasemark.service.health;

import com.phillippitts.erasemark.domain.BackendStatus;
import com.phillippitts.erasemark.domain.InpaintMode;
import com.phillippitts.erasemark.service.WatermarkRemovalService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the inpainting backends.
 *
 * <ul>
 *   <li>UP: the preferred neural backend for the mode is ready</li>
 *   <li>DEGRADED: only the classical fallback is available</li>
 * </ul>
 *
 * <p>The classical backend is always present, so this indicator never reports DOWN.
 */
@Component
public class InpaintBackendHealthIndicator implements HealthIndicator {

    private final WatermarkRemovalService service;

    public InpaintBackendHealthIndicator(WatermarkRemovalService service) {
        this.service = service;
    }

    @Override
    public Health health() {
        BackendStatus status = service.getBackendStatus();
        boolean neuralReady = status.localLoaded() || status.cloudAvailable();

        Health.Builder builder = new Health.Builder();
        if (neuralReady) {
            builder.up().withDetail("status", "Neural backend available");
        } else {
            builder.status("DEGRADED").withDetail("status", "Only classical fallback available");
        }
        return builder
                .withDetail("mode", status.mode().name())
                .withDetail("local", status.localLoaded() ? "loaded" : "not loaded")
                .withDetail("cloud", describeCloud(status))
                .withDetail("classical", "ready")
                .build();
    }

    private String describeCloud(BackendStatus status) {
        if (status.mode() != InpaintMode.CLOUD) {
            return "disabled";
        }
        return status.cloudAvailable() ? "ready" : "token missing";
    }
}
