package com.phillippitts.erasemark.service.health;

import com.phillippitts.erasemark.config.inpaint.LocalModelConfig;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Health indicator for the local model file.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ModelHealthIndicator implements HealthIndicator {

    private final LocalModelConfig config;

    public ModelHealthIndicator(LocalModelConfig config) {
        this.config = config;
    }

    @Override
    public Health health() {
        Path modelPath = Paths.get(config.modelPath());
        boolean exists = Files.isRegularFile(modelPath);
        boolean readable = exists && Files.isReadable(modelPath);

        Health.Builder builder = readable ? Health.up() : Health.down();
        builder.withDetail("model", formatStatus(exists, readable, modelPath));
        if (!exists) {
            builder.withDetail("download", LocalModelConfig.DOWNLOAD_HINT);
        }
        return builder.build();
    }

    private String formatStatus(boolean exists, boolean readable, Path path) {
        if (!exists) {
            return "NOT FOUND at " + path;
        }
        if (!readable) {
            return "not readable at " + path;
        }
        return "accessible at " + path;
    }
}
