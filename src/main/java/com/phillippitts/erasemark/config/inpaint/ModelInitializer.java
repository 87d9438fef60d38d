package com.phillippitts.erasemark.config.inpaint;

import com.phillippitts.erasemark.service.model.InpaintModel;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads the local inpainting model once at startup.
 *
 * <p>A missing model is not fatal: the local backend reports itself unavailable and
 * requests fall through to the classical backend.
 */
@Component
@ConditionalOnProperty(name = "inpaint.local.load-on-startup", havingValue = "true", matchIfMissing = true)
class ModelInitializer {

    private static final Logger LOG = LogManager.getLogger(ModelInitializer.class);

    private final InpaintModel model;
    private final LocalModelConfig config;

    ModelInitializer(InpaintModel model, LocalModelConfig config) {
        this.model = model;
        this.config = config;
    }

    @PostConstruct
    void loadOnStartup() {
        Path path = resolve(config.modelPath());
        LOG.info("Loading local inpainting model: path='{}', inputSize={}, gpu={}",
                path, config.inputSize(), config.useGpu());
        if (!model.load(path)) {
            LOG.warn("Local model unavailable; requests will use the remaining backends. "
                    + "Download it with: curl -L -o '{}' {}", path, LocalModelConfig.DOWNLOAD_HINT);
        }
    }

    // Visible for tests
    static Path resolve(String pathString) {
        Path path = Paths.get(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        Path resolved = Paths.get(".").toAbsolutePath().normalize().resolve(path).normalize();
        LOG.warn("Local model uses relative path '{}' - resolved to '{}'. "
                + "Consider using absolute paths in production.", pathString, resolved);
        return resolved;
    }
}
