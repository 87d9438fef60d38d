package com.phillippitts.erasemark.service.model;

import com.phillippitts.erasemark.exception.BackendUnavailableException;
import com.phillippitts.erasemark.exception.InpaintException;
import com.phillippitts.erasemark.exception.ModelNotFoundException;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Base class for inpainting models providing load/close state management.
 *
 * <p><b>Thread Safety:</b> state transitions are synchronized on {@link #lock}. Inference
 * itself runs outside the lock so a loaded session can serve concurrent requests.
 *
 * <p><b>Lifecycle:</b> unloaded, then loaded by {@link #load(Path)}, then closed by
 * {@link #close()}. A closed model may be loaded again. Both operations are idempotent.
 *
 * <p>Subclasses implement {@link #doLoad(Path)}, {@link #doInfer(float[], float[])} and
 * {@link #doClose()}.
 */
public abstract class AbstractInpaintModel implements InpaintModel {

    private static final Logger LOG = LogManager.getLogger(AbstractInpaintModel.class);

    /**
     * Guards {@link #loaded} and {@link #loadedFrom}.
     */
    protected final Object lock = new Object();

    private boolean loaded = false;
    private Path loadedFrom;

    private final int inputSize;

    protected AbstractInpaintModel(int inputSize) {
        if (inputSize <= 0) {
            throw new IllegalArgumentException("Input size must be positive: " + inputSize);
        }
        this.inputSize = inputSize;
    }

    /**
     * Loads the model, reporting failures through the return value.
     *
     * <p>A missing file or a session that cannot be created is logged and yields {@code false};
     * the service keeps running with the remaining backends.
     */
    @Override
    public final boolean load(Path modelPath) {
        synchronized (lock) {
            if (loaded && modelPath.equals(loadedFrom)) {
                return true;
            }
            if (loaded) {
                doClose();
                loaded = false;
            }
            try {
                if (!Files.isRegularFile(modelPath)) {
                    throw new ModelNotFoundException(modelPath.toString());
                }
                doLoad(modelPath);
                loaded = true;
                loadedFrom = modelPath;
                LOG.info("{} model loaded from '{}' (inputSize={})", getModelName(), modelPath, inputSize);
                return true;
            } catch (ModelNotFoundException e) {
                LOG.warn("{} model not available: {}", getModelName(), e.getMessage());
                return false;
            } catch (Exception e) {
                LOG.error("{} model failed to load from '{}'", getModelName(), modelPath, e);
                return false;
            }
        }
    }

    /**
     * Creates the inference session. Called under {@link #lock} with an existing regular file.
     */
    protected abstract void doLoad(Path modelPath) throws Exception;

    @Override
    public final boolean isLoaded() {
        synchronized (lock) {
            return loaded;
        }
    }

    @Override
    public final int inputSize() {
        return inputSize;
    }

    @Override
    public final float[] infer(float[] imageChw, float[] maskChw) {
        ensureLoaded();
        int plane = inputSize * inputSize;
        if (imageChw == null || imageChw.length != 3 * plane) {
            throw new IllegalArgumentException("Image tensor must hold " + (3 * plane) + " values");
        }
        if (maskChw == null || maskChw.length != plane) {
            throw new IllegalArgumentException("Mask tensor must hold " + plane + " values");
        }
        try {
            return doInfer(imageChw, maskChw);
        } catch (InpaintException e) {
            throw e;
        } catch (Exception e) {
            throw new InpaintException(getModelName() + " inference failed: " + e.getMessage(),
                    getModelName(), e);
        }
    }

    /**
     * Runs the session on validated tensors.
     */
    protected abstract float[] doInfer(float[] imageChw, float[] maskChw) throws Exception;

    /**
     * Releases the session. Spring calls this on shutdown.
     */
    @Override
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (!loaded) {
                return;
            }
            doClose();
            loaded = false;
            loadedFrom = null;
        }
    }

    /**
     * Releases native resources; must log rather than throw.
     */
    protected abstract void doClose();

    protected final void ensureLoaded() {
        if (!isLoaded()) {
            throw new BackendUnavailableException(getModelName() + " model not loaded", getModelName());
        }
    }
}
