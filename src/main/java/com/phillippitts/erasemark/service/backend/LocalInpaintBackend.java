package com.phillippitts.erasemark.service.backend;

import com.phillippitts.erasemark.config.inpaint.LocalModelConfig;
import com.phillippitts.erasemark.domain.Mask;
import com.phillippitts.erasemark.exception.InpaintException;
import com.phillippitts.erasemark.service.blend.Blender;
import com.phillippitts.erasemark.service.model.InpaintModel;
import com.phillippitts.erasemark.service.patch.PatchPlanner;
import com.phillippitts.erasemark.service.patch.PlanResult;
import com.phillippitts.erasemark.service.patch.TileSpec;
import com.phillippitts.erasemark.service.tile.Tile;
import com.phillippitts.erasemark.service.tile.TileProcessor;
import com.phillippitts.erasemark.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Local neural backend: plans tiles over the mask, infers them one after another and
 * feather-blends each into a working copy of the image.
 *
 * <p>Tile inputs are always cropped from the untouched source so overlapping tiles do not
 * see each other's output. The whole plan runs on the inference executor under a single
 * timeout; any tile failure fails the attempt so tiles from different backends are never mixed.
 * On timeout the worker is interrupted and no further tile is started.
 */
@Component
class LocalInpaintBackend implements InpaintBackend {
    private static final Logger LOG = LogManager.getLogger(LocalInpaintBackend.class);

    private final InpaintModel model;
    private final PatchPlanner planner;
    private final TileProcessor processor;
    private final Blender blender;
    private final LocalModelConfig config;
    private final Executor executor;

    LocalInpaintBackend(InpaintModel model,
                        PatchPlanner planner,
                        TileProcessor processor,
                        Blender blender,
                        LocalModelConfig config,
                        @Qualifier("inferenceExecutor") Executor executor) {
        this.model = model;
        this.planner = planner;
        this.processor = processor;
        this.blender = blender;
        this.config = config;
        this.executor = executor;
    }

    @Override
    public String name() {
        return BackendNames.LOCAL;
    }

    @Override
    public boolean isAvailable() {
        return model.isLoaded();
    }

    @Override
    public BackendOutcome attempt(Mat image, Mask mask) {
        if (!isAvailable()) {
            return BackendOutcome.unavailable(name(), model.getModelName() + " model not loaded");
        }
        PlanResult plan = planner.plan(image.cols(), image.rows(), mask, model.inputSize());
        if (plan.isEmpty()) {
            return BackendOutcome.success(name(), image.clone(), 0);
        }

        long start = System.nanoTime();
        AtomicBoolean cancelled = new AtomicBoolean();
        FutureTask<Mat> future = new FutureTask<>(() -> runPlan(image, mask, plan, cancelled));
        executor.execute(future);
        try {
            Mat result = future.get(config.timeoutMs(), TimeUnit.MILLISECONDS);
            LOG.info("Local inpaint finished: tiles={}, elapsedMs={}", plan.size(), TimeUtils.elapsedMillis(start));
            return BackendOutcome.success(name(), result, plan.size());
        } catch (TimeoutException e) {
            cancelled.set(true);
            future.cancel(true);
            LOG.warn("Local inpaint timed out after {} ms, cancelling remaining tiles", config.timeoutMs());
            return BackendOutcome.failed(name(), "timed out after " + config.timeoutMs() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled.set(true);
            future.cancel(true);
            return BackendOutcome.failed(name(), "interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.warn("Local inpaint failed after {} ms: {}", TimeUtils.elapsedMillis(start), cause.toString());
            String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            return BackendOutcome.failed(name(), reason);
        }
    }

    private Mat runPlan(Mat image, Mask mask, PlanResult plan, AtomicBoolean cancelled) {
        Mat canvas = image.clone();
        int index = 0;
        for (TileSpec spec : plan.tiles()) {
            if (cancelled.get() || Thread.currentThread().isInterrupted()) {
                canvas.release();
                throw new InpaintException("Cancelled before tile " + index, name());
            }
            Rect r = spec.toRect();
            Tile tile = new Tile(spec, image.submat(r).clone(), mask.crop(r));
            try {
                Mat inferred = processor.process(tile, model);
                blender.blend(canvas, inferred, tile.mask(), spec);
                inferred.release();
            } catch (RuntimeException e) {
                canvas.release();
                throw e;
            } finally {
                tile.release();
            }
            LOG.debug("Tile {}/{} blended at {}", ++index, plan.size(), spec);
        }
        if (cancelled.get()) {
            canvas.release();
            throw new InpaintException("Cancelled after last tile", name());
        }
        return canvas;
    }
}
