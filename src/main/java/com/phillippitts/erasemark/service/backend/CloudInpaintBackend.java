package com.phillippitts.erasemark.service.backend;

import com.phillippitts.erasemark.config.inpaint.ChainProperties;
import com.phillippitts.erasemark.config.inpaint.CloudConfig;
import com.phillippitts.erasemark.domain.InpaintMode;
import com.phillippitts.erasemark.domain.Mask;
import com.phillippitts.erasemark.exception.EraseMarkException;
import com.phillippitts.erasemark.exception.InpaintException;
import com.phillippitts.erasemark.service.blend.Blender;
import com.phillippitts.erasemark.service.codec.ImageCodec;
import com.phillippitts.erasemark.service.patch.TileSpec;
import com.phillippitts.erasemark.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Remote backend: uploads the whole image and mask, polls the job and downloads the result.
 *
 * <p>Only attempted in {@link InpaintMode#CLOUD} with an API token. Images whose longest side
 * exceeds {@code maxImageSize} are downscaled before upload (Lanczos for pixels, nearest for
 * the mask) and the result is resized back to the source dimensions.
 *
 * <p>The remote output is feather-blended onto a copy of the source through the request mask,
 * so pixels away from the mask keep their original values.
 */
@Component
class CloudInpaintBackend implements InpaintBackend {
    private static final Logger LOG = LogManager.getLogger(CloudInpaintBackend.class);

    private final CloudInpaintClient client;
    private final CloudConfig config;
    private final ChainProperties chain;
    private final ImageCodec codec;
    private final Blender blender;

    CloudInpaintBackend(CloudInpaintClient client,
                        CloudConfig config,
                        ChainProperties chain,
                        ImageCodec codec,
                        Blender blender) {
        this.client = client;
        this.config = config;
        this.chain = chain;
        this.codec = codec;
        this.blender = blender;
    }

    @Override
    public String name() {
        return BackendNames.CLOUD;
    }

    @Override
    public boolean isAvailable() {
        return chain.mode() == InpaintMode.CLOUD && config.isConfigured();
    }

    @Override
    public BackendOutcome attempt(Mat image, Mask mask) {
        if (chain.mode() != InpaintMode.CLOUD) {
            return BackendOutcome.unavailable(name(), "mode is " + chain.mode());
        }
        if (!config.isConfigured()) {
            return BackendOutcome.unavailable(name(), "API token not configured");
        }

        long start = System.nanoTime();
        Mat upload = image;
        Mat maskUpload = mask.toMat();
        int longest = Math.max(image.cols(), image.rows());
        if (longest > config.maxImageSize()) {
            double ratio = (double) config.maxImageSize() / longest;
            Size target = new Size((int) (image.cols() * ratio), (int) (image.rows() * ratio));
            upload = new Mat();
            Imgproc.resize(image, upload, target, 0, 0, Imgproc.INTER_LANCZOS4);
            Mat scaledMask = new Mat();
            Imgproc.resize(maskUpload, scaledMask, target, 0, 0, Imgproc.INTER_NEAREST);
            maskUpload.release();
            maskUpload = scaledMask;
            LOG.debug("Downscaled {}x{} to {}x{} for upload", image.cols(), image.rows(),
                    (int) target.width, (int) target.height);
        }

        try {
            String jobId = client.submit(codec.encodePng(upload), codec.encodePng(maskUpload));
            Mat result = awaitResult(jobId);
            if (result == null) {
                return BackendOutcome.failed(name(), "prediction timed out after " + config.timeoutMs() + " ms");
            }
            if (result.cols() != image.cols() || result.rows() != image.rows()) {
                Mat resized = new Mat();
                Imgproc.resize(result, resized, image.size(), 0, 0, Imgproc.INTER_LANCZOS4);
                result.release();
                result = resized;
            }
            Mat composite = composite(image, result, mask);
            result.release();
            LOG.info("Cloud inpaint finished: job={}, elapsedMs={}", jobId, TimeUtils.elapsedMillis(start));
            return BackendOutcome.success(name(), composite, 0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return BackendOutcome.failed(name(), "interrupted while polling");
        } catch (EraseMarkException e) {
            LOG.warn("Cloud inpaint failed after {} ms: {}", TimeUtils.elapsedMillis(start), e.getMessage());
            return BackendOutcome.failed(name(), e.getMessage());
        } finally {
            if (upload != image) {
                upload.release();
            }
            maskUpload.release();
        }
    }

    private Mat composite(Mat image, Mat remote, Mask mask) {
        Mat canvas = image.clone();
        Mat maskMat = mask.toMat();
        try {
            blender.blend(canvas, remote, maskMat, new TileSpec(0, 0, image.cols(), image.rows()));
        } finally {
            maskMat.release();
        }
        return canvas;
    }

    /**
     * Polls until the job finishes or the budget runs out.
     *
     * @return the decoded output, or null on timeout
     * @throws InpaintException if the job fails or succeeds without output
     */
    private Mat awaitResult(String jobId) throws InterruptedException {
        long deadline = TimeUtils.deadlineAfter(Duration.ofMillis(config.timeoutMs()));
        while (TimeUtils.remainingMillis(deadline) > 0) {
            Thread.sleep(Math.min(config.pollIntervalMs(), Math.max(1L, TimeUtils.remainingMillis(deadline))));
            PredictionStatus status = client.poll(jobId);
            if (status.isSucceeded()) {
                if (status.outputUrl() == null) {
                    throw new InpaintException("prediction " + jobId + " succeeded without output", name());
                }
                return codec.decodeImage(client.download(status.outputUrl()));
            }
            if (status.isFailed()) {
                throw new InpaintException("prediction " + jobId + " " + status.status()
                        + (status.error() == null ? "" : ": " + status.error()), name());
            }
        }
        return null;
    }
}
