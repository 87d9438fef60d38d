package com.phillippitts.erasemark.service;

import com.phillippitts.erasemark.config.inpaint.ChainProperties;
import com.phillippitts.erasemark.config.inpaint.CloudConfig;
import com.phillippitts.erasemark.config.inpaint.PatchProperties;
import com.phillippitts.erasemark.domain.BackendStatus;
import com.phillippitts.erasemark.domain.InpaintMode;
import com.phillippitts.erasemark.domain.Mask;
import com.phillippitts.erasemark.domain.Region;
import com.phillippitts.erasemark.domain.RemovalResult;
import com.phillippitts.erasemark.exception.AllBackendsExhaustedException;
import com.phillippitts.erasemark.exception.InvalidImageException;
import com.phillippitts.erasemark.service.backend.BackendOutcome;
import com.phillippitts.erasemark.service.backend.InpaintBackendChain;
import com.phillippitts.erasemark.service.codec.ImageCodec;
import com.phillippitts.erasemark.service.detect.RegionDetector;
import com.phillippitts.erasemark.service.mask.MaskBuilder;
import com.phillippitts.erasemark.service.mask.RegionFilter;
import com.phillippitts.erasemark.service.metrics.InpaintMetrics;
import com.phillippitts.erasemark.service.model.InpaintModel;
import com.phillippitts.erasemark.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.opencv.core.Mat;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Default removal pipeline: decode, build mask, short-circuit empty masks, run the backend
 * chain, encode PNG.
 *
 * <p>Each request is tagged with a {@code requestId} in the Log4j2 ThreadContext unless the
 * caller already set one; the inference executor propagates it to worker threads.
 */
@Service
public class DefaultWatermarkRemovalService implements WatermarkRemovalService {
    private static final Logger LOG = LogManager.getLogger(DefaultWatermarkRemovalService.class);

    static final String REQUEST_ID = "requestId";

    private final ImageCodec codec;
    private final MaskBuilder maskBuilder;
    private final RegionFilter regionFilter;
    private final RegionDetector detector;
    private final InpaintBackendChain chain;
    private final InpaintModel model;
    private final PatchProperties patchProps;
    private final ChainProperties chainProps;
    private final CloudConfig cloudConfig;
    private final InpaintMetrics metrics;

    public DefaultWatermarkRemovalService(ImageCodec codec,
                                          MaskBuilder maskBuilder,
                                          RegionFilter regionFilter,
                                          RegionDetector detector,
                                          InpaintBackendChain chain,
                                          InpaintModel model,
                                          PatchProperties patchProps,
                                          ChainProperties chainProps,
                                          CloudConfig cloudConfig,
                                          InpaintMetrics metrics) {
        this.codec = codec;
        this.maskBuilder = maskBuilder;
        this.regionFilter = regionFilter;
        this.detector = detector;
        this.chain = chain;
        this.model = model;
        this.patchProps = patchProps;
        this.chainProps = chainProps;
        this.cloudConfig = cloudConfig;
        this.metrics = metrics;
    }

    @Override
    public RemovalResult removeWatermark(byte[] image, byte[] mask) {
        boolean tagged = tagRequest();
        long start = System.nanoTime();
        try {
            Mat source = codec.decodeImage(image);
            Mat userMask = mask == null ? null : codec.decodeMask(mask);
            List<Region> regions = userMask == null ? detectQuietly(source) : List.of();

            Mask repaint = maskBuilder.build(source.cols(), source.rows(), userMask, regions);
            LOG.info("Removal request: image={}x{}, userMask={}, regions={}, {}",
                    source.cols(), source.rows(), userMask != null, regions.size(), repaint);

            if (repaint.maskedPixelCount() < patchProps.minMaskPixels()) {
                metrics.incrementNoOp();
                LOG.info("Mask below {} pixels; returning input unchanged", patchProps.minMaskPixels());
                return RemovalResult.noOp(image, TimeUtils.elapsedMillis(start));
            }

            BackendOutcome outcome = chain.inpaint(source, repaint);
            byte[] png = codec.encodePng(outcome.image());
            long elapsedNanos = System.nanoTime() - start;
            metrics.recordLatency(outcome.backend(), elapsedNanos);
            metrics.incrementSuccess(outcome.backend());
            return new RemovalResult(png, outcome.backend(), outcome.bestEffort(), outcome.tiles(),
                    elapsedNanos / TimeUtils.NANOS_PER_MILLI);
        } catch (InvalidImageException e) {
            metrics.incrementFailure("input", "invalid_input");
            LOG.warn("Rejected request: {}", e.getMessage());
            throw e;
        } catch (AllBackendsExhaustedException e) {
            metrics.incrementFailure("chain", "exhausted");
            throw e;
        } finally {
            if (tagged) {
                ThreadContext.remove(REQUEST_ID);
            }
        }
    }

    @Override
    public List<Region> detectRegions(byte[] image) {
        boolean tagged = tagRequest();
        try {
            Mat source = codec.decodeImage(image);
            return regionFilter.filter(detectQuietly(source), source.cols(), source.rows());
        } finally {
            if (tagged) {
                ThreadContext.remove(REQUEST_ID);
            }
        }
    }

    @Override
    public BackendStatus getBackendStatus() {
        InpaintMode mode = chainProps.mode();
        boolean cloudAvailable = mode == InpaintMode.CLOUD && cloudConfig.isConfigured();
        return new BackendStatus(mode, model.isLoaded(), cloudAvailable);
    }

    private List<Region> detectQuietly(Mat source) {
        try {
            return detector.detect(source);
        } catch (RuntimeException e) {
            LOG.warn("Detector {} failed, treating as no regions: {}", detector.name(), e.toString());
            return List.of();
        }
    }

    private static boolean tagRequest() {
        if (ThreadContext.containsKey(REQUEST_ID)) {
            return false;
        }
        ThreadContext.put(REQUEST_ID, UUID.randomUUID().toString().substring(0, 8));
        return true;
    }
}
