package com.phillippitts.erasemark.service.detect;

import com.phillippitts.erasemark.config.inpaint.DetectorConfig;
import com.phillippitts.erasemark.domain.Region;
import com.phillippitts.erasemark.service.codec.ImageCodec;
import com.phillippitts.erasemark.util.LogSanitizer;
import com.phillippitts.erasemark.util.TimeUtils;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.Word;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opencv.core.Mat;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Word-level text detector backed by Tesseract.
 *
 * <p>A new {@link Tesseract} instance is created per call because the engine is not thread-safe.
 * Word confidences (0..100) are scaled to [0, 1].
 */
@Component
@ConditionalOnProperty(name = "inpaint.detector.enabled", havingValue = "true")
public class TesseractRegionDetector implements RegionDetector {
    private static final Logger LOG = LogManager.getLogger(TesseractRegionDetector.class);

    private static final int TEXT_PREVIEW = 40;

    private final DetectorConfig config;
    private final ImageCodec codec;

    public TesseractRegionDetector(DetectorConfig config, ImageCodec codec) {
        this.config = config;
        this.codec = codec;
    }

    @Override
    public List<Region> detect(Mat image) {
        long start = System.nanoTime();
        try {
            BufferedImage buffered = codec.toBufferedImage(image);
            List<Word> words = newTesseract().getWords(buffered, ITessAPI.TessPageIteratorLevel.RIL_WORD);
            List<Region> regions = new ArrayList<>(words.size());
            for (Word word : words) {
                Region region = toRegion(word);
                if (region != null) {
                    regions.add(region);
                    LOG.debug("Detected text '{}' at {}", LogSanitizer.preview(word.getText(), TEXT_PREVIEW),
                            word.getBoundingBox());
                }
            }
            LOG.info("Tesseract found {} word region(s) in {} ms", regions.size(),
                    TimeUtils.elapsedMillis(start));
            return regions;
        } catch (RuntimeException | LinkageError e) {
            LOG.warn("Text detection failed, continuing without regions: {}", e.toString());
            return List.of();
        }
    }

    @Override
    public String name() {
        return "tesseract";
    }

    Tesseract newTesseract() {
        Tesseract tesseract = new Tesseract();
        tesseract.setDatapath(config.dataPath());
        tesseract.setLanguage(config.language());
        tesseract.setPageSegMode(config.pageSegMode());
        return tesseract;
    }

    static Region toRegion(Word word) {
        Rectangle box = word.getBoundingBox();
        if (box == null || box.width <= 0 || box.height <= 0) {
            return null;
        }
        double confidence = Math.max(0.0, Math.min(1.0, word.getConfidence() / 100.0));
        String text = word.getText() == null ? null : word.getText().strip();
        return new Region(box.x, box.y, box.width, box.height, confidence, text);
    }
}
