package com.phillippitts.erasemark.service.detect;

import com.phillippitts.erasemark.config.inpaint.DetectorConfig;
import com.phillippitts.erasemark.domain.Region;
import com.phillippitts.erasemark.service.codec.ImageCodec;
import com.phillippitts.erasemark.testutil.TestImages;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.Word;
import org.junit.jupiter.api.Test;
import org.opencv.core.Scalar;

import java.awt.Rectangle;

import static org.assertj.core.api.Assertions.assertThat;

class TesseractRegionDetectorTest {

    private final DetectorConfig config = new DetectorConfig(true, "/nonexistent/tessdata", "eng", 11);

    @Test
    void convertsWordToRegionWithUnitConfidence() {
        Word word = new Word(" iStock\n", 87.5f, new Rectangle(12, 30, 90, 24));

        Region region = TesseractRegionDetector.toRegion(word);

        assertThat(region).isEqualTo(new Region(12, 30, 90, 24, 0.875, "iStock"));
    }

    @Test
    void clampsOutOfRangeConfidence() {
        assertThat(TesseractRegionDetector.toRegion(new Word("a", -1f, new Rectangle(0, 0, 5, 5))).confidence())
                .isEqualTo(0.0);
        assertThat(TesseractRegionDetector.toRegion(new Word("a", 140f, new Rectangle(0, 0, 5, 5))).confidence())
                .isEqualTo(1.0);
    }

    @Test
    void skipsEmptyBoxes() {
        assertThat(TesseractRegionDetector.toRegion(new Word("x", 90f, new Rectangle(3, 3, 0, 10)))).isNull();
        assertThat(TesseractRegionDetector.toRegion(new Word("x", 90f, null))).isNull();
    }

    @Test
    void recognitionFailureDegradesToNoRegions() {
        TesseractRegionDetector detector = new TesseractRegionDetector(config, new ImageCodec()) {
            @Override
            Tesseract newTesseract() {
                throw new IllegalStateException("tessdata missing");
            }
        };

        assertThat(detector.detect(TestImages.solid(20, 20, new Scalar(255, 255, 255)))).isEmpty();
    }

    @Test
    void configuresEngineFromProperties() {
        TesseractRegionDetector detector = new TesseractRegionDetector(config, new ImageCodec());

        assertThat(detector.newTesseract()).isNotNull();
        assertThat(detector.name()).isEqualTo("tesseract");
    }

    @Test
    void noOpDetectorFindsNothing() {
        NoOpRegionDetector detector = new NoOpRegionDetector();

        assertThat(detector.detect(null)).isEmpty();
        assertThat(detector.name()).isEqualTo("noop");
    }
}
