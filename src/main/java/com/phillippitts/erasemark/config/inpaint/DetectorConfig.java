package com.phillippitts.erasemark.config.inpaint;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Text-region detector settings. Binds to "inpaint.detector".
 *
 * <p>When {@code enabled=false} a no-op detector is wired and auto-detection yields no regions.
 *
 * @param enabled whether the Tesseract detector is active
 * @param dataPath tessdata directory
 * @param language Tesseract language code(s)
 * @param pageSegMode Tesseract page segmentation mode (11 = sparse text)
 */
@ConfigurationProperties(prefix = "inpaint.detector")
@Validated
public record DetectorConfig(
        @DefaultValue("false") boolean enabled,
        @NotBlank @DefaultValue("/usr/share/tesseract-ocr/5/tessdata") String dataPath,
        @NotBlank @DefaultValue("eng") String language,
        @Positive @DefaultValue("11") int pageSegMode
) {
}
