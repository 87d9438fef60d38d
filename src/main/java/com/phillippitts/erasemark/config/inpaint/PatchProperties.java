package com.phillippitts.erasemark.config.inpaint;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Geometry constants for tiling and compositing.
 * Binds to properties prefixed with "inpaint.patch".
 *
 * @param contextPadding pixels of surrounding context added around the mask bounding box
 * @param overlap overlap between neighbouring tiles
 * @param featherRadius radius of the soft blend edge
 * @param minTileMaskPixels tiles with fewer masked pixels are skipped unless they hold uncovered mask
 * @param minMaskPixels masks with fewer masked pixels are treated as a no-op
 */
@ConfigurationProperties(prefix = "inpaint.patch")
@Validated
public record PatchProperties(
        @PositiveOrZero @DefaultValue("32") int contextPadding,
        @PositiveOrZero @DefaultValue("64") int overlap,
        @PositiveOrZero @DefaultValue("16") int featherRadius,
        @Positive @DefaultValue("10") int minTileMaskPixels,
        @Positive @DefaultValue("10") int minMaskPixels
) {
    public static PatchProperties defaults() {
        return new PatchProperties(32, 64, 16, 10, 10);
    }
}
