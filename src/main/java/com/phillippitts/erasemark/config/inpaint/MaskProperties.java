package com.phillippitts.erasemark.config.inpaint;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Mask synthesis and region filtering settings.
 * Binds to properties prefixed with "inpaint.mask".
 *
 * @param regionPadding pixels added on every side of a detected region
 * @param blurRadius Gaussian sigma used to soften synthesized mask edges
 * @param minRegionWidth narrower regions are ignored
 * @param minRegionHeight shorter regions are ignored
 * @param maxAreaFraction regions covering more than this share of the image are ignored
 * @param maxRegions at most this many regions (highest confidence first) are painted
 */
@ConfigurationProperties(prefix = "inpaint.mask")
@Validated
public record MaskProperties(
        @PositiveOrZero @DefaultValue("10") int regionPadding,
        @PositiveOrZero @DefaultValue("2") int blurRadius,
        @PositiveOrZero @DefaultValue("20") int minRegionWidth,
        @PositiveOrZero @DefaultValue("10") int minRegionHeight,
        @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.15") double maxAreaFraction,
        @Positive @DefaultValue("5") int maxRegions
) {
    public static MaskProperties defaults() {
        return new MaskProperties(10, 2, 20, 10, 0.15, 5);
    }
}
