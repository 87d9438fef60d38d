package com.phillippitts.erasemark.config.inpaint;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Classical (non-learned) inpainting settings. Binds to "inpaint.classical".
 *
 * @param radius neighbourhood radius considered for each repainted pixel
 * @param method {@code TELEA} or {@code NS} (Navier-Stokes)
 */
@ConfigurationProperties(prefix = "inpaint.classical")
@Validated
public record ClassicalConfig(
        @Positive @DefaultValue("3") double radius,
        @NotNull @DefaultValue("TELEA") Method method
) {
    public enum Method {
        TELEA,
        NS
    }

    public static ClassicalConfig defaults() {
        return new ClassicalConfig(3, Method.TELEA);
    }
}
