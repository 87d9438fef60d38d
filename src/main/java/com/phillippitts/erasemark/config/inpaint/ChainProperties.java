package com.phillippitts.erasemark.config.inpaint;

import com.phillippitts.erasemark.domain.InpaintMode;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Backend chain settings. Binds to "inpaint.chain".
 *
 * @param mode {@code LOCAL} skips the remote backend, {@code CLOUD} tries it first
 */
@ConfigurationProperties(prefix = "inpaint.chain")
@Validated
public record ChainProperties(
        @NotNull @DefaultValue("LOCAL") InpaintMode mode
) {
}
