package com.phillippitts.erasemark.config.inpaint;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the remote (Replicate-compatible) inpainting service.
 * Binds to properties prefixed with "inpaint.cloud".
 *
 * <p>The backend is only considered available when {@code api-token} is set.
 *
 * @param apiToken bearer token; blank disables the backend
 * @param baseUrl service root, without trailing slash
 * @param modelVersion model version identifier sent with each prediction
 * @param prompt positive prompt
 * @param negativePrompt negative prompt
 * @param inferenceSteps diffusion steps requested
 * @param guidanceScale classifier-free guidance scale
 * @param maxImageSize longest side sent upstream; larger images are downscaled first
 * @param pollIntervalMs delay between status polls
 * @param timeoutMs total polling budget
 * @param connectTimeoutMs HTTP connect timeout
 * @param readTimeoutMs HTTP read timeout
 */
@ConfigurationProperties(prefix = "inpaint.cloud")
@Validated
public record CloudConfig(
        @DefaultValue("")
        String apiToken,

        @NotBlank(message = "Cloud base URL must not be blank")
        @DefaultValue("https://api.replicate.com/v1")
        String baseUrl,

        @NotBlank(message = "Cloud model version must not be blank")
        @DefaultValue("95b7223104132402a9ae91cc677285bc5eb997834bd2349fa486f53910fd68b3")
        String modelVersion,

        @DefaultValue("clean background, seamless, high quality, detailed")
        String prompt,

        @DefaultValue("watermark, text, logo, blurry, low quality")
        String negativePrompt,

        @Positive(message = "Inference steps must be positive")
        @DefaultValue("30")
        int inferenceSteps,

        @Positive(message = "Guidance scale must be positive")
        @DefaultValue("7.5")
        double guidanceScale,

        @Positive(message = "Max image size must be positive")
        @DefaultValue("1024")
        int maxImageSize,

        @Positive(message = "Poll interval must be positive")
        @DefaultValue("1000")
        long pollIntervalMs,

        @Positive(message = "Cloud timeout must be positive")
        @DefaultValue("90000")
        long timeoutMs,

        @Positive(message = "Connect timeout must be positive")
        @DefaultValue("10000")
        int connectTimeoutMs,

        @Positive(message = "Read timeout must be positive")
        @DefaultValue("180000")
        int readTimeoutMs
) {
    public static CloudConfig withToken(String apiToken) {
        return new CloudConfig(apiToken, "https://api.replicate.com/v1",
                "95b7223104132402a9ae91cc677285bc5eb997834bd2349fa486f53910fd68b3",
                "clean background, seamless, high quality, detailed",
                "watermark, text, logo, blurry, low quality",
                30, 7.5, 1024, 1000L, 90_000L, 10_000, 180_000);
    }

    public boolean isConfigured() {
        return apiToken != null && !apiToken.isBlank();
    }
}
