package com.phillippitts.erasemark.config.inpaint;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the local neural inpainting model.
 * Binds to properties prefixed with "inpaint.local".
 *
 * <p>Example application.properties:
 * <pre>
 * inpaint.local.model-path=models/lama_fp32.onnx
 * inpaint.local.input-size=512
 * inpaint.local.timeout-ms=60000
 * </pre>
 *
 * @param modelPath path to the ONNX model file
 * @param inputSize fixed square input side the model expects
 * @param intraOpThreads ONNX intra-op threads, 0 lets the runtime decide
 * @param useGpu whether to register the CUDA execution provider
 * @param timeoutMs upper bound for inferring every tile of one request
 * @param loadOnStartup whether the model is loaded during context startup
 */
@ConfigurationProperties(prefix = "inpaint.local")
@Validated
public record LocalModelConfig(
        @NotBlank(message = "Local model path must not be blank")
        @DefaultValue("models/lama_fp32.onnx")
        String modelPath,

        @Positive(message = "Input size must be positive")
        @DefaultValue("512")
        int inputSize,

        @PositiveOrZero(message = "Intra-op threads must not be negative")
        @DefaultValue("0")
        int intraOpThreads,

        @DefaultValue("false")
        boolean useGpu,

        @Positive(message = "Local inference timeout must be positive")
        @DefaultValue("60000")
        long timeoutMs,

        @DefaultValue("true")
        boolean loadOnStartup
) {
    /** Download location printed when the model file is missing. */
    public static final String DOWNLOAD_HINT =
            "https://huggingface.co/Carve/LaMa-ONNX/resolve/main/lama_fp32.onnx";

    public static LocalModelConfig defaults() {
        return new LocalModelConfig("models/lama_fp32.onnx", 512, 0, false, 60_000L, true);
    }
}
