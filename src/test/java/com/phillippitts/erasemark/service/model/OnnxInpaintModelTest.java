package com.phillippitts.erasemark.service.model;

import com.phillippitts.erasemark.config.inpaint.LocalModelConfig;
import com.phillippitts.erasemark.exception.BackendUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OnnxInpaintModelTest {

    @TempDir
    Path tempDir;

    @Test
    void missingModelFileIsReportedNotThrown() {
        OnnxInpaintModel model = new OnnxInpaintModel(LocalModelConfig.defaults());

        assertThat(model.load(tempDir.resolve("lama_fp32.onnx"))).isFalse();
        assertThat(model.isLoaded()).isFalse();
    }

    @Test
    void corruptModelFileIsReportedNotThrown() throws IOException {
        OnnxInpaintModel model = new OnnxInpaintModel(LocalModelConfig.defaults());
        Path corrupt = Files.write(tempDir.resolve("lama_fp32.onnx"), new byte[]{0x01, 0x02, 0x03});

        assertThat(model.load(corrupt)).isFalse();
        assertThat(model.isLoaded()).isFalse();
    }

    @Test
    void inferBeforeLoadIsUnavailable() {
        OnnxInpaintModel model = new OnnxInpaintModel(LocalModelConfig.defaults());
        int s = model.inputSize();

        assertThatThrownBy(() -> model.infer(new float[3 * s * s], new float[s * s]))
                .isInstanceOf(BackendUnavailableException.class);
    }

    @Test
    void usesConfiguredInputSize() {
        LocalModelConfig config = new LocalModelConfig("models/x.onnx", 256, 0, false, 1000L, false);

        assertThat(new OnnxInpaintModel(config).inputSize()).isEqualTo(256);
        assertThat(new OnnxInpaintModel(config).getModelName()).isEqualTo(OnnxInpaintModel.NAME);
    }

    @Test
    void recognisesMaskInputsByName() {
        assertThat(OnnxInpaintModel.isMaskInput("mask")).isTrue();
        assertThat(OnnxInpaintModel.isMaskInput("input_MASK")).isTrue();
        assertThat(OnnxInpaintModel.isMaskInput("image")).isFalse();
    }
}
