package com.phillippitts.erasemark.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void eraseMarkExceptionShouldIncludeMessage() {
        EraseMarkException ex = new EraseMarkException("test error");
        assertThat(ex.getMessage()).isEqualTo("test error");
    }

    @Test
    void eraseMarkExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        EraseMarkException ex = new EraseMarkException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void modelNotFoundExceptionShouldIncludePath() {
        ModelNotFoundException ex = new ModelNotFoundException("/models/lama_fp32.onnx");

        assertThat(ex.getMessage()).contains("/models/lama_fp32.onnx");
        assertThat(ex.getModelPath()).isEqualTo("/models/lama_fp32.onnx");
    }

    @Test
    void modelNotFoundExceptionShouldIncludeCause() {
        IOException cause = new IOException("File not found");
        ModelNotFoundException ex = new ModelNotFoundException("/models/lama_fp32.onnx", cause);

        assertThat(ex.getCause()).isEqualTo(cause);
        assertThat(ex.getModelPath()).isEqualTo("/models/lama_fp32.onnx");
    }

    @Test
    void inpaintExceptionShouldDefaultBackendToUnknown() {
        InpaintException ex = new InpaintException("inference failed");

        assertThat(ex.getMessage()).isEqualTo("inference failed");
        assertThat(ex.getBackendName()).isEqualTo("unknown");
    }

    @Test
    void inpaintExceptionShouldIncludeBackendName() {
        InpaintException ex = new InpaintException("prediction timed out", "cloud");

        assertThat(ex.getMessage()).isEqualTo("prediction timed out (backend: cloud)");
        assertThat(ex.getBackendName()).isEqualTo("cloud");
    }

    @Test
    void inpaintExceptionShouldIncludeBackendAndCause() {
        RuntimeException cause = new RuntimeException("session crashed");
        InpaintException ex = new InpaintException("tile failed", "local", cause);

        assertThat(ex.getMessage()).contains("tile failed").contains("local");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void invalidImageExceptionShouldIncludeSizeAndReason() {
        InvalidImageException ex = new InvalidImageException(42, "Image bytes could not be decoded");

        assertThat(ex.getMessage()).isEqualTo("Invalid image data (42 bytes): Image bytes could not be decoded");
        assertThat(ex.getByteSize()).isEqualTo(42);
        assertThat(ex.getReason()).isEqualTo("Image bytes could not be decoded");
    }

    @Test
    void invalidImageExceptionWithoutSize() {
        InvalidImageException ex = new InvalidImageException("Mask payload is empty");

        assertThat(ex.getMessage()).isEqualTo("Invalid image data: Mask payload is empty");
        assertThat(ex.getByteSize()).isZero();
    }

    @Test
    void allBackendsExhaustedShouldListAttempts() {
        List<String> attempts = List.of("local: UNAVAILABLE (not loaded)", "classical: FAILED (boom)");
        AllBackendsExhaustedException ex = new AllBackendsExhaustedException(attempts);

        assertThat(ex.getMessage())
                .isEqualTo("All inpainting backends exhausted: local: UNAVAILABLE (not loaded); classical: FAILED (boom)");
        assertThat(ex.getAttempts()).containsExactlyElementsOf(attempts);
    }

    @Test
    void allExceptionsShouldExtendEraseMarkException() {
        assertThat(new ModelNotFoundException("/path")).isInstanceOf(EraseMarkException.class);
        assertThat(new InpaintException("test")).isInstanceOf(EraseMarkException.class);
        assertThat(new InvalidImageException("test")).isInstanceOf(EraseMarkException.class);
        assertThat(new AllBackendsExhaustedException(List.of())).isInstanceOf(EraseMarkException.class);
        assertThat(new BackendUnavailableException("test", "local")).isInstanceOf(InpaintException.class);
    }

    @Test
    void allExceptionsShouldBeUnchecked() {
        assertThat(new EraseMarkException("test")).isInstanceOf(RuntimeException.class);
    }
}
