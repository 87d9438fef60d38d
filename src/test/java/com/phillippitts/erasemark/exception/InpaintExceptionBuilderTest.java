package com.phillippitts.erasemark.exception;

import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InpaintExceptionBuilderTest {

    @Test
    void buildsPlainMessageWithoutDetails() {
        InpaintException ex = InpaintExceptionBuilder.create("Remote job failed").build();

        assertThat(ex.getMessage()).isEqualTo("Remote job failed (backend: unknown)");
        assertThat(ex.getBackendName()).isEqualTo("unknown");
        assertThat(ex.getCause()).isNull();
    }

    @Test
    void appendsDetailsInOrder() {
        InpaintException ex = InpaintExceptionBuilder.create("Prediction was not created")
                .backend("cloud")
                .httpStatus(422)
                .durationMs(180)
                .metadata("jobId", "abc123")
                .build();

        assertThat(ex.getMessage()).isEqualTo(
                "Prediction was not created (httpStatus=422, durationMs=180, jobId=abc123) (backend: cloud)");
        assertThat(ex.getBackendName()).isEqualTo("cloud");
    }

    @Test
    void keepsCause() {
        SocketTimeoutException cause = new SocketTimeoutException("read timed out");
        InpaintException ex = InpaintExceptionBuilder.create("Download failed")
                .backend("cloud")
                .cause(cause)
                .build();

        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void ignoresNullMetadata() {
        InpaintException ex = InpaintExceptionBuilder.create("Tile failed")
                .metadata(null, "x")
                .metadata("tile", null)
                .build();

        assertThat(ex.getMessage()).isEqualTo("Tile failed (backend: unknown)");
    }

    @Test
    void rejectsEmptyMessage() {
        assertThatThrownBy(() -> InpaintExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> InpaintExceptionBuilder.create(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
