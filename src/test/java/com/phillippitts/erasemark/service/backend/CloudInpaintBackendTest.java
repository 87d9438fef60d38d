package com.phillippitts.erasemark.service.backend;

import com.phillippitts.erasemark.config.inpaint.ChainProperties;
import com.phillippitts.erasemark.config.inpaint.CloudConfig;
import com.phillippitts.erasemark.config.inpaint.PatchProperties;
import com.phillippitts.erasemark.domain.InpaintMode;
import com.phillippitts.erasemark.domain.Mask;
import com.phillippitts.erasemark.exception.InpaintException;
import com.phillippitts.erasemark.service.blend.Blender;
import com.phillippitts.erasemark.service.codec.ImageCodec;
import com.phillippitts.erasemark.testutil.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CloudInpaintBackendTest {

    private static final ChainProperties CLOUD = new ChainProperties(InpaintMode.CLOUD);
    private static final ChainProperties LOCAL = new ChainProperties(InpaintMode.LOCAL);

    private CloudInpaintClient client;
    private ImageCodec codec;
    private Blender blender;

    @BeforeEach
    void setUp() {
        client = mock(CloudInpaintClient.class);
        codec = new ImageCodec();
        blender = new Blender(PatchProperties.defaults());
    }

    @Test
    void unavailableInLocalMode() {
        CloudInpaintBackend backend = new CloudInpaintBackend(client, config("token", 200), LOCAL, codec, blender);

        BackendOutcome outcome = backend.attempt(TestImages.gradient(32, 32), TestImages.mask(32, 32, 0, 0, 8, 8));

        assertThat(backend.isAvailable()).isFalse();
        assertThat(outcome.kind()).isEqualTo(BackendOutcome.Kind.UNAVAILABLE);
        assertThat(outcome.reason()).isEqualTo("mode is LOCAL");
        verify(client, never()).submit(any(), any());
    }

    @Test
    void unavailableWithoutToken() {
        CloudInpaintBackend backend = new CloudInpaintBackend(client, config("", 200), CLOUD, codec, blender);

        BackendOutcome outcome = backend.attempt(TestImages.gradient(32, 32), TestImages.mask(32, 32, 0, 0, 8, 8));

        assertThat(outcome.kind()).isEqualTo(BackendOutcome.Kind.UNAVAILABLE);
        assertThat(outcome.reason()).isEqualTo("API token not configured");
        verify(client, never()).submit(any(), any());
    }

    @Test
    void pollsUntilSucceededAndDownloadsResult() {
        Mat output = TestImages.solid(64, 48, new Scalar(1, 2, 3));
        when(client.submit(any(), any())).thenReturn("job-1");
        when(client.poll("job-1")).thenReturn(
                new PredictionStatus("starting", null, null),
                new PredictionStatus("processing", null, null),
                new PredictionStatus("succeeded", "https://cdn.example/out.png", null));
        when(client.download("https://cdn.example/out.png")).thenReturn(TestImages.png(output));
        CloudInpaintBackend backend = new CloudInpaintBackend(client, config("token", 2_000), CLOUD, codec, blender);

        BackendOutcome outcome = backend.attempt(TestImages.gradient(64, 48), TestImages.mask(64, 48, 4, 4, 8, 8));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.backend()).isEqualTo(BackendNames.CLOUD);
        assertThat(outcome.image().get(6, 6)).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    void remoteChangesAwayFromMaskAreDiscarded() {
        Mat source = TestImages.gradient(2048, 1024);
        Mat shifted = new Mat();
        Core.add(TestImages.gradient(1024, 512), Scalar.all(40), shifted);
        when(client.submit(any(), any())).thenReturn("job-6");
        when(client.poll("job-6")).thenReturn(new PredictionStatus("succeeded", "u", null));
        when(client.download("u")).thenReturn(TestImages.png(shifted));
        CloudInpaintBackend backend = new CloudInpaintBackend(client, config("token", 2_000), CLOUD, codec, blender);

        BackendOutcome outcome = backend.attempt(source, TestImages.mask(2048, 1024, 900, 400, 200, 100));

        assertThat(outcome.isSuccess()).isTrue();
        Rect far = new Rect(0, 0, 800, 1024);
        assertThat(TestImages.differingPixels(source.submat(far), outcome.image().submat(far))).isZero();
        Rect inside = new Rect(950, 420, 100, 60);
        assertThat(TestImages.differingPixels(source.submat(inside), outcome.image().submat(inside)))
                .isEqualTo(100 * 60);
    }

    @Test
    void downscalesLargeImagesAndResizesResultBack() {
        ArgumentCaptor<byte[]> image = ArgumentCaptor.forClass(byte[].class);
        ArgumentCaptor<byte[]> mask = ArgumentCaptor.forClass(byte[].class);
        when(client.submit(image.capture(), mask.capture())).thenReturn("job-2");
        when(client.poll("job-2")).thenReturn(new PredictionStatus("succeeded", "u", null));
        when(client.download("u")).thenReturn(TestImages.png(TestImages.solid(1024, 512, new Scalar(9, 9, 9))));
        CloudInpaintBackend backend = new CloudInpaintBackend(client, config("token", 2_000), CLOUD, codec, blender);

        BackendOutcome outcome = backend.attempt(TestImages.gradient(2048, 1024),
                TestImages.mask(2048, 1024, 100, 100, 50, 50));

        Mat uploaded = codec.decodeImage(image.getValue());
        Mat uploadedMask = codec.decodeMask(mask.getValue());
        assertThat(uploaded.cols()).isEqualTo(1024);
        assertThat(uploaded.rows()).isEqualTo(512);
        assertThat(uploadedMask.cols()).isEqualTo(1024);
        assertThat(Mask.of(uploadedMask).maskedPixelCount()).isEqualTo(25 * 25);
        assertThat(outcome.image().cols()).isEqualTo(2048);
        assertThat(outcome.image().rows()).isEqualTo(1024);
    }

    @Test
    void failedPredictionFailsTheAttempt() {
        when(client.submit(any(), any())).thenReturn("job-3");
        when(client.poll("job-3")).thenReturn(new PredictionStatus("failed", null, "NSFW content detected"));
        CloudInpaintBackend backend = new CloudInpaintBackend(client, config("token", 2_000), CLOUD, codec, blender);

        BackendOutcome outcome = backend.attempt(TestImages.gradient(32, 32), TestImages.mask(32, 32, 0, 0, 8, 8));

        assertThat(outcome.kind()).isEqualTo(BackendOutcome.Kind.FAILED);
        assertThat(outcome.reason()).contains("job-3 failed: NSFW content detected");
        verify(client, never()).download(anyString());
    }

    @Test
    void succeededWithoutOutputFails() {
        when(client.submit(any(), any())).thenReturn("job-4");
        when(client.poll("job-4")).thenReturn(new PredictionStatus("succeeded", null, null));
        CloudInpaintBackend backend = new CloudInpaintBackend(client, config("token", 2_000), CLOUD, codec, blender);

        BackendOutcome outcome = backend.attempt(TestImages.gradient(32, 32), TestImages.mask(32, 32, 0, 0, 8, 8));

        assertThat(outcome.kind()).isEqualTo(BackendOutcome.Kind.FAILED);
        assertThat(outcome.reason()).contains("without output");
    }

    @Test
    void pollingStopsAtTimeout() {
        when(client.submit(any(), any())).thenReturn("job-5");
        when(client.poll("job-5")).thenReturn(new PredictionStatus("processing", null, null));
        CloudInpaintBackend backend = new CloudInpaintBackend(client, config("token", 60), CLOUD, codec, blender);

        BackendOutcome outcome = backend.attempt(TestImages.gradient(32, 32), TestImages.mask(32, 32, 0, 0, 8, 8));

        assertThat(outcome.kind()).isEqualTo(BackendOutcome.Kind.FAILED);
        assertThat(outcome.reason()).isEqualTo("prediction timed out after 60 ms");
    }

    @Test
    void clientErrorFailsTheAttempt() {
        when(client.submit(any(), any())).thenThrow(new InpaintException("Cloud request failed", BackendNames.CLOUD));
        CloudInpaintBackend backend = new CloudInpaintBackend(client, config("token", 2_000), CLOUD, codec, blender);

        BackendOutcome outcome = backend.attempt(TestImages.gradient(32, 32), TestImages.mask(32, 32, 0, 0, 8, 8));

        assertThat(outcome.kind()).isEqualTo(BackendOutcome.Kind.FAILED);
        assertThat(outcome.reason()).contains("Cloud request failed");
    }

    private static CloudConfig config(String token, long timeoutMs) {
        return new CloudConfig(token, "https://api.replicate.com/v1", "owner/lama:abc123",
                "clean background", "watermark", 30, 7.5, 1024, 5L, timeoutMs, 1_000, 1_000);
    }
}
