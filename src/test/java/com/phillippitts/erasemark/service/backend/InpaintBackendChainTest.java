package com.phillippitts.erasemark.service.backend;

import com.phillippitts.erasemark.domain.Mask;
import com.phillippitts.erasemark.exception.AllBackendsExhaustedException;
import com.phillippitts.erasemark.service.backend.event.AllBackendsExhaustedEvent;
import com.phillippitts.erasemark.service.backend.event.BackendFallbackEvent;
import com.phillippitts.erasemark.service.metrics.InpaintMetrics;
import com.phillippitts.erasemark.testutil.EventCapturingPublisher;
import com.phillippitts.erasemark.util.OpenCvLoader;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InpaintBackendChainTest {

    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry registry;
    private InpaintMetrics metrics;
    private Mat image;
    private Mask mask;

    @BeforeAll
    static void loadOpenCv() {
        OpenCvLoader.ensureLoaded();
    }

    @BeforeEach
    void setUp() {
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
        metrics = new InpaintMetrics(registry);
        image = new Mat(8, 8, CvType.CV_8UC3);
        mask = Mask.empty(8, 8);
    }

    @Test
    void ordersBackendsByPriority() {
        InpaintBackendChain chain = new InpaintBackendChain(List.of(
                stub(BackendNames.CLASSICAL, name -> BackendOutcome.bestEffort(name, new Mat())),
                stub(BackendNames.CLOUD, name -> BackendOutcome.unavailable(name, "off")),
                stub(BackendNames.LOCAL, name -> BackendOutcome.unavailable(name, "off"))),
                publisher, metrics);

        assertThat(chain.backendNames()).containsExactly(BackendNames.CLOUD, BackendNames.LOCAL, BackendNames.CLASSICAL);
    }

    @Test
    void firstSuccessWinsAndLaterBackendsAreNotTried() {
        StubBackend classical = stub(BackendNames.CLASSICAL, name -> BackendOutcome.bestEffort(name, new Mat()));
        InpaintBackendChain chain = new InpaintBackendChain(List.of(
                stub(BackendNames.CLOUD, name -> BackendOutcome.unavailable(name, "mode is LOCAL")),
                stub(BackendNames.LOCAL, name -> BackendOutcome.success(name, new Mat(), 4)),
                classical),
                publisher, metrics);

        BackendOutcome outcome = chain.inpaint(image, mask);

        assertThat(outcome.backend()).isEqualTo(BackendNames.LOCAL);
        assertThat(outcome.tiles()).isEqualTo(4);
        assertThat(classical.calls.get()).isZero();
        List<BackendFallbackEvent> events = publisher.eventsOfType(BackendFallbackEvent.class);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).backend()).isEqualTo(BackendNames.CLOUD);
        assertThat(events.get(0).outcome()).isEqualTo("UNAVAILABLE");
        assertThat(events.get(0).reason()).isEqualTo("mode is LOCAL");
    }

    @Test
    void fallsBackToClassicalWhenNeuralBackendsFail() {
        InpaintBackendChain chain = new InpaintBackendChain(List.of(
                stub(BackendNames.CLOUD, name -> BackendOutcome.unavailable(name, "API token not configured")),
                stub(BackendNames.LOCAL, name -> BackendOutcome.failed(name, "timed out after 10 ms")),
                stub(BackendNames.CLASSICAL, name -> BackendOutcome.bestEffort(name, new Mat()))),
                publisher, metrics);

        BackendOutcome outcome = chain.inpaint(image, mask);

        assertThat(outcome.backend()).isEqualTo(BackendNames.CLASSICAL);
        assertThat(outcome.bestEffort()).isTrue();
        assertThat(publisher.eventsOfType(BackendFallbackEvent.class))
                .extracting(BackendFallbackEvent::backend)
                .containsExactly(BackendNames.CLOUD, BackendNames.LOCAL);
        Counter failed = registry.find("erasemark.inpaint.fallback")
                .tag("backend", BackendNames.LOCAL).tag("outcome", "FAILED").counter();
        assertThat(failed).isNotNull();
        assertThat(failed.count()).isEqualTo(1.0);
    }

    @Test
    void throwingBackendIsTreatedAsFailed() {
        InpaintBackendChain chain = new InpaintBackendChain(List.of(
                stub(BackendNames.LOCAL, name -> {
                    throw new IllegalStateException("native crash");
                }),
                stub(BackendNames.CLASSICAL, name -> BackendOutcome.bestEffort(name, new Mat()))),
                publisher, metrics);

        BackendOutcome outcome = chain.inpaint(image, mask);

        assertThat(outcome.backend()).isEqualTo(BackendNames.CLASSICAL);
        BackendFallbackEvent event = publisher.eventsOfType(BackendFallbackEvent.class).get(0);
        assertThat(event.outcome()).isEqualTo("FAILED");
        assertThat(event.reason()).contains("IllegalStateException").contains("native crash");
    }

    @Test
    void exhaustedChainThrowsAndPublishes() {
        InpaintBackendChain chain = new InpaintBackendChain(List.of(
                stub(BackendNames.CLOUD, name -> BackendOutcome.unavailable(name, "no token")),
                stub(BackendNames.LOCAL, name -> BackendOutcome.unavailable(name, "not loaded")),
                stub(BackendNames.CLASSICAL, name -> BackendOutcome.failed(name, "inpaint error"))),
                publisher, metrics);

        assertThatThrownBy(() -> chain.inpaint(image, mask))
                .isInstanceOf(AllBackendsExhaustedException.class)
                .satisfies(e -> assertThat(((AllBackendsExhaustedException) e).getAttempts()).containsExactly(
                        "cloud: UNAVAILABLE (no token)",
                        "local: UNAVAILABLE (not loaded)",
                        "classical: FAILED (inpaint error)"));

        assertThat(publisher.eventsOfType(BackendFallbackEvent.class)).hasSize(3);
        List<AllBackendsExhaustedEvent> exhausted = publisher.eventsOfType(AllBackendsExhaustedEvent.class);
        assertThat(exhausted).hasSize(1);
        assertThat(exhausted.get(0).attempts()).hasSize(3);
    }

    private static StubBackend stub(String name, Function<String, BackendOutcome> behaviour) {
        return new StubBackend(name, behaviour);
    }

    private static final class StubBackend implements InpaintBackend {
        private final String name;
        private final Function<String, BackendOutcome> behaviour;
        final AtomicInteger calls = new AtomicInteger();

        StubBackend(String name, Function<String, BackendOutcome> behaviour) {
            this.name = name;
            this.behaviour = behaviour;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean isAvailable() {
            return true;
        }

        @Override
        public BackendOutcome attempt(Mat image, Mask mask) {
            calls.incrementAndGet();
            return behaviour.apply(name);
        }
    }
}
