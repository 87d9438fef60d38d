package com.phillippitts.erasemark.service.backend;

import com.phillippitts.erasemark.domain.Mask;
import com.phillippitts.erasemark.exception.AllBackendsExhaustedException;
import com.phillippitts.erasemark.service.backend.event.AllBackendsExhaustedEvent;
import com.phillippitts.erasemark.service.backend.event.BackendFallbackEvent;
import com.phillippitts.erasemark.service.metrics.InpaintMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opencv.core.Mat;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Tries backends in priority order until one succeeds: cloud, then local, then classical.
 *
 * <p>Every non-success publishes a {@link BackendFallbackEvent}. If nothing succeeds an
 * {@link AllBackendsExhaustedEvent} is published and {@link AllBackendsExhaustedException}
 * thrown. Backends that throw are treated as failed.
 */
@Service
public class InpaintBackendChain {
    private static final Logger LOG = LogManager.getLogger(InpaintBackendChain.class);

    private final List<InpaintBackend> chain;
    private final ApplicationEventPublisher publisher;
    private final InpaintMetrics metrics;

    public InpaintBackendChain(List<InpaintBackend> backends, ApplicationEventPublisher publisher,
                               InpaintMetrics metrics) {
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
        List<InpaintBackend> ordered = new ArrayList<>(backends);
        ordered.sort(Comparator.comparingInt(InpaintBackendChain::priority));
        this.chain = List.copyOf(ordered);
        LOG.info("Backend chain: {}", chain.stream().map(InpaintBackend::name).toList());
    }

    /**
     * Runs the chain.
     *
     * @return the first successful outcome
     * @throws AllBackendsExhaustedException if no backend succeeded
     */
    public BackendOutcome inpaint(Mat image, Mask mask) {
        List<String> attempts = new ArrayList<>();
        for (InpaintBackend backend : chain) {
            BackendOutcome outcome;
            try {
                outcome = backend.attempt(image, mask);
            } catch (Exception e) {
                LOG.warn("Backend {} threw: {}", backend.name(), e.toString());
                outcome = BackendOutcome.failed(backend.name(), e.getClass().getSimpleName() + ": " + e.getMessage());
            }

            if (outcome.isSuccess()) {
                LOG.info("Inpainted via {} (tiles={}, bestEffort={})",
                        outcome.backend(), outcome.tiles(), outcome.bestEffort());
                return outcome;
            }

            attempts.add(outcome.toString());
            if (outcome.kind() == BackendOutcome.Kind.UNAVAILABLE) {
                LOG.debug("Skipping backend {}: {}", backend.name(), outcome.reason());
            } else {
                LOG.warn("Backend {} failed, falling back: {}", backend.name(), outcome.reason());
            }
            metrics.incrementFallback(backend.name(), outcome.kind().name());
            publisher.publishEvent(new BackendFallbackEvent(backend.name(), outcome.kind().name(),
                    outcome.reason(), Instant.now()));
        }

        LOG.error("No inpainting backend succeeded: {}", attempts);
        publisher.publishEvent(new AllBackendsExhaustedEvent(List.copyOf(attempts), Instant.now()));
        throw new AllBackendsExhaustedException(attempts);
    }

    public List<String> backendNames() {
        return chain.stream().map(InpaintBackend::name).toList();
    }

    private static int priority(InpaintBackend backend) {
        int index = BackendNames.PRIORITY.indexOf(backend.name());
        return index < 0 ? BackendNames.PRIORITY.size() : index;
    }
}
