package com.phillippitts.erasemark.service.backend.event;

import java.time.Instant;
import java.util.List;

/** Published when no backend, classical included, produced an image. */
public record AllBackendsExhaustedEvent(List<String> attempts, Instant at) { }
