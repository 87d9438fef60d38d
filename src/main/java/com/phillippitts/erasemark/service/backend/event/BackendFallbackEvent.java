package com.phillippitts.erasemark.service.backend.event;

import java.time.Instant;

/** Published when a backend does not succeed and the chain moves on to the next one. */
public record BackendFallbackEvent(String backend, String outcome, String reason, Instant at) { }
