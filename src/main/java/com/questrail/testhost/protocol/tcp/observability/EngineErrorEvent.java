package com.questrail.testhost.protocol.tcp.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly on the engine link.
 *
 * @param cause the underlying failure; {@code null} for pure protocol violations
 */
public record EngineErrorEvent(
    Instant timestamp,
    String engine,
    String message,
    Throwable cause
) {
}
