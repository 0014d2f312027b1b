package com.questrail.testhost.protocol.tcp.observability;

import java.time.Instant;

/**
 * Record representing a notable, non-error protocol event.
 */
public record EngineProtocolEvent(
    Instant timestamp,
    String engine,
    String message
) {
}
