package com.questrail.testhost.protocol.tcp.observability;

import com.questrail.testhost.protocol.tcp.engine.EngineState;

import java.time.Instant;

/**
 * Record representing a state transition of an engine.
 */
public record EngineStateTransitionEvent(
    Instant timestamp,
    String engine,
    EngineState oldState,
    EngineState newState
) {
}
