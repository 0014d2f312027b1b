package com.questrail.testhost.protocol.tcp.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of EngineObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jEngineObservabilitySink implements EngineObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jEngineObservabilitySink.class);

    @Override
    public void onStateTransition(EngineStateTransitionEvent event) {
        log.info("{}: Engine state transition from {} to {}",
            event.engine(),
            event.oldState(),
            event.newState());
    }

    @Override
    public void onProtocolEvent(EngineProtocolEvent event) {
        log.debug("{}: {}", event.engine(), event.message());
    }

    @Override
    public void onTransportEvent(EngineTransportEvent event) {
        log.info("{}: Transport {} ({})", event.engine(), event.kind(), event.address());
    }

    @Override
    public void onError(EngineErrorEvent event) {
        log.error("{}: {}", event.engine(), event.message(), event.cause());
    }
}
