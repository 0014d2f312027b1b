package com.questrail.testhost.protocol.tcp.observability;

/**
 * Main interface for receiving engine link observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive from any thread, including transport event loops and
 * while the engine holds its state lock. Implementations must not block and
 * must not call back into the engine.</p>
 */
public interface EngineObservabilitySink {
    /**
     * Called on every engine state transition.
     * @param event the transition event details
     */
    void onStateTransition(EngineStateTransitionEvent event);

    /**
     * Called when a protocol-level event occurs (e.g., request sent, handshake detail).
     * @param event the protocol event
     */
    void onProtocolEvent(EngineProtocolEvent event);

    /**
     * Called when a transport-level event occurs (e.g., listening, accepted, disconnected).
     * @param event the transport event
     */
    void onTransportEvent(EngineTransportEvent event);

    /**
     * Called for protocol violations and I/O failures. None of these are fatal
     * to the connection.
     * @param event the error event
     */
    void onError(EngineErrorEvent event);
}
