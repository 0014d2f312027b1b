package com.questrail.testhost.protocol.tcp.observability;

/**
 * No-op implementation of EngineObservabilitySink.
 */
public final class NullObservabilitySink implements EngineObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(EngineStateTransitionEvent event) {}

    @Override
    public void onProtocolEvent(EngineProtocolEvent event) {}

    @Override
    public void onTransportEvent(EngineTransportEvent event) {}

    @Override
    public void onError(EngineErrorEvent event) {}
}
