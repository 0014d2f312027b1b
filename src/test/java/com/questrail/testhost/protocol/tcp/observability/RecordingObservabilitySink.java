package com.questrail.testhost.protocol.tcp.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements EngineObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(EngineStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onProtocolEvent(EngineProtocolEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(EngineTransportEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(EngineErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<EngineStateTransitionEvent> getStateTransitions() {
        return ofType(EngineStateTransitionEvent.class);
    }

    public synchronized List<EngineErrorEvent> getErrors() {
        return ofType(EngineErrorEvent.class);
    }

    public synchronized List<EngineProtocolEvent> getProtocolEvents() {
        return ofType(EngineProtocolEvent.class);
    }

    public synchronized List<EngineTransportEvent.Kind> getTransportKinds() {
        return ofType(EngineTransportEvent.class).stream()
            .map(EngineTransportEvent::kind)
            .collect(Collectors.toList());
    }

    public synchronized boolean hasErrorContaining(String text) {
        return getErrors().stream().anyMatch(e -> e.message().contains(text));
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
