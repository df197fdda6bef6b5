package com.questrail.mesh.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements MeshObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onReassemblyEvent(ReassemblyEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onPeerEvent(PeerEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(MeshErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
