package com.questrail.mesh.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FakeMeshLink
 * -----------------------------------------------------------------------------
 * Test-only {@link MeshLink}. Stores broadcast frames and lets tests inject
 * inbound frames. Contains no mesh semantics.
 */
public final class FakeMeshLink implements MeshLink {

    private MeshLinkListener listener;
    private final List<byte[]> broadcast = new ArrayList<>();

    @Override
    public void setListener(MeshLinkListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        if (listener != null) {
            listener.onLinkUp();
        }
    }

    @Override
    public void stop() {
        if (listener != null) {
            listener.onLinkDown(null);
        }
    }

    @Override
    public void broadcast(byte[] frame) {
        broadcast.add(Objects.requireNonNull(frame, "frame").clone());
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void injectFrame(String linkAddress, byte[] frame) {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        listener.onFrame(linkAddress, frame);
    }

    public void failLink(Throwable cause) {
        listener.onLinkDown(cause);
    }

    public List<byte[]> broadcast() {
        return Collections.unmodifiableList(broadcast);
    }

    public void clear() {
        broadcast.clear();
    }
}
