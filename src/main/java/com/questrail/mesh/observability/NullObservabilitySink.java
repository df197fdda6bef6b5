package com.questrail.mesh.observability;

/**
 * No-op implementation of MeshObservabilitySink.
 */
public final class NullObservabilitySink implements MeshObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onReassemblyEvent(ReassemblyEvent event) {}

    @Override
    public void onPeerEvent(PeerEvent event) {}

    @Override
    public void onError(MeshErrorEvent event) {}
}
