package com.questrail.mesh.api;

import com.questrail.mesh.model.MeshPacket;
import com.questrail.mesh.model.PeerId;

import java.util.List;

/**
 * No-op {@link MeshEventListener}, installed until the application registers one.
 */
public final class NullMeshEventListener implements MeshEventListener {
    public static final NullMeshEventListener INSTANCE = new NullMeshEventListener();

    private NullMeshEventListener() {}

    @Override
    public void onReassembledPacket(MeshPacket packet) {}

    @Override
    public void onPeerListUpdated(List<PeerId> activePeerIds) {}

    @Override
    public void onPeerRemoved(PeerId peerId) {}
}
