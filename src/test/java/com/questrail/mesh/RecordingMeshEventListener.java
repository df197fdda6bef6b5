package com.questrail.mesh;

import com.questrail.mesh.api.MeshEventListener;
import com.questrail.mesh.model.MeshPacket;
import com.questrail.mesh.model.PeerId;

import java.util.ArrayList;
import java.util.List;

/**
 * Test listener that records every callback.
 */
public final class RecordingMeshEventListener implements MeshEventListener {
    private final List<MeshPacket> packets = new ArrayList<>();
    private final List<List<PeerId>> peerListUpdates = new ArrayList<>();
    private final List<PeerId> removed = new ArrayList<>();

    @Override
    public synchronized void onReassembledPacket(MeshPacket packet) {
        packets.add(packet);
    }

    @Override
    public synchronized void onPeerListUpdated(List<PeerId> activePeerIds) {
        peerListUpdates.add(List.copyOf(activePeerIds));
    }

    @Override
    public synchronized void onPeerRemoved(PeerId peerId) {
        removed.add(peerId);
    }

    public synchronized List<MeshPacket> packets() {
        return new ArrayList<>(packets);
    }

    public synchronized List<List<PeerId>> peerListUpdates() {
        return new ArrayList<>(peerListUpdates);
    }

    public synchronized List<PeerId> removed() {
        return new ArrayList<>(removed);
    }

    public synchronized void clear() {
        packets.clear();
        peerListUpdates.clear();
        removed.clear();
    }
}
