package com.questrail.mesh.api;

import com.questrail.mesh.model.MeshPacket;
import com.questrail.mesh.model.PeerId;

import java.util.List;

/**
 * MeshEventListener
 * =============================================================================
 * Application-facing callbacks of the mesh core.
 *
 * <p>Callbacks are delivered synchronously on the thread that caused them
 * (the receive path for packets and announcements, a maintenance thread for
 * evictions). Implementations should hand work off rather than block.</p>
 *
 * <p>An exception thrown by a callback is caught by the caller, reported to
 * the observability sink, and otherwise ignored: it never corrupts engine or
 * directory state and never stops a maintenance sweep.</p>
 */
public interface MeshEventListener
{
    /**
     * A packet is ready for the application: either a completed reassembly
     * group (fired exactly once per group) or a non-fragmented packet passing
     * straight through.
     */
    void onReassembledPacket(MeshPacket packet);

    /**
     * The set of active peers may have changed.
     *
     * @param activePeerIds current active peer ids, sorted
     */
    void onPeerListUpdated(List<PeerId> activePeerIds);

    /**
     * A peer record was removed (explicit leave or staleness).
     */
    void onPeerRemoved(PeerId peerId);
}
