package com.questrail.mesh.peer;

import com.questrail.mesh.model.PeerId;

import java.util.Map;
import java.util.Optional;

/**
 * FingerprintRegistry
 * =============================================================================
 * Binds ephemeral peer ids to the stable fingerprint of a peer's public key.
 *
 * <h2>Invariant</h2>
 * The mapping is one-to-one at every instant: a peer id has at most one
 * fingerprint and a fingerprint belongs to at most one peer id. Every
 * mutation, including {@link #remap}, preserves this atomically.
 *
 * <h2>Lifecycle</h2>
 * A registry is an explicitly constructed object handed to the
 * {@link PeerDirectory}; it is created at startup and cleared at shutdown by
 * whoever owns it. There is no process-wide instance.
 */
public interface FingerprintRegistry
{
    /**
     * Derive the fingerprint of {@code publicKey} and bind it to {@code peerId},
     * replacing any previous binding of either side.
     *
     * @return the fingerprint
     */
    String storeFingerprint(PeerId peerId, byte[] publicKey);

    /**
     * Move {@code fingerprint} to {@code newPeerId}, dropping whatever
     * {@code oldPeerId} was bound to.
     *
     * @param oldPeerId previous id of the peer, or {@code null} if unknown
     */
    void remap(PeerId oldPeerId, PeerId newPeerId, String fingerprint);

    Optional<String> fingerprintOf(PeerId peerId);

    Optional<PeerId> peerIdOf(String fingerprint);

    boolean hasFingerprint(PeerId peerId);

    /**
     * Removal hook, called whenever the directory deletes a peer record.
     */
    void removePeer(PeerId peerId);

    /**
     * Snapshot of all bindings, peer id to fingerprint.
     */
    Map<PeerId, String> allFingerprints();

    void clear();

    String debugInfo();
}
