package com.questrail.mesh.observability;

import com.questrail.mesh.model.PeerId;

import java.time.Instant;

/**
 * Observability events emitted by the peer directory.
 */
public sealed interface PeerEvent
        permits PeerEvent.PeerAdded,
                PeerEvent.PeerVerified,
                PeerEvent.VerificationRejected,
                PeerEvent.PeerRemoved
{
    Instant timestamp();

    PeerId peerId();

    enum RemovalReason {
        EXPLICIT,
        STALE,
        NICKNAME_COLLISION
    }

    /** First announcement created a record. */
    record PeerAdded(Instant timestamp, PeerId peerId, String nickname) implements PeerEvent {}

    /** A record became verified for the first time. */
    record PeerVerified(Instant timestamp, PeerId peerId, String nickname) implements PeerEvent {}

    /** A keyed announcement did not pass verification; the record stays unverified. */
    record VerificationRejected(Instant timestamp, PeerId peerId, String nickname) implements PeerEvent {}

    /** A record was deleted. */
    record PeerRemoved(Instant timestamp, PeerId peerId, RemovalReason reason) implements PeerEvent {}
}
