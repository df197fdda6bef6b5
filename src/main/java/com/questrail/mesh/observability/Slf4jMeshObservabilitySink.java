package com.questrail.mesh.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of MeshObservabilitySink that emits logs via SLF4J.
 *
 * <p>Fragment traffic is logged at debug, peer lifecycle at info, dropped
 * input at debug (untrusted peers can flood it), failures at warn/error.</p>
 */
public final class Slf4jMeshObservabilitySink implements MeshObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jMeshObservabilitySink.class);

    @Override
    public void onReassemblyEvent(ReassemblyEvent event) {
        if (event instanceof ReassemblyEvent.FragmentsCreated created) {
            log.debug("Split {} bytes from {} into {} fragments ({})",
                created.payloadLength(),
                created.sender(),
                created.fragmentCount(),
                created.fragmentId().hex());
        } else if (event instanceof ReassemblyEvent.GroupCompleted completed) {
            log.debug("Reassembled {} bytes from {} out of {} fragments ({})",
                completed.payloadLength(),
                completed.sender(),
                completed.totalFragments(),
                completed.fragmentId().hex());
        } else if (event instanceof ReassemblyEvent.GroupsExpired expired) {
            log.debug("Expired {} incomplete reassembly groups", expired.count());
        } else if (event instanceof ReassemblyEvent.FragmentDropped dropped) {
            log.debug("Dropped fragment from {}: {}", dropped.sender(), dropped.reason());
        }
    }

    @Override
    public void onPeerEvent(PeerEvent event) {
        if (event instanceof PeerEvent.PeerAdded added) {
            log.info("New peer: {} ({})", added.nickname(), added.peerId());
        } else if (event instanceof PeerEvent.PeerVerified verified) {
            log.info("New verified peer: {} ({})", verified.nickname(), verified.peerId());
        } else if (event instanceof PeerEvent.VerificationRejected rejected) {
            log.warn("Unverified peer announcement from: {} ({})", rejected.nickname(), rejected.peerId());
        } else if (event instanceof PeerEvent.PeerRemoved removed) {
            log.info("Removed peer {} ({})", removed.peerId(), removed.reason());
        }
    }

    @Override
    public void onError(MeshErrorEvent event) {
        log.error("Mesh error: {}", event.message(), event.cause());
    }
}
