package com.questrail.mesh.peer;

import java.util.Objects;

/**
 * AnnouncementHandler
 * =============================================================================
 * Applies decoded announcements to the {@link PeerDirectory}.
 *
 * <pre>
 *   PeerAnnouncement
 *        → no keys        → PeerDirectory.addOrUpdatePeer
 *        → keys present   → AnnouncementVerifier
 *                             → PeerDirectory.updatePeerInfo
 *                             → storeFingerprint (noise key) when verified
 * </pre>
 *
 * <p>A verifier that throws is treated as a failed verification.</p>
 */
public final class AnnouncementHandler {

    private final PeerDirectory directory;
    private final AnnouncementVerifier verifier;

    public AnnouncementHandler(PeerDirectory directory, AnnouncementVerifier verifier) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
    }

    /**
     * @return {@code true} if the announcement was the peer's first, or made
     *         the peer verified for the first time
     */
    public boolean handle(PeerAnnouncement announcement) {
        Objects.requireNonNull(announcement, "announcement");

        if (!announcement.hasKeyMaterial()) {
            return directory.addOrUpdatePeer(announcement.peerId(), announcement.nickname());
        }

        final boolean passed = verifySafely(announcement);
        final boolean newlyVerified = directory.updatePeerInfo(
                announcement.peerId(),
                announcement.nickname(),
                announcement.noisePublicKey(),
                announcement.signingPublicKey(),
                passed);

        final byte[] noiseKey = announcement.noisePublicKey();
        final byte[] signingKey = announcement.signingPublicKey();
        if (passed && isPresent(noiseKey) && isPresent(signingKey)) {
            directory.storeFingerprint(announcement.peerId(), noiseKey);
        }
        return newlyVerified;
    }

    private static boolean isPresent(byte[] key) {
        return key != null && key.length > 0;
    }

    private boolean verifySafely(PeerAnnouncement announcement) {
        try {
            return verifier.verify(announcement);
        } catch (RuntimeException e) {
            return false;
        }
    }
}
