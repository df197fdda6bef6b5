package com.questrail.mesh.peer;

import com.questrail.mesh.model.PeerId;

import java.util.Objects;

/**
 * Decoded content of an ANNOUNCE packet.
 *
 * <p>Key material and signature are optional: a plain announcement carries
 * only the nickname. Arrays are copied on the way in and on the way out.</p>
 */
public record PeerAnnouncement(PeerId peerId,
                               String nickname,
                               byte[] noisePublicKey,
                               byte[] signingPublicKey,
                               byte[] signature)
{
    public PeerAnnouncement {
        Objects.requireNonNull(peerId, "peerId");
        Objects.requireNonNull(nickname, "nickname");
        noisePublicKey = copyOf(noisePublicKey);
        signingPublicKey = copyOf(signingPublicKey);
        signature = copyOf(signature);
    }

    /**
     * Nickname-only announcement.
     */
    public static PeerAnnouncement plain(PeerId peerId, String nickname) {
        return new PeerAnnouncement(peerId, nickname, null, null, null);
    }

    @Override
    public byte[] noisePublicKey() {
        return copyOf(noisePublicKey);
    }

    @Override
    public byte[] signingPublicKey() {
        return copyOf(signingPublicKey);
    }

    @Override
    public byte[] signature() {
        return copyOf(signature);
    }

    public boolean hasKeyMaterial() {
        return noisePublicKey != null || signingPublicKey != null;
    }

    private static byte[] copyOf(byte[] bytes) {
        return (bytes == null) ? null : bytes.clone();
    }
}
