package com.questrail.mesh.peer;

import com.questrail.mesh.model.PeerId;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * InMemoryFingerprintRegistry
 * -----------------------------------------------------------------------------
 * {@link FingerprintRegistry} holding both directions of the mapping in plain
 * maps guarded by the instance monitor.
 *
 * <p>A fingerprint is the lower-case hex SHA-256 digest of the public key.</p>
 *
 * <p>Both maps are only ever changed together under the same lock, so no
 * reader can observe two peer ids bound to one fingerprint.</p>
 */
public final class InMemoryFingerprintRegistry implements FingerprintRegistry
{
    private static final HexFormat HEX = HexFormat.of();

    private final Map<PeerId, String> fingerprintByPeer = new HashMap<>();
    private final Map<String, PeerId> peerByFingerprint = new HashMap<>();

    /**
     * SHA-256 fingerprint of a public key, as lower-case hex.
     */
    public static String fingerprint(byte[] publicKey) {
        Objects.requireNonNull(publicKey, "publicKey");
        try {
            return HEX.formatHex(MessageDigest.getInstance("SHA-256").digest(publicKey));
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    @Override
    public synchronized String storeFingerprint(PeerId peerId, byte[] publicKey) {
        Objects.requireNonNull(peerId, "peerId");
        final String fingerprint = fingerprint(publicKey);
        bind(peerId, fingerprint);
        return fingerprint;
    }

    @Override
    public synchronized void remap(PeerId oldPeerId, PeerId newPeerId, String fingerprint) {
        Objects.requireNonNull(newPeerId, "newPeerId");
        Objects.requireNonNull(fingerprint, "fingerprint");

        if (oldPeerId != null) {
            unbindPeer(oldPeerId);
        }
        bind(newPeerId, fingerprint);
    }

    @Override
    public synchronized Optional<String> fingerprintOf(PeerId peerId) {
        return Optional.ofNullable(fingerprintByPeer.get(peerId));
    }

    @Override
    public synchronized Optional<PeerId> peerIdOf(String fingerprint) {
        return Optional.ofNullable(peerByFingerprint.get(fingerprint));
    }

    @Override
    public synchronized boolean hasFingerprint(PeerId peerId) {
        return fingerprintByPeer.containsKey(peerId);
    }

    @Override
    public synchronized void removePeer(PeerId peerId) {
        unbindPeer(peerId);
    }

    @Override
    public synchronized Map<PeerId, String> allFingerprints() {
        return Map.copyOf(fingerprintByPeer);
    }

    @Override
    public synchronized void clear() {
        fingerprintByPeer.clear();
        peerByFingerprint.clear();
    }

    @Override
    public synchronized String debugInfo() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Fingerprint Registry ===\n");
        sb.append("Mappings: ").append(fingerprintByPeer.size()).append('\n');
        new TreeMap<>(fingerprintByPeer).forEach((peerId, fingerprint) ->
                sb.append("  - ").append(peerId).append(" -> ")
                  .append(fingerprint, 0, Math.min(16, fingerprint.length())).append("...\n"));
        return sb.toString();
    }

    private void bind(PeerId peerId, String fingerprint) {
        unbindPeer(peerId);

        PeerId previousHolder = peerByFingerprint.remove(fingerprint);
        if (previousHolder != null) {
            fingerprintByPeer.remove(previousHolder);
        }

        fingerprintByPeer.put(peerId, fingerprint);
        peerByFingerprint.put(fingerprint, peerId);
    }

    private void unbindPeer(PeerId peerId) {
        String previous = fingerprintByPeer.remove(peerId);
        if (previous != null) {
            peerByFingerprint.remove(previous, peerId);
        }
    }
}
