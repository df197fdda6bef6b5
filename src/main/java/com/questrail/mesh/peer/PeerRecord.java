package com.questrail.mesh.peer;

import com.questrail.mesh.model.PeerId;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * PeerRecord
 * -----------------------------------------------------------------------------
 * Directory entry for one mesh peer.
 *
 * <p>Records are immutable values. The {@link PeerDirectory} updates a peer
 * "in place" by atomically replacing the record under its id with a
 * {@code withX} copy, so readers always observe a consistent snapshot.</p>
 *
 * <p>Equality and hashing are structural, including byte-exact comparison of
 * key material.</p>
 *
 * <p>{@code lastSeenNanos} is a {@code MonotonicClock} reading, meaningful
 * only relative to other readings of the same clock.</p>
 */
public final class PeerRecord
{
    private final PeerId id;
    private final String nickname;
    private final boolean connected;
    private final boolean directConnection;
    private final byte[] noisePublicKey;
    private final byte[] signingPublicKey;
    private final boolean verified;
    private final long lastSeenNanos;

    public PeerRecord(PeerId id,
                      String nickname,
                      boolean connected,
                      boolean directConnection,
                      byte[] noisePublicKey,
                      byte[] signingPublicKey,
                      boolean verified,
                      long lastSeenNanos) {
        this.id = Objects.requireNonNull(id, "id");
        this.nickname = Objects.requireNonNull(nickname, "nickname");
        this.connected = connected;
        this.directConnection = directConnection;
        this.noisePublicKey = (noisePublicKey == null) ? null : noisePublicKey.clone();
        this.signingPublicKey = (signingPublicKey == null) ? null : signingPublicKey.clone();
        this.verified = verified;
        this.lastSeenNanos = lastSeenNanos;
    }

    /**
     * A freshly announced, connected, unverified peer without key material.
     */
    static PeerRecord announced(PeerId id, String nickname, long nowNanos) {
        return new PeerRecord(id, nickname, true, false, null, null, false, nowNanos);
    }

    public PeerId id() {
        return id;
    }

    public String nickname() {
        return nickname;
    }

    public boolean connected() {
        return connected;
    }

    public boolean directConnection() {
        return directConnection;
    }

    public Optional<byte[]> noisePublicKey() {
        return Optional.ofNullable(noisePublicKey).map(byte[]::clone);
    }

    public Optional<byte[]> signingPublicKey() {
        return Optional.ofNullable(signingPublicKey).map(byte[]::clone);
    }

    public boolean verified() {
        return verified;
    }

    public long lastSeenNanos() {
        return lastSeenNanos;
    }

    public PeerRecord withNickname(String nickname) {
        return new PeerRecord(id, nickname, connected, directConnection,
                noisePublicKey, signingPublicKey, verified, lastSeenNanos);
    }

    public PeerRecord withConnected(boolean connected) {
        return new PeerRecord(id, nickname, connected, directConnection,
                noisePublicKey, signingPublicKey, verified, lastSeenNanos);
    }

    public PeerRecord withDirectConnection(boolean directConnection) {
        return new PeerRecord(id, nickname, connected, directConnection,
                noisePublicKey, signingPublicKey, verified, lastSeenNanos);
    }

    public PeerRecord withKeys(byte[] noisePublicKey, byte[] signingPublicKey, boolean verified) {
        return new PeerRecord(id, nickname, connected, directConnection,
                noisePublicKey, signingPublicKey, verified, lastSeenNanos);
    }

    public PeerRecord withLastSeen(long lastSeenNanos) {
        return new PeerRecord(id, nickname, connected, directConnection,
                noisePublicKey, signingPublicKey, verified, lastSeenNanos);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PeerRecord that)) return false;
        return connected == that.connected
                && directConnection == that.directConnection
                && verified == that.verified
                && lastSeenNanos == that.lastSeenNanos
                && id.equals(that.id)
                && nickname.equals(that.nickname)
                && Arrays.equals(noisePublicKey, that.noisePublicKey)
                && Arrays.equals(signingPublicKey, that.signingPublicKey);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, nickname, connected, directConnection, verified, lastSeenNanos);
        result = 31 * result + Arrays.hashCode(noisePublicKey);
        result = 31 * result + Arrays.hashCode(signingPublicKey);
        return result;
    }

    @Override
    public String toString() {
        return "PeerRecord[" +
                "id=" + id +
                ", nickname=" + nickname +
                ", connected=" + connected +
                ", direct=" + directConnection +
                ", verified=" + verified +
                ", hasNoiseKey=" + (noisePublicKey != null) +
                ", hasSigningKey=" + (signingPublicKey != null) +
                ']';
    }
}
