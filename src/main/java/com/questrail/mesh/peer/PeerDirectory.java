package com.questrail.mesh.peer;

import com.questrail.mesh.api.MeshEventListener;
import com.questrail.mesh.api.NullMeshEventListener;
import com.questrail.mesh.config.PeerLivenessPolicy;
import com.questrail.mesh.internal.time.MonotonicClock;
import com.questrail.mesh.internal.time.MonotonicScheduler;
import com.questrail.mesh.internal.time.PeriodicTask;
import com.questrail.mesh.internal.time.SystemWallClock;
import com.questrail.mesh.internal.time.WallClock;
import com.questrail.mesh.model.PeerId;
import com.questrail.mesh.observability.MeshErrorEvent;
import com.questrail.mesh.observability.MeshObservabilitySink;
import com.questrail.mesh.observability.NullObservabilitySink;
import com.questrail.mesh.observability.PeerEvent;
import com.questrail.mesh.observability.PeerEvent.RemovalReason;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * PeerDirectory
 * =============================================================================
 * Authoritative in-memory table of known mesh peers.
 *
 * <h2>Per-peer lifecycle</h2>
 * <pre>
 *   unknown
 *      │ addOrUpdatePeer (plain announcement)
 *      ▼
 *   announced-unverified ──── updatePeerInfo (keys + verification passed) ───┐
 *      │                                                                      ▼
 *      │                                                        announced-verified
 *      │ removePeer / stale eviction                                          │
 *      ▼                                                                      │
 *   removed ◄─────────────────────── removePeer / stale eviction ─────────────┘
 * </pre>
 * Verification is monotonic per id: once verified, a record stays verified
 * until it is removed.
 *
 * <h2>Liveness</h2>
 * A peer is <em>active</em> iff it is connected and was seen no longer than
 * {@link PeerLivenessPolicy#staleTimeout()} ago. The periodic sweep evicts
 * exactly the peers failing that same test, so a peer cannot be reported
 * active and be evicted within one tick.
 *
 * <h2>Concurrency</h2>
 * Records, RSSI readings and announcement markers live in concurrent maps and
 * sets; every per-peer update is an atomic replace under the peer's key.
 * Callers never lock. Fingerprints are delegated to a
 * {@link FingerprintRegistry}, which is synchronized internally.
 *
 * <h2>Notifications</h2>
 * A single {@link MeshEventListener} receives peer-list-updated and
 * peer-removed callbacks synchronously. Listener exceptions are reported to
 * the observability sink and otherwise ignored.
 */
public final class PeerDirectory {

    private final PeerLivenessPolicy policy;
    private final FingerprintRegistry fingerprints;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MeshObservabilitySink observabilitySink;
    private final PeriodicTask evictionTask;

    private final Map<PeerId, PeerRecord> peers = new ConcurrentHashMap<>();
    private final Map<PeerId, Integer> rssiByPeer = new ConcurrentHashMap<>();
    private final Set<PeerId> announcedPeers = ConcurrentHashMap.newKeySet();
    private final Set<PeerId> announcedToPeers = ConcurrentHashMap.newKeySet();

    private volatile MeshEventListener listener = NullMeshEventListener.INSTANCE;

    public PeerDirectory(PeerLivenessPolicy policy,
                         FingerprintRegistry fingerprints,
                         MonotonicClock clock,
                         MonotonicScheduler scheduler,
                         WallClock wallClock,
                         MeshObservabilitySink observabilitySink) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.fingerprints = Objects.requireNonNull(fingerprints, "fingerprints");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.evictionTask = new PeriodicTask(
                Objects.requireNonNull(scheduler, "scheduler"),
                clock,
                policy.cleanupInterval(),
                this::evictStalePeers,
                e -> reportError("Stale peer sweep failed", e));
    }

    public PeerDirectory(PeerLivenessPolicy policy,
                         FingerprintRegistry fingerprints,
                         MonotonicClock clock,
                         MonotonicScheduler scheduler,
                         MeshObservabilitySink observabilitySink) {
        this(policy, fingerprints, clock, scheduler, SystemWallClock.INSTANCE, observabilitySink);
    }

    public void setListener(MeshEventListener listener) {
        this.listener = Objects.requireNonNullElse(listener, NullMeshEventListener.INSTANCE);
    }

    public void start() {
        evictionTask.start();
    }

    /**
     * Stops the eviction sweep and clears all peer state.
     */
    public void shutdown() {
        evictionTask.cancel();
        clearAllPeers();
    }

    // -------------------------------------------------------------------------
    // Announcements
    // -------------------------------------------------------------------------

    /**
     * Record a plain announcement (nickname only, no key material).
     *
     * <p>Older records of other ids using the same nickname that were not seen
     * within the recently-seen window are removed first, without notification.
     * Verification state and keys of an existing record are left untouched.</p>
     *
     * @return {@code true} if this was the first announcement from {@code peerId}
     */
    public boolean addOrUpdatePeer(PeerId peerId, String nickname) {
        Objects.requireNonNull(peerId, "peerId");
        Objects.requireNonNull(nickname, "nickname");

        final long now = clock.nowNanos();
        removeNicknameCollisions(peerId, nickname, now);

        final boolean[] firstAnnounce = new boolean[1];
        final boolean[] created = new boolean[1];

        peers.compute(peerId, (id, existing) -> {
            firstAnnounce[0] = announcedPeers.add(id);
            if (existing == null) {
                created[0] = true;
                return PeerRecord.announced(id, nickname, now);
            }
            return existing.withNickname(nickname).withConnected(true).withLastSeen(now);
        });

        if (created[0]) {
            observabilitySink.onPeerEvent(new PeerEvent.PeerAdded(wallClock.now(), peerId, nickname));
        }

        if (firstAnnounce[0]) {
            notifyPeerListUpdated();
            return true;
        }
        return false;
    }

    /**
     * Record an announcement carrying key material.
     *
     * <p>The record becomes verified only if both keys are present and non-empty
     * and {@code verificationPassed} is true. A record that is already verified
     * keeps its verified keys and nickname when a later announcement fails;
     * only its liveness is refreshed.</p>
     *
     * @return {@code true} if this call made the peer verified for the first time
     */
    public boolean updatePeerInfo(PeerId peerId,
                                  String nickname,
                                  byte[] noisePublicKey,
                                  byte[] signingPublicKey,
                                  boolean verificationPassed) {
        Objects.requireNonNull(peerId, "peerId");
        Objects.requireNonNull(nickname, "nickname");

        final boolean verifiedNow = verificationPassed
                && hasKeyMaterial(noisePublicKey)
                && hasKeyMaterial(signingPublicKey);

        final long now = clock.nowNanos();
        removeNicknameCollisions(peerId, nickname, now);

        final boolean[] becameVerified = new boolean[1];
        final boolean[] created = new boolean[1];

        peers.compute(peerId, (id, existing) -> {
            if (existing == null) {
                created[0] = true;
                becameVerified[0] = verifiedNow;
                if (verifiedNow) {
                    announcedPeers.add(id);
                }
                return new PeerRecord(id, nickname, true, false,
                        noisePublicKey, signingPublicKey, verifiedNow, now);
            }
            if (existing.verified() && !verifiedNow) {
                return existing.withConnected(true).withLastSeen(now);
            }
            becameVerified[0] = verifiedNow && !existing.verified();
            if (becameVerified[0]) {
                announcedPeers.add(id);
            }
            return existing.withNickname(nickname)
                    .withKeys(noisePublicKey, signingPublicKey, verifiedNow)
                    .withConnected(true)
                    .withLastSeen(now);
        });

        if (created[0]) {
            observabilitySink.onPeerEvent(new PeerEvent.PeerAdded(wallClock.now(), peerId, nickname));
        }

        if (becameVerified[0]) {
            observabilitySink.onPeerEvent(new PeerEvent.PeerVerified(wallClock.now(), peerId, nickname));
            notifyPeerListUpdated();
            return true;
        }

        if (!verifiedNow) {
            observabilitySink.onPeerEvent(new PeerEvent.VerificationRejected(wallClock.now(), peerId, nickname));
        }
        return false;
    }

    /**
     * Flag whether the peer is reachable over a direct link rather than relayed.
     * Fires a peer-list update when the flag actually changes.
     */
    public void setDirectConnection(PeerId peerId, boolean direct) {
        final boolean[] changed = new boolean[1];
        peers.computeIfPresent(peerId, (id, existing) -> {
            if (existing.directConnection() == direct) {
                return existing;
            }
            changed[0] = true;
            return existing.withDirectConnection(direct);
        });
        if (changed[0]) {
            notifyPeerListUpdated();
        }
    }

    /**
     * Flag the peer's link as up or down. A disconnected peer is no longer
     * active and is evicted on the next sweep.
     */
    public void setConnected(PeerId peerId, boolean connected) {
        final boolean[] changed = new boolean[1];
        peers.computeIfPresent(peerId, (id, existing) -> {
            if (existing.connected() == connected) {
                return existing;
            }
            changed[0] = true;
            return existing.withConnected(connected);
        });
        if (changed[0]) {
            notifyPeerListUpdated();
        }
    }

    /**
     * Refresh liveness of a known peer (any traffic counts as a heartbeat).
     * Unknown ids are ignored.
     */
    public void updatePeerLastSeen(PeerId peerId) {
        final long now = clock.nowNanos();
        peers.computeIfPresent(peerId, (id, existing) -> existing.withLastSeen(now));
    }

    public void updatePeerRssi(PeerId peerId, int rssi) {
        rssiByPeer.put(Objects.requireNonNull(peerId, "peerId"), rssi);
    }

    public void markPeerAsAnnouncedTo(PeerId peerId) {
        announcedToPeers.add(Objects.requireNonNull(peerId, "peerId"));
    }

    public boolean hasAnnouncedToPeer(PeerId peerId) {
        return announcedToPeers.contains(peerId);
    }

    // -------------------------------------------------------------------------
    // Removal
    // -------------------------------------------------------------------------

    /**
     * Remove a peer and notify the listener. Unknown ids are a no-op.
     */
    public void removePeer(PeerId peerId) {
        removePeer(peerId, true);
    }

    /**
     * Remove a peer, its RSSI reading, its announcement markers and its
     * fingerprint binding.
     *
     * @param notify whether to fire peer-removed and peer-list-updated
     */
    public void removePeer(PeerId peerId, boolean notify) {
        Objects.requireNonNull(peerId, "peerId");
        if (removeRecord(peerId, null)) {
            afterRemoval(peerId, notify, RemovalReason.EXPLICIT);
        }
    }

    /**
     * Remove every peer that is no longer active.
     *
     * @return the number of peers evicted
     */
    public int evictStalePeers() {
        final long now = clock.nowNanos();

        int evicted = 0;
        for (PeerRecord record : new ArrayList<>(peers.values())) {
            if (isActive(record, now)) {
                continue;
            }
            // a record refreshed since the snapshot survives
            if (removeRecord(record.id(), record)) {
                afterRemoval(record.id(), true, RemovalReason.STALE);
                evicted++;
            }
        }
        return evicted;
    }

    /**
     * Forget every peer without notifications.
     */
    public void clearAllPeers() {
        for (PeerId peerId : new ArrayList<>(peers.keySet())) {
            fingerprints.removePeer(peerId);
        }
        peers.clear();
        rssiByPeer.clear();
        announcedPeers.clear();
        announcedToPeers.clear();
    }

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    public Optional<PeerRecord> peer(PeerId peerId) {
        return Optional.ofNullable(peers.get(peerId));
    }

    public boolean isPeerVerified(PeerId peerId) {
        PeerRecord record = peers.get(peerId);
        return record != null && record.verified();
    }

    public Map<PeerId, PeerRecord> verifiedPeers() {
        Map<PeerId, PeerRecord> verified = new TreeMap<>();
        peers.forEach((id, record) -> {
            if (record.verified()) {
                verified.put(id, record);
            }
        });
        return Collections.unmodifiableMap(verified);
    }

    public boolean isPeerActive(PeerId peerId) {
        PeerRecord record = peers.get(peerId);
        return record != null && isActive(record, clock.nowNanos());
    }

    /**
     * Ids of all active peers, sorted.
     */
    public List<PeerId> activePeerIds() {
        final long now = clock.nowNanos();
        List<PeerId> active = new ArrayList<>();
        for (PeerRecord record : peers.values()) {
            if (isActive(record, now)) {
                active.add(record.id());
            }
        }
        Collections.sort(active);
        return Collections.unmodifiableList(active);
    }

    public int activePeerCount() {
        return activePeerIds().size();
    }

    public OptionalInt rssi(PeerId peerId) {
        Integer rssi = rssiByPeer.get(peerId);
        return (rssi == null) ? OptionalInt.empty() : OptionalInt.of(rssi);
    }

    public Map<PeerId, Integer> allRssi() {
        return Map.copyOf(rssiByPeer);
    }

    public Optional<String> nickname(PeerId peerId) {
        return peer(peerId).map(PeerRecord::nickname);
    }

    public Map<PeerId, String> allNicknames() {
        Map<PeerId, String> nicknames = new TreeMap<>();
        peers.forEach((id, record) -> nicknames.put(id, record.nickname()));
        return Collections.unmodifiableMap(nicknames);
    }

    /**
     * Human-readable dump of the directory.
     *
     * @param addressPeerMap link address to peer id, as tracked by the
     *                       transport adapter (may be empty)
     */
    public String debugInfo(Map<String, PeerId> addressPeerMap) {
        final long now = clock.nowNanos();
        final Set<PeerId> active = Set.copyOf(activePeerIds());

        StringBuilder sb = new StringBuilder();
        sb.append("=== Peer Directory Debug Info ===\n");
        sb.append("Active Peers: ").append(active.size()).append('\n');
        new TreeMap<>(peers).forEach((id, record) -> {
            long secondsSince = (now - record.lastSeenNanos()) / 1_000_000_000L;
            Integer rssi = rssiByPeer.get(id);
            String address = addressFor(addressPeerMap, id);
            sb.append("  - ").append(id)
              .append(" (").append(record.nickname()).append(')')
              .append(" [Device: ").append(address == null ? "Unknown" : address).append(']')
              .append(" - ").append(active.contains(id) ? "ACTIVE" : "INACTIVE")
              .append('/').append(record.directConnection() ? "DIRECT" : "ROUTED")
              .append(record.verified() ? "/VERIFIED" : "")
              .append(", last seen ").append(secondsSince).append("s ago")
              .append(", RSSI: ").append(rssi == null ? "No RSSI" : rssi + " dBm")
              .append('\n');
        });
        sb.append("Announced Peers: ").append(announcedPeers.size()).append('\n');
        sb.append("Announced To Peers: ").append(announcedToPeers.size()).append('\n');
        return sb.toString();
    }

    /**
     * Device-address-first dump followed by {@link #debugInfo(Map)}.
     */
    public String debugInfoWithDeviceAddresses(Map<String, PeerId> addressPeerMap) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Device Address to Peer Mapping ===\n");
        if (addressPeerMap.isEmpty()) {
            sb.append("No device address mappings available\n");
        } else {
            new TreeMap<>(addressPeerMap).forEach((address, peerId) -> sb
                    .append("  Device: ").append(address)
                    .append(" -> Peer: ").append(peerId)
                    .append(" (").append(nickname(peerId).orElse("Unknown")).append(')')
                    .append(" [").append(isPeerActive(peerId) ? "ACTIVE" : "INACTIVE").append("]\n"));
        }
        sb.append('\n');
        sb.append(debugInfo(addressPeerMap));
        return sb.toString();
    }

    // -------------------------------------------------------------------------
    // Fingerprint delegation
    // -------------------------------------------------------------------------

    public String storeFingerprint(PeerId peerId, byte[] publicKey) {
        return fingerprints.storeFingerprint(peerId, publicKey);
    }

    public void remapPeerId(PeerId oldPeerId, PeerId newPeerId, String fingerprint) {
        fingerprints.remap(oldPeerId, newPeerId, fingerprint);
    }

    public Optional<String> fingerprintOf(PeerId peerId) {
        return fingerprints.fingerprintOf(peerId);
    }

    public Optional<PeerId> peerIdOf(String fingerprint) {
        return fingerprints.peerIdOf(fingerprint);
    }

    public boolean hasFingerprint(PeerId peerId) {
        return fingerprints.hasFingerprint(peerId);
    }

    public Map<PeerId, String> allFingerprints() {
        return fingerprints.allFingerprints();
    }

    public void clearAllFingerprints() {
        fingerprints.clear();
    }

    public String fingerprintDebugInfo() {
        return fingerprints.debugInfo();
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private boolean isActive(PeerRecord record, long nowNanos) {
        return record.connected()
                && nowNanos - record.lastSeenNanos() <= policy.staleTimeout().toNanos();
    }

    /**
     * Drop records of other ids with the same nickname that were not seen
     * strictly within the recently-seen window. Models a peer that came back
     * under a new ephemeral id before its old record went stale.
     */
    private void removeNicknameCollisions(PeerId peerId, String nickname, long nowNanos) {
        final long window = policy.recentlySeenWindow().toNanos();
        for (PeerRecord record : new ArrayList<>(peers.values())) {
            if (record.id().equals(peerId) || !record.nickname().equals(nickname)) {
                continue;
            }
            boolean recentlySeen = nowNanos - record.lastSeenNanos() < window;
            if (!recentlySeen && removeRecord(record.id(), record)) {
                afterRemoval(record.id(), false, RemovalReason.NICKNAME_COLLISION);
            }
        }
    }

    /**
     * Remove the record and purge its side tables under the record's map
     * lock, so an announcement for the same id is ordered entirely before or
     * after the removal. With {@code expected} set, only that exact record is
     * removed. An unknown id still has its side tables purged.
     *
     * @return whether a record was removed
     */
    private boolean removeRecord(PeerId peerId, PeerRecord expected) {
        final boolean[] removed = new boolean[1];
        peers.compute(peerId, (id, current) -> {
            if (current == null) {
                if (expected == null) {
                    purgeSideTables(id);
                }
                return null;
            }
            if (expected != null && !expected.equals(current)) {
                return current;
            }
            purgeSideTables(id);
            removed[0] = true;
            return null;
        });
        return removed[0];
    }

    private void purgeSideTables(PeerId peerId) {
        rssiByPeer.remove(peerId);
        announcedPeers.remove(peerId);
        announcedToPeers.remove(peerId);
        fingerprints.removePeer(peerId);
    }

    private void afterRemoval(PeerId peerId, boolean notify, RemovalReason reason) {
        observabilitySink.onPeerEvent(new PeerEvent.PeerRemoved(wallClock.now(), peerId, reason));
        if (!notify) {
            return;
        }
        try {
            listener.onPeerRemoved(peerId);
        } catch (RuntimeException e) {
            reportError("Listener failed on removal of peer " + peerId, e);
        }
        notifyPeerListUpdated();
    }

    private void notifyPeerListUpdated() {
        List<PeerId> active = activePeerIds();
        try {
            listener.onPeerListUpdated(active);
        } catch (RuntimeException e) {
            reportError("Listener failed on peer list update", e);
        }
    }

    private void reportError(String message, Throwable cause) {
        observabilitySink.onError(new MeshErrorEvent(wallClock.now(), message, cause));
    }

    private static boolean hasKeyMaterial(byte[] key) {
        return key != null && key.length > 0;
    }

    private static String addressFor(Map<String, PeerId> addressPeerMap, PeerId peerId) {
        if (addressPeerMap == null) {
            return null;
        }
        for (Map.Entry<String, PeerId> entry : addressPeerMap.entrySet()) {
            if (entry.getValue().equals(peerId)) {
                return entry.getKey();
            }
        }
        return null;
    }
}
