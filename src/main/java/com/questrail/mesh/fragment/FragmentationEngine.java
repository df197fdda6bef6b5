package com.questrail.mesh.fragment;

import com.questrail.mesh.api.MeshEventListener;
import com.questrail.mesh.api.NullMeshEventListener;
import com.questrail.mesh.config.FragmentationPolicy;
import com.questrail.mesh.internal.time.MonotonicClock;
import com.questrail.mesh.internal.time.MonotonicScheduler;
import com.questrail.mesh.internal.time.PeriodicTask;
import com.questrail.mesh.internal.time.SystemWallClock;
import com.questrail.mesh.internal.time.WallClock;
import com.questrail.mesh.model.FragmentId;
import com.questrail.mesh.model.FragmentPayload;
import com.questrail.mesh.model.MeshPacket;
import com.questrail.mesh.model.MessageType;
import com.questrail.mesh.observability.MeshErrorEvent;
import com.questrail.mesh.observability.MeshObservabilitySink;
import com.questrail.mesh.observability.NullObservabilitySink;
import com.questrail.mesh.observability.ReassemblyEvent;
import com.questrail.mesh.observability.ReassemblyEvent.DropReason;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * FragmentationEngine
 * =============================================================================
 * Splits oversized outbound packets into bounded fragments and reassembles
 * inbound fragments, in any arrival order, back into the original packet.
 *
 * <h2>Outbound</h2>
 * <pre>
 *   MeshPacket (payload &gt; threshold)
 *        → fragment(...)
 *            → [FRAGMENT #0, FRAGMENT #1, ... FRAGMENT #N-1]   (shared FragmentId)
 * </pre>
 * Chunk {@code i} holds payload bytes {@code [i*max, min((i+1)*max, len))}.
 * Packets at or below the threshold, and packets that already are fragments,
 * pass through as a single-element list.
 *
 * <h2>Inbound</h2>
 * <pre>
 *   FRAGMENT packet
 *        → acceptFragment(...)
 *            → buffered            (Optional.empty())
 *            → group complete      (Optional.of(original))
 * </pre>
 *
 * <h2>Concurrency</h2>
 * <p>Groups live in a {@link ConcurrentHashMap}. The insert-then-check step
 * runs inside {@link ConcurrentHashMap#compute}, so it is atomic per fragment
 * id: of several fragments racing to complete a group exactly one caller
 * receives the reassembled packet. Completed ids are remembered for one
 * reassembly timeout so late duplicates cannot open a phantom group.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   engine.start()  → arms the periodic expiry sweep
 *   engine.stop()   → cancels the sweep and discards all pending state
 * </pre>
 *
 * <p>Instances share nothing; two engines never see each other's groups.</p>
 */
public final class FragmentationEngine {

    private final FragmentationPolicy policy;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MeshObservabilitySink observabilitySink;
    private final PeriodicTask expiryTask;

    private final Map<FragmentId, ReassemblyGroup> groups = new ConcurrentHashMap<>();
    private final Map<FragmentId, Long> completedAtNanos = new ConcurrentHashMap<>();

    private volatile MeshEventListener listener = NullMeshEventListener.INSTANCE;

    /**
     * @param policy            size and timing constants
     * @param clock             monotonic clock for group ages
     * @param scheduler         scheduler for the expiry sweep
     * @param wallClock         timestamps for observability events
     * @param observabilitySink receives reassembly events and errors (may be null)
     */
    public FragmentationEngine(FragmentationPolicy policy,
                               MonotonicClock clock,
                               MonotonicScheduler scheduler,
                               WallClock wallClock,
                               MeshObservabilitySink observabilitySink) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.expiryTask = new PeriodicTask(
                Objects.requireNonNull(scheduler, "scheduler"),
                clock,
                policy.cleanupInterval(),
                this::expireStaleGroups,
                e -> reportError("Reassembly expiry sweep failed", e));
    }

    public FragmentationEngine(FragmentationPolicy policy,
                               MonotonicClock clock,
                               MonotonicScheduler scheduler,
                               MeshObservabilitySink observabilitySink) {
        this(policy, clock, scheduler, SystemWallClock.INSTANCE, observabilitySink);
    }

    public void setListener(MeshEventListener listener) {
        this.listener = Objects.requireNonNullElse(listener, NullMeshEventListener.INSTANCE);
    }

    public FragmentationPolicy policy() {
        return policy;
    }

    public void start() {
        expiryTask.start();
    }

    /**
     * Stops the expiry sweep and discards every in-flight group.
     */
    public void stop() {
        expiryTask.cancel();
        groups.clear();
        completedAtNanos.clear();
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Fragment using the configured policy sizes.
     */
    public List<MeshPacket> fragment(MeshPacket packet) {
        return fragment(packet, policy.maxFragmentBytes(), policy.thresholdBytes());
    }

    /**
     * Split {@code packet} into fragment packets of at most
     * {@code maxFragmentBytes} data bytes each.
     *
     * @return {@code [packet]} when no fragmentation is needed, otherwise the
     *         fragments in index order
     * @throws IllegalArgumentException if the sizes are inconsistent or the
     *                                  payload needs more than 65535 fragments
     */
    public List<MeshPacket> fragment(MeshPacket packet, int maxFragmentBytes, int thresholdBytes) {
        Objects.requireNonNull(packet, "packet");
        FragmentationPolicy.validateSizes(maxFragmentBytes, thresholdBytes);

        if (packet.isFragment() || packet.payloadLength() <= thresholdBytes) {
            return List.of(packet);
        }

        final byte[] payload = packet.payload();
        final int total = (payload.length + maxFragmentBytes - 1) / maxFragmentBytes;
        if (total > FragmentPayload.MAX_FRAGMENTS) {
            throw new IllegalArgumentException(
                    "Payload of " + payload.length + " bytes needs " + total + " fragments; limit is "
                            + FragmentPayload.MAX_FRAGMENTS);
        }

        final FragmentId fragmentId = FragmentId.random();
        final List<MeshPacket> fragments = new ArrayList<>(total);

        for (int index = 0; index < total; index++) {
            int from = index * maxFragmentBytes;
            int to = Math.min(from + maxFragmentBytes, payload.length);

            FragmentPayload fragmentPayload = new FragmentPayload(
                    fragmentId,
                    index,
                    total,
                    packet.type(),
                    Arrays.copyOfRange(payload, from, to));

            fragments.add(new MeshPacket(MessageType.FRAGMENT, packet.sender(), fragmentPayload.encode()));
        }

        observabilitySink.onReassemblyEvent(new ReassemblyEvent.FragmentsCreated(
                wallClock.now(), fragmentId, packet.sender(), total, payload.length));

        return fragments;
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    /**
     * Buffer one inbound fragment and return the original packet if this
     * fragment completed its group.
     *
     * <p>Malformed fragments, fragments of already-completed groups,
     * fragments whose total disagrees with their group and fragments whose
     * original type is FRAGMENT are dropped without touching state. A
     * reassembled packet is therefore never a fragment.</p>
     */
    public Optional<MeshPacket> acceptFragment(MeshPacket fragmentPacket) {
        Objects.requireNonNull(fragmentPacket, "fragmentPacket");

        if (!fragmentPacket.isFragment()) {
            drop(fragmentPacket, DropReason.NOT_A_FRAGMENT);
            return Optional.empty();
        }

        final Optional<FragmentPayload> decoded = FragmentPayload.decode(fragmentPacket.payload());
        if (decoded.isEmpty()) {
            drop(fragmentPacket, DropReason.MALFORMED);
            return Optional.empty();
        }

        final FragmentPayload fragment = decoded.get();
        if (fragment.originalType() == MessageType.FRAGMENT.toByte()) {
            drop(fragmentPacket, DropReason.NESTED_FRAGMENT);
            return Optional.empty();
        }

        final long now = clock.nowNanos();
        final Accepted accepted = new Accepted();

        groups.compute(fragment.fragmentId(), (id, group) -> {
            if (group == null) {
                if (completedAtNanos.containsKey(id)) {
                    accepted.dropReason = DropReason.ALREADY_COMPLETED;
                    return null;
                }
                group = new ReassemblyGroup(fragment.totalFragments(), fragment.originalType(), now);
            }

            if (group.totalFragments() != fragment.totalFragments()) {
                accepted.dropReason = DropReason.INCONSISTENT_TOTAL;
                return group;
            }

            group.put(fragment.fragmentIndex(), fragment.data());

            if (!group.isComplete()) {
                return group;
            }

            accepted.reassembled = new MeshPacket(group.originalType(), fragmentPacket.sender(), group.assemble());
            completedAtNanos.put(id, now);
            return null;
        });

        if (accepted.dropReason != null) {
            drop(fragmentPacket, accepted.dropReason);
            return Optional.empty();
        }

        if (accepted.reassembled == null) {
            return Optional.empty();
        }

        final MeshPacket original = accepted.reassembled;
        observabilitySink.onReassemblyEvent(new ReassemblyEvent.GroupCompleted(
                wallClock.now(), fragment.fragmentId(), original.sender(),
                fragment.totalFragments(), original.payloadLength()));

        try {
            listener.onReassembledPacket(original);
        } catch (RuntimeException e) {
            reportError("Listener failed on reassembled packet from " + original.sender(), e);
        }

        return Optional.of(original);
    }

    // -------------------------------------------------------------------------
    // Maintenance
    // -------------------------------------------------------------------------

    /**
     * Discard groups older than the reassembly timeout and forget completed
     * ids older than the same timeout.
     *
     * @return number of incomplete groups discarded
     */
    public int expireStaleGroups() {
        final long cutoff = clock.nowNanos() - policy.reassemblyTimeout().toNanos();

        int expired = 0;
        for (Map.Entry<FragmentId, ReassemblyGroup> entry : groups.entrySet()) {
            if (entry.getValue().isOlderThan(cutoff) && groups.remove(entry.getKey(), entry.getValue())) {
                expired++;
            }
        }
        completedAtNanos.values().removeIf(completedAt -> completedAt < cutoff);

        if (expired > 0) {
            observabilitySink.onReassemblyEvent(new ReassemblyEvent.GroupsExpired(wallClock.now(), expired));
        }
        return expired;
    }

    public int pendingGroupCount() {
        return groups.size();
    }

    public boolean hasPendingGroup(FragmentId fragmentId) {
        return groups.containsKey(fragmentId);
    }

    /**
     * Number of distinct fragments buffered for a pending group, or 0.
     */
    public int receivedFragmentCount(FragmentId fragmentId) {
        // compute keeps the read serialized with concurrent inserts
        final int[] count = new int[1];
        groups.computeIfPresent(fragmentId, (id, group) -> {
            count[0] = group.receivedCount();
            return group;
        });
        return count[0];
    }

    private void drop(MeshPacket packet, DropReason reason) {
        observabilitySink.onReassemblyEvent(new ReassemblyEvent.FragmentDropped(
                wallClock.now(), packet.sender(), reason));
    }

    private void reportError(String message, Throwable cause) {
        observabilitySink.onError(new MeshErrorEvent(wallClock.now(), message, cause));
    }

    /**
     * Result holder written inside {@code compute}.
     */
    private static final class Accepted {
        private MeshPacket reassembled;
        private DropReason dropReason;
    }
}
