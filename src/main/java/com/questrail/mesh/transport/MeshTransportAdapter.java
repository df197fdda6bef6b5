package com.questrail.mesh.transport;

import com.questrail.mesh.codec.MeshPacketDecoder;
import com.questrail.mesh.codec.MeshPacketEncoder;
import com.questrail.mesh.fragment.FragmentationEngine;
import com.questrail.mesh.internal.time.WallClock;
import com.questrail.mesh.model.MeshPacket;
import com.questrail.mesh.observability.MeshErrorEvent;
import com.questrail.mesh.observability.MeshObservabilitySink;
import com.questrail.mesh.observability.NullObservabilitySink;
import com.questrail.mesh.model.PeerId;
import com.questrail.mesh.routing.MeshPacketRouter;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * MeshTransportAdapter
 * =============================================================================
 * Joins a {@link MeshLink} to the mesh core.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   MeshLink.onFrame
 *        → MeshPacketDecoder      (undecodable frames are dropped)
 *            → MeshPacketRouter
 * </pre>
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   MeshPacket
 *        → FragmentationEngine.fragment
 *            → MeshPacketEncoder (per piece)
 *                → MeshLink.broadcast
 * </pre>
 *
 * <p>The adapter adds no retries or timing of its own. It remembers which
 * peer id was last heard at each link address; the map is diagnostic only.
 * It holds at most {@link #MAX_TRACKED_ADDRESSES} addresses and drops a
 * peer's entries through {@link #forgetPeer(PeerId)}.</p>
 *
 * <p>A failure while routing one frame is reported to the sink and never
 * reaches the link, so the next frame is still processed.</p>
 */
public final class MeshTransportAdapter implements MeshLinkListener {

    /** Upper bound on remembered link addresses. */
    public static final int MAX_TRACKED_ADDRESSES = 1024;

    private final MeshLink link;
    private final MeshPacketDecoder decoder;
    private final MeshPacketEncoder encoder;
    private final FragmentationEngine engine;
    private final MeshPacketRouter router;
    private final WallClock wallClock;
    private final MeshObservabilitySink observabilitySink;

    private final Map<String, PeerId> addressPeerMap = new ConcurrentHashMap<>();

    private volatile boolean linkUp;

    public MeshTransportAdapter(MeshLink link,
                                MeshPacketDecoder decoder,
                                MeshPacketEncoder encoder,
                                FragmentationEngine engine,
                                MeshPacketRouter router,
                                WallClock wallClock,
                                MeshObservabilitySink observabilitySink) {
        this.link = Objects.requireNonNull(link, "link");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.router = Objects.requireNonNull(router, "router");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.link.setListener(this);
    }

    public void start() {
        link.start();
    }

    public void stop() {
        link.stop();
    }

    /**
     * Fragment if needed, encode and broadcast.
     *
     * @return number of frames handed to the link
     */
    public int send(MeshPacket packet) {
        Objects.requireNonNull(packet, "packet");

        List<MeshPacket> pieces = engine.fragment(packet);
        for (MeshPacket piece : pieces) {
            link.broadcast(encoder.encode(piece));
        }
        return pieces.size();
    }

    public boolean isLinkUp() {
        return linkUp;
    }

    /**
     * Snapshot of link address to the peer id last heard there.
     */
    public Map<String, PeerId> addressPeerMap() {
        return Map.copyOf(addressPeerMap);
    }

    /**
     * Forget every link address last heard from {@code peerId}.
     */
    public void forgetPeer(PeerId peerId) {
        Objects.requireNonNull(peerId, "peerId");
        addressPeerMap.values().removeIf(peerId::equals);
    }

    // -------------------------------------------------------------------------
    // MeshLinkListener
    // -------------------------------------------------------------------------

    @Override
    public void onLinkUp() {
        linkUp = true;
    }

    @Override
    public void onLinkDown(Throwable cause) {
        linkUp = false;
        if (cause != null) {
            observabilitySink.onError(new MeshErrorEvent(wallClock.now(), "Mesh link went down", cause));
        }
    }

    @Override
    public void onFrame(String linkAddress, byte[] frame) {
        Objects.requireNonNull(linkAddress, "linkAddress");
        Objects.requireNonNull(frame, "frame");

        Optional<MeshPacket> packet = decoder.decode(frame);
        if (packet.isEmpty()) {
            return;
        }

        rememberAddress(linkAddress, packet.get().sender());

        try {
            router.route(packet.get());
        } catch (RuntimeException e) {
            observabilitySink.onError(new MeshErrorEvent(
                    wallClock.now(), "Failed to route frame from " + linkAddress, e));
        }
    }

    private void rememberAddress(String linkAddress, PeerId sender) {
        if (addressPeerMap.size() >= MAX_TRACKED_ADDRESSES && !addressPeerMap.containsKey(linkAddress)) {
            return;
        }
        addressPeerMap.put(linkAddress, sender);
    }
}
