package com.questrail.mesh.routing;

import com.questrail.mesh.api.MeshEventListener;
import com.questrail.mesh.api.NullMeshEventListener;
import com.questrail.mesh.fragment.FragmentationEngine;
import com.questrail.mesh.internal.time.SystemWallClock;
import com.questrail.mesh.internal.time.WallClock;
import com.questrail.mesh.model.MeshPacket;
import com.questrail.mesh.model.MessageType;
import com.questrail.mesh.observability.MeshErrorEvent;
import com.questrail.mesh.observability.MeshObservabilitySink;
import com.questrail.mesh.observability.NullObservabilitySink;
import com.questrail.mesh.peer.AnnouncementHandler;
import com.questrail.mesh.peer.PeerAnnouncement;
import com.questrail.mesh.peer.PeerDirectory;

import java.util.Objects;
import java.util.Optional;

/**
 * MeshPacketRouter
 * =============================================================================
 * Classifies decoded inbound packets and hands them to the component that
 * owns them.
 *
 * <pre>
 *   MeshPacket
 *        → FRAGMENT  → FragmentationEngine.acceptFragment
 *                          → completed original is dispatched once,
 *                            never fed back into the engine
 *        → ANNOUNCE  → AnnouncementDecoder → AnnouncementHandler
 *        → LEAVE     → PeerDirectory.removePeer(sender)
 *        → other     → MeshEventListener.onReassembledPacket
 * </pre>
 *
 * <p>Every packet except LEAVE refreshes the sender's last-seen time.
 * The router is the only path that delivers packets to the application
 * listener; the engine's own listener slot stays unused when it is wired
 * through a router.</p>
 */
public final class MeshPacketRouter {

    private final FragmentationEngine engine;
    private final PeerDirectory directory;
    private final AnnouncementHandler announcementHandler;
    private final AnnouncementDecoder announcementDecoder;
    private final WallClock wallClock;
    private final MeshObservabilitySink observabilitySink;

    private volatile MeshEventListener listener = NullMeshEventListener.INSTANCE;

    public MeshPacketRouter(FragmentationEngine engine,
                            PeerDirectory directory,
                            AnnouncementHandler announcementHandler,
                            AnnouncementDecoder announcementDecoder,
                            WallClock wallClock,
                            MeshObservabilitySink observabilitySink) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.announcementHandler = Objects.requireNonNull(announcementHandler, "announcementHandler");
        this.announcementDecoder = Objects.requireNonNull(announcementDecoder, "announcementDecoder");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public MeshPacketRouter(FragmentationEngine engine,
                            PeerDirectory directory,
                            AnnouncementHandler announcementHandler,
                            AnnouncementDecoder announcementDecoder) {
        this(engine, directory, announcementHandler, announcementDecoder,
                SystemWallClock.INSTANCE, NullObservabilitySink.INSTANCE);
    }

    public void setListener(MeshEventListener listener) {
        this.listener = Objects.requireNonNullElse(listener, NullMeshEventListener.INSTANCE);
    }

    public void route(MeshPacket packet) {
        Objects.requireNonNull(packet, "packet");
        dispatch(packet, false);
    }

    private void dispatch(MeshPacket packet, boolean reassembled) {
        Optional<MessageType> type = packet.messageType();
        if (type.isPresent() && type.get() == MessageType.LEAVE) {
            directory.removePeer(packet.sender());
            return;
        }

        if (!reassembled) {
            directory.updatePeerLastSeen(packet.sender());
        }

        if (type.isEmpty()) {
            deliver(packet);
            return;
        }

        switch (type.get()) {
            case FRAGMENT:
                if (reassembled) {
                    // the engine rejects nested groups; a fragment here is not re-entered
                    break;
                }
                engine.acceptFragment(packet).ifPresent(original -> dispatch(original, true));
                break;
            case ANNOUNCE:
                Optional<PeerAnnouncement> announcement = announcementDecoder.decode(packet);
                announcement.ifPresent(announcementHandler::handle);
                break;
            default:
                deliver(packet);
                break;
        }
    }

    private void deliver(MeshPacket packet) {
        try {
            listener.onReassembledPacket(packet);
        } catch (RuntimeException e) {
            observabilitySink.onError(new MeshErrorEvent(
                    wallClock.now(), "Listener failed on packet from " + packet.sender(), e));
        }
    }
}
