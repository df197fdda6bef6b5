package com.questrail.mesh.runtime;

import com.questrail.mesh.api.MeshEventListener;
import com.questrail.mesh.api.NullMeshEventListener;
import com.questrail.mesh.codec.impl.DefaultMeshPacketDecoder;
import com.questrail.mesh.codec.impl.DefaultMeshPacketEncoder;
import com.questrail.mesh.config.MeshRuntimeConfig;
import com.questrail.mesh.fragment.FragmentationEngine;
import com.questrail.mesh.internal.time.MonotonicClock;
import com.questrail.mesh.internal.time.MonotonicScheduler;
import com.questrail.mesh.internal.time.ScheduledExecutorScheduler;
import com.questrail.mesh.internal.time.SystemMonotonicClock;
import com.questrail.mesh.internal.time.SystemWallClock;
import com.questrail.mesh.internal.time.WallClock;
import com.questrail.mesh.model.MeshPacket;
import com.questrail.mesh.model.PeerId;
import com.questrail.mesh.observability.MeshObservabilitySink;
import com.questrail.mesh.observability.Slf4jMeshObservabilitySink;
import com.questrail.mesh.peer.AnnouncementHandler;
import com.questrail.mesh.peer.AnnouncementVerifier;
import com.questrail.mesh.peer.InMemoryFingerprintRegistry;
import com.questrail.mesh.peer.PeerDirectory;
import com.questrail.mesh.routing.AnnouncementDecoder;
import com.questrail.mesh.routing.MeshPacketRouter;
import com.questrail.mesh.transport.MeshLink;
import com.questrail.mesh.transport.MeshTransportAdapter;
import com.questrail.mesh.transport.netty.NettyUdpMeshLink;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * MeshRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one mesh node.
 *
 * <pre>
 *   MeshLink ⇄ MeshTransportAdapter → MeshPacketRouter → FragmentationEngine
 *                                                      → PeerDirectory
 *                                                      → MeshEventListener
 * </pre>
 *
 * <p>The runtime owns a single-threaded {@link ScheduledExecutorService} that
 * runs both maintenance sweeps. {@link #stop()} cancels them, closes the link
 * and clears all in-memory state.</p>
 */
public final class MeshRuntime {

    private final MeshTransportAdapter transport;
    private final FragmentationEngine engine;
    private final PeerDirectory directory;
    private final ScheduledExecutorService schedulerExecutor;

    private MeshRuntime(MeshTransportAdapter transport,
                        FragmentationEngine engine,
                        PeerDirectory directory,
                        ScheduledExecutorService schedulerExecutor) {
        this.transport = transport;
        this.engine = engine;
        this.directory = directory;
        this.schedulerExecutor = schedulerExecutor;
    }

    public void start() {
        engine.start();
        directory.start();
        transport.start();
    }

    public void stop() {
        transport.stop();
        engine.stop();
        directory.shutdown();
        directory.clearAllFingerprints();
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Fragment if needed and broadcast.
     *
     * @return number of frames handed to the link
     */
    public int send(MeshPacket packet) {
        return transport.send(packet);
    }

    public PeerDirectory directory() {
        return directory;
    }

    public FragmentationEngine engine() {
        return engine;
    }

    public MeshTransportAdapter transport() {
        return transport;
    }

    /**
     * Directory dump including the link addresses the transport has seen.
     */
    public String debugInfo() {
        return directory.debugInfoWithDeviceAddresses(transport.addressPeerMap());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MeshRuntimeConfig config = MeshRuntimeConfig.builder().build();
        private MeshObservabilitySink observabilitySink = new Slf4jMeshObservabilitySink();
        private MeshEventListener listener = NullMeshEventListener.INSTANCE;
        private AnnouncementDecoder announcementDecoder;
        private AnnouncementVerifier announcementVerifier = AnnouncementVerifier.REJECT_ALL;
        private MeshLink link;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withConfig(MeshRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(MeshObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withListener(MeshEventListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder withAnnouncementDecoder(AnnouncementDecoder decoder) {
            this.announcementDecoder = decoder;
            return this;
        }

        public Builder withAnnouncementVerifier(AnnouncementVerifier verifier) {
            this.announcementVerifier = verifier;
            return this;
        }

        /**
         * Use a custom link instead of the Netty UDP link built from the
         * config's bind address and neighbours.
         */
        public Builder withLink(MeshLink link) {
            this.link = link;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public MeshRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(announcementDecoder, "announcementDecoder");
            Objects.requireNonNull(announcementVerifier, "announcementVerifier");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");

            // 1. Scheduling
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "mesh-maintenance");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Core components
            FragmentationEngine engine = new FragmentationEngine(
                    config.fragmentation(), clock, scheduler, wallClock, observabilitySink);
            PeerDirectory directory = new PeerDirectory(
                    config.liveness(), new InMemoryFingerprintRegistry(), clock, scheduler, wallClock, observabilitySink);

            // 3. Routing; the router alone delivers packets to the listener
            MeshPacketRouter router = new MeshPacketRouter(
                    engine,
                    directory,
                    new AnnouncementHandler(directory, announcementVerifier),
                    announcementDecoder,
                    wallClock,
                    observabilitySink);
            router.setListener(listener);

            // 4. Transport
            MeshLink effectiveLink = (link != null)
                    ? link
                    : new NettyUdpMeshLink(config.bindAddress(), config.neighbours());
            MeshTransportAdapter transport = new MeshTransportAdapter(
                    effectiveLink,
                    new DefaultMeshPacketDecoder(),
                    new DefaultMeshPacketEncoder(),
                    engine,
                    router,
                    wallClock,
                    observabilitySink);

            // 5. Removed peers also leave the transport's address map
            directory.setListener(new AddressForgettingListener(listener, transport));

            return new MeshRuntime(transport, engine, directory, schedulerExec);
        }
    }

    private static final class AddressForgettingListener implements MeshEventListener {

        private final MeshEventListener delegate;
        private final MeshTransportAdapter transport;

        AddressForgettingListener(MeshEventListener delegate, MeshTransportAdapter transport) {
            this.delegate = Objects.requireNonNullElse(delegate, NullMeshEventListener.INSTANCE);
            this.transport = transport;
        }

        @Override
        public void onReassembledPacket(MeshPacket packet) {
            delegate.onReassembledPacket(packet);
        }

        @Override
        public void onPeerListUpdated(List<PeerId> activePeerIds) {
            delegate.onPeerListUpdated(activePeerIds);
        }

        @Override
        public void onPeerRemoved(PeerId peerId) {
            transport.forgetPeer(peerId);
            delegate.onPeerRemoved(peerId);
        }
    }
}
