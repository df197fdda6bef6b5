package com.questrail.mesh.transport;

import com.questrail.mesh.RecordingMeshEventListener;
import com.questrail.mesh.codec.impl.DefaultMeshPacketDecoder;
import com.questrail.mesh.codec.impl.DefaultMeshPacketEncoder;
import com.questrail.mesh.config.FragmentationPolicy;
import com.questrail.mesh.config.PeerLivenessPolicy;
import com.questrail.mesh.fragment.FragmentationEngine;
import com.questrail.mesh.internal.time.SystemWallClock;
import com.questrail.mesh.model.MeshPacket;
import com.questrail.mesh.model.MessageType;
import com.questrail.mesh.model.PeerId;
import com.questrail.mesh.observability.MeshErrorEvent;
import com.questrail.mesh.observability.RecordingObservabilitySink;
import com.questrail.mesh.peer.AnnouncementHandler;
import com.questrail.mesh.peer.AnnouncementVerifier;
import com.questrail.mesh.peer.InMemoryFingerprintRegistry;
import com.questrail.mesh.peer.PeerDirectory;
import com.questrail.mesh.routing.MeshPacketRouter;
import com.questrail.mesh.time.DeterministicScheduler;
import com.questrail.mesh.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MeshTransportAdapterTest
 * -----------------------------------------------------------------------------
 * Frame decoding, routing and outbound fragmentation over a fake link.
 */
class MeshTransportAdapterTest {

    private static final PeerId ALICE = PeerId.of("00000000000000a1");
    private static final PeerId BOB = PeerId.of("00000000000000b2");
    private static final PeerId SELF = PeerId.of("00000000000000ff");

    private final DefaultMeshPacketEncoder encoder = new DefaultMeshPacketEncoder();
    private final DefaultMeshPacketDecoder decoder = new DefaultMeshPacketDecoder();

    private FragmentationEngine engine;
    private PeerDirectory directory;
    private FakeMeshLink link;
    private RecordingMeshEventListener listener;
    private RecordingObservabilitySink sink;
    private MeshTransportAdapter adapter;

    @BeforeEach
    void setUp() {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        DeterministicScheduler scheduler = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();

        engine = new FragmentationEngine(FragmentationPolicy.defaults(), clock, scheduler, sink);
        directory = new PeerDirectory(PeerLivenessPolicy.defaults(), new InMemoryFingerprintRegistry(),
                clock, scheduler, sink);
        MeshPacketRouter router = new MeshPacketRouter(engine, directory,
                new AnnouncementHandler(directory, AnnouncementVerifier.REJECT_ALL), packet -> Optional.empty());
        listener = new RecordingMeshEventListener();
        router.setListener(listener);

        link = new FakeMeshLink();
        adapter = new MeshTransportAdapter(link, decoder, encoder, engine, router, SystemWallClock.INSTANCE, sink);
    }

    @Test
    void linkLifecycleIsTracked() {
        adapter.start();
        assertTrue(adapter.isLinkUp());

        adapter.stop();
        assertFalse(adapter.isLinkUp());
        assertFalse(sink.hasEventOfType(MeshErrorEvent.class));
    }

    @Test
    void linkFailureIsReported() {
        adapter.start();
        link.failLink(new IOException("radio off"));

        assertFalse(adapter.isLinkUp());
        assertTrue(sink.hasEventOfType(MeshErrorEvent.class));
    }

    @Test
    void inboundFrameIsRoutedAndAddressRecorded() {
        MeshPacket message = new MeshPacket(MessageType.MESSAGE, ALICE, new byte[] { 1, 2 });

        link.injectFrame("AA:BB:CC:DD:EE:01", encoder.encode(message));

        assertEquals(List.of(message), listener.packets());
        assertEquals(Map.of("AA:BB:CC:DD:EE:01", ALICE), adapter.addressPeerMap());
    }

    @Test
    void undecodableFrameIsDropped() {
        link.injectFrame("AA:BB:CC:DD:EE:01", new byte[] { 0x01, 0x02, 0x03 });

        assertTrue(listener.packets().isEmpty());
        assertTrue(adapter.addressPeerMap().isEmpty());
    }

    @Test
    void smallPacketIsBroadcastAsOneFrame() {
        MeshPacket message = new MeshPacket(MessageType.MESSAGE, SELF, new byte[100]);

        assertEquals(1, adapter.send(message));
        assertEquals(message, decoder.decode(link.broadcast().get(0)).orElseThrow());
    }

    @Test
    void thresholdCountsPayloadBytesNotFrameBytes() {
        MeshPacket atThreshold = new MeshPacket(MessageType.MESSAGE, SELF,
                new byte[FragmentationPolicy.DEFAULT_THRESHOLD_BYTES]);

        assertEquals(1, adapter.send(atThreshold));
        assertEquals(FragmentationPolicy.DEFAULT_THRESHOLD_BYTES + 12, link.broadcast().get(0).length);
        assertEquals(atThreshold, decoder.decode(link.broadcast().get(0)).orElseThrow());
    }

    @Test
    void largePacketIsBroadcastAsFragmentsThatFitTheLink() {
        MeshPacket message = new MeshPacket(MessageType.MESSAGE, SELF, new byte[1500]);

        assertEquals(4, adapter.send(message));
        for (byte[] frame : link.broadcast()) {
            assertTrue(frame.length <= FragmentationPolicy.DEFAULT_THRESHOLD_BYTES);
            assertTrue(decoder.decode(frame).orElseThrow().isFragment());
        }
    }

    @Test
    void broadcastFramesReassembleOnTheReceivingSide() {
        MeshPacket message = new MeshPacket(MessageType.MESSAGE, ALICE, new byte[3000]);
        adapter.send(message);

        for (byte[] frame : link.broadcast()) {
            link.injectFrame("AA:BB:CC:DD:EE:01", frame);
        }

        assertEquals(List.of(message), listener.packets());
    }

    @Test
    void routingFailureIsReportedAndNextFrameStillRouted() {
        MeshPacketRouter router = new MeshPacketRouter(engine, directory,
                new AnnouncementHandler(directory, AnnouncementVerifier.REJECT_ALL),
                packet -> {
                    throw new IllegalStateException("truncated announcement");
                });
        router.setListener(listener);
        FakeMeshLink otherLink = new FakeMeshLink();
        new MeshTransportAdapter(otherLink, decoder, encoder, engine, router, SystemWallClock.INSTANCE, sink);

        MeshPacket announce = new MeshPacket(MessageType.ANNOUNCE, ALICE, new byte[] { 9 });
        MeshPacket message = new MeshPacket(MessageType.MESSAGE, ALICE, new byte[] { 1 });

        assertDoesNotThrow(() -> otherLink.injectFrame("AA:BB:CC:DD:EE:01", encoder.encode(announce)));
        otherLink.injectFrame("AA:BB:CC:DD:EE:01", encoder.encode(message));

        assertEquals(List.of(message), listener.packets());
        List<MeshErrorEvent> errors = sink.eventsOfType(MeshErrorEvent.class);
        assertEquals(1, errors.size());
        assertInstanceOf(IllegalStateException.class, errors.get(0).cause());
    }

    @Test
    void forgetPeerDropsItsAddresses() {
        MeshPacket fromAlice = new MeshPacket(MessageType.MESSAGE, ALICE, new byte[] { 1 });
        MeshPacket fromBob = new MeshPacket(MessageType.MESSAGE, BOB, new byte[] { 2 });
        link.injectFrame("AA:BB:CC:DD:EE:01", encoder.encode(fromAlice));
        link.injectFrame("AA:BB:CC:DD:EE:02", encoder.encode(fromAlice));
        link.injectFrame("AA:BB:CC:DD:EE:03", encoder.encode(fromBob));

        adapter.forgetPeer(ALICE);

        assertEquals(Map.of("AA:BB:CC:DD:EE:03", BOB), adapter.addressPeerMap());
    }

    @Test
    void addressMapIsBounded() {
        byte[] frame = encoder.encode(new MeshPacket(MessageType.MESSAGE, ALICE, new byte[] { 1 }));
        for (int i = 0; i < MeshTransportAdapter.MAX_TRACKED_ADDRESSES + 50; i++) {
            link.injectFrame("10.0.0." + i + ":9000", frame);
        }

        assertEquals(MeshTransportAdapter.MAX_TRACKED_ADDRESSES, adapter.addressPeerMap().size());
        assertEquals(MeshTransportAdapter.MAX_TRACKED_ADDRESSES + 50, listener.packets().size());

        // a known address is still refreshed when the map is full
        byte[] fromBob = encoder.encode(new MeshPacket(MessageType.MESSAGE, BOB, new byte[] { 2 }));
        link.injectFrame("10.0.0.0:9000", fromBob);
        assertEquals(BOB, adapter.addressPeerMap().get("10.0.0.0:9000"));
    }
}
