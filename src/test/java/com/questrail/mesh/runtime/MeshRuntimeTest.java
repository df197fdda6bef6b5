package com.questrail.mesh.runtime;

import com.questrail.mesh.RecordingMeshEventListener;
import com.questrail.mesh.codec.impl.DefaultMeshPacketEncoder;
import com.questrail.mesh.model.MeshPacket;
import com.questrail.mesh.model.MessageType;
import com.questrail.mesh.model.PeerId;
import com.questrail.mesh.observability.RecordingObservabilitySink;
import com.questrail.mesh.peer.PeerAnnouncement;
import com.questrail.mesh.transport.FakeMeshLink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MeshRuntimeTest
 * -----------------------------------------------------------------------------
 * Smoke test of the composition root over a fake link.
 */
class MeshRuntimeTest {

    private static final PeerId ALICE = PeerId.of("00000000000000a1");

    private final DefaultMeshPacketEncoder encoder = new DefaultMeshPacketEncoder();

    private FakeMeshLink link;
    private RecordingMeshEventListener listener;
    private MeshRuntime runtime;

    @BeforeEach
    void setUp() {
        link = new FakeMeshLink();
        listener = new RecordingMeshEventListener();
        runtime = MeshRuntime.builder()
                .withLink(link)
                .withListener(listener)
                .withObservabilitySink(new RecordingObservabilitySink())
                .withAnnouncementDecoder(packet -> Optional.of(PeerAnnouncement.plain(
                        packet.sender(), new String(packet.payload(), StandardCharsets.UTF_8))))
                .build();
        runtime.start();
    }

    @AfterEach
    void tearDown() {
        runtime.stop();
    }

    @Test
    void announcedPeerAppearsInDirectory() {
        link.injectFrame("AA:BB:CC:DD:EE:01",
                encoder.encode(new MeshPacket(MessageType.ANNOUNCE, ALICE, "alice".getBytes(StandardCharsets.UTF_8))));

        assertTrue(runtime.directory().isPeerActive(ALICE));
        assertEquals(List.of(List.of(ALICE)), listener.peerListUpdates());
        assertTrue(runtime.debugInfo().contains("AA:BB:CC:DD:EE:01 -> Peer: " + ALICE + " (alice)"));
    }

    @Test
    void largeMessageIsDeliveredExactlyOnce() {
        MeshPacket message = new MeshPacket(MessageType.MESSAGE, ALICE, new byte[5000]);
        runtime.send(message);

        List<byte[]> frames = List.copyOf(link.broadcast());
        for (int i = frames.size() - 1; i >= 0; i--) {
            link.injectFrame("AA:BB:CC:DD:EE:01", frames.get(i));
        }

        assertEquals(List.of(message), listener.packets());
    }

    @Test
    void leavingPeerIsForgottenByTheTransport() {
        link.injectFrame("AA:BB:CC:DD:EE:01",
                encoder.encode(new MeshPacket(MessageType.ANNOUNCE, ALICE, "alice".getBytes(StandardCharsets.UTF_8))));
        assertEquals(ALICE, runtime.transport().addressPeerMap().get("AA:BB:CC:DD:EE:01"));

        link.injectFrame("AA:BB:CC:DD:EE:01", encoder.encode(new MeshPacket(MessageType.LEAVE, ALICE, new byte[0])));

        assertTrue(runtime.transport().addressPeerMap().isEmpty());
        assertEquals(List.of(ALICE), listener.removed());
    }

    @Test
    void stopClearsState() {
        link.injectFrame("AA:BB:CC:DD:EE:01",
                encoder.encode(new MeshPacket(MessageType.ANNOUNCE, ALICE, "alice".getBytes(StandardCharsets.UTF_8))));

        runtime.stop();

        assertTrue(runtime.directory().allNicknames().isEmpty());
        assertEquals(0, runtime.engine().pendingGroupCount());
    }

    @Test
    void builderRequiresAnnouncementDecoder() {
        assertThrows(NullPointerException.class, () -> MeshRuntime.builder().withLink(new FakeMeshLink()).build());
    }
}
