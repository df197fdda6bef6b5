package com.questrail.mesh.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MeshPacketTest {

    private static final PeerId SENDER = PeerId.of("00000000000000aa");

    @Test
    void payloadIsDefensivelyCopied() {
        byte[] data = { 1, 2, 3 };
        MeshPacket packet = new MeshPacket(MessageType.MESSAGE, SENDER, data);

        data[0] = 99;
        assertEquals(1, packet.payload()[0]);

        packet.payload()[1] = 99;
        assertEquals(2, packet.payload()[1]);
    }

    @Test
    void unknownTypeByteIsPreserved() {
        MeshPacket packet = new MeshPacket((byte) 0x55, SENDER, new byte[0]);
        assertEquals((byte) 0x55, packet.type());
        assertTrue(packet.messageType().isEmpty());
        assertFalse(packet.isFragment());
    }

    @Test
    void fragmentTypeIsRecognized() {
        assertTrue(new MeshPacket(MessageType.FRAGMENT, SENDER, new byte[0]).isFragment());
        assertEquals(MessageType.FRAGMENT, MessageType.fromValue((byte) 0x20).orElseThrow());
    }

    @Test
    void equalityIsStructural() {
        assertEquals(
                new MeshPacket(MessageType.MESSAGE, SENDER, new byte[] { 7 }),
                new MeshPacket(MessageType.MESSAGE, SENDER, new byte[] { 7 }));
        assertNotEquals(
                new MeshPacket(MessageType.MESSAGE, SENDER, new byte[] { 7 }),
                new MeshPacket(MessageType.ANNOUNCE, SENDER, new byte[] { 7 }));
    }
}
