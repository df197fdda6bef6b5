package com.questrail.mesh.codec.impl;

import com.questrail.mesh.model.MeshPacket;
import com.questrail.mesh.model.MessageType;
import com.questrail.mesh.model.PeerId;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultMeshPacketDecoderTest
 * -----------------------------------------------------------------------------
 * Frame decoding and drop-on-link-defect behaviour.
 */
final class DefaultMeshPacketDecoderTest
{
    private final DefaultMeshPacketDecoder decoder = new DefaultMeshPacketDecoder();
    private final DefaultMeshPacketEncoder encoder = new DefaultMeshPacketEncoder();

    private static final PeerId SENDER = PeerId.of("0102030405060708");

    @Test
    void decodeExtractsFields()
    {
        byte[] frame = {
                0x01,
                0x02,
                1, 2, 3, 4, 5, 6, 7, 8,
                0x00, 0x03,
                10, 20, 30 };

        MeshPacket packet = decoder.decode(frame).orElseThrow();

        assertEquals(MessageType.MESSAGE, packet.messageType().orElseThrow());
        assertEquals(SENDER, packet.sender());
        assertArrayEquals(new byte[] { 10, 20, 30 }, packet.payload());
    }

    @Test
    void decodeAcceptsEncoderOutput()
    {
        MeshPacket packet = new MeshPacket(MessageType.ANNOUNCE, SENDER, "alice".getBytes());
        assertEquals(packet, decoder.decode(encoder.encode(packet)).orElseThrow());
    }

    @Test
    void decodeRejectsShortFrame()
    {
        assertTrue(decoder.decode(new byte[MeshFrameLayout.HEADER_SIZE - 1]).isEmpty());
        assertTrue(decoder.decode(null).isEmpty());
    }

    @Test
    void decodeRejectsUnknownVersion()
    {
        byte[] frame = encoder.encode(new MeshPacket(MessageType.MESSAGE, SENDER, new byte[] { 1 }));
        frame[0] = 0x02;
        assertTrue(decoder.decode(frame).isEmpty());
    }

    @Test
    void decodeRejectsLengthMismatch()
    {
        byte[] frame = encoder.encode(new MeshPacket(MessageType.MESSAGE, SENDER, new byte[] { 1, 2 }));

        assertTrue(decoder.decode(Arrays.copyOf(frame, frame.length - 1)).isEmpty());
        assertTrue(decoder.decode(Arrays.copyOf(frame, frame.length + 1)).isEmpty());
    }
}
