package com.questrail.mesh.codec.impl;

import com.questrail.mesh.codec.MeshPacketEncoder;
import com.questrail.mesh.model.MeshPacket;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Concrete {@link MeshPacketEncoder} for the {@link MeshFrameLayout} format.
 */
public final class DefaultMeshPacketEncoder implements MeshPacketEncoder
{
    @Override
    public byte[] encode(MeshPacket packet)
    {
        Objects.requireNonNull(packet, "packet");

        final byte[] payload = packet.payload();
        if (payload.length > MeshFrameLayout.MAX_PAYLOAD) {
            throw new IllegalArgumentException(
                    "Payload of " + payload.length + " bytes exceeds frame limit; fragment it first");
        }

        final ByteBuffer buf = ByteBuffer.allocate(MeshFrameLayout.HEADER_SIZE + payload.length);
        buf.put((byte) MeshFrameLayout.VERSION);
        buf.put(packet.type());
        buf.put(packet.sender().toBytes());
        buf.putShort((short) payload.length);
        buf.put(payload);
        return buf.array();
    }
}
