package com.questrail.mesh.codec.impl;

import com.questrail.mesh.codec.MeshPacketDecoder;
import com.questrail.mesh.model.MeshPacket;
import com.questrail.mesh.model.PeerId;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Optional;

/**
 * DefaultMeshPacketDecoder
 * -----------------------------------------------------------------------------
 * Concrete {@link MeshPacketDecoder} for the {@link MeshFrameLayout} format.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>Header length check</li>
 *   <li>Version check</li>
 *   <li>Declared payload length must match the remaining bytes exactly</li>
 *   <li>Structural extraction into {@link MeshPacket}</li>
 * </ol>
 */
public final class DefaultMeshPacketDecoder implements MeshPacketDecoder
{
    @Override
    public Optional<MeshPacket> decode(byte[] frame)
    {
        try {
            return Optional.of(parse(frame));
        }
        catch (FrameFormatException e) {
            // Link-level defect -> drop frame
            return Optional.empty();
        }
    }

    private static MeshPacket parse(byte[] frame) throws FrameFormatException
    {
        if (frame == null || frame.length < MeshFrameLayout.HEADER_SIZE) {
            throw new FrameFormatException("Frame shorter than header");
        }

        final ByteBuffer buf = ByteBuffer.wrap(frame);

        final int version = buf.get() & 0xFF;
        if (version != MeshFrameLayout.VERSION) {
            throw new FrameFormatException("Unsupported frame version " + version);
        }

        final byte type = buf.get();

        final byte[] sender = new byte[PeerId.LENGTH];
        buf.get(sender);

        final int declared = Short.toUnsignedInt(buf.getShort());
        if (declared != buf.remaining()) {
            throw new FrameFormatException(
                    "Declared payload length " + declared + " but " + buf.remaining() + " bytes remain");
        }

        final byte[] payload = Arrays.copyOfRange(frame, MeshFrameLayout.HEADER_SIZE, frame.length);
        return new MeshPacket(type, PeerId.fromBytes(sender), payload);
    }
}
