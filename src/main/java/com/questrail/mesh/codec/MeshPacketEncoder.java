package com.questrail.mesh.codec;

import com.questrail.mesh.model.MeshPacket;

/**
 * Outbound boundary: turns a {@link MeshPacket} into link-ready bytes.
 *
 * <p>The encoder never decides whether a packet must be fragmented; oversized
 * packets are split by the fragmentation engine before they reach it.</p>
 */
public interface MeshPacketEncoder
{
    byte[] encode(MeshPacket packet);
}
