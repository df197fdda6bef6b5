package com.questrail.mesh.codec;

import com.questrail.mesh.model.MeshPacket;

import java.util.Optional;

/**
 * MeshPacketDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between raw link bytes and a structured {@link MeshPacket}.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Validating the frame header and declared length</li>
 *   <li>Detecting truncation or trailing garbage</li>
 *   <li>Constructing a {@link MeshPacket} on success</li>
 * </ul>
 *
 * <p>It does not interpret payloads, decode fragment sub-payloads, or touch
 * peer state. Input comes from untrusted peers: every failure is reported as
 * {@link Optional#empty()} and the frame is dropped.</p>
 */
public interface MeshPacketDecoder
{
    /**
     * Decode exactly one frame as delivered by the link.
     *
     * @param frame raw bytes received from the link
     * @return the decoded packet, or empty if the frame is malformed
     */
    Optional<MeshPacket> decode(byte[] frame);
}
