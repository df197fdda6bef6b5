package com.questrail.mesh.routing;

import com.questrail.mesh.model.MeshPacket;
import com.questrail.mesh.peer.PeerAnnouncement;

import java.util.Optional;

/**
 * Parses the payload of an ANNOUNCE packet.
 *
 * <p>The announcement payload format belongs to the application protocol,
 * not to the mesh core, so the decoder is supplied by the caller.</p>
 */
@FunctionalInterface
public interface AnnouncementDecoder
{
    /**
     * @return the announcement, or empty if the payload cannot be parsed
     */
    Optional<PeerAnnouncement> decode(MeshPacket announcePacket);
}
