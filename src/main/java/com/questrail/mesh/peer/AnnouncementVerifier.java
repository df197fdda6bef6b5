package com.questrail.mesh.peer;

/**
 * Checks the signature of a keyed announcement.
 *
 * <p>The cryptography lives outside the mesh core; the directory only
 * consumes the boolean result.</p>
 */
@FunctionalInterface
public interface AnnouncementVerifier
{
    /**
     * @return {@code true} if the announcement's signature is valid for its
     *         signing key
     */
    boolean verify(PeerAnnouncement announcement);

    /**
     * Verifier that rejects everything. Peers stay unverified.
     */
    AnnouncementVerifier REJECT_ALL = announcement -> false;
}
