package com.questrail.mesh.transport;

/**
 * MeshLink
 * -----------------------------------------------------------------------------
 * Port for the radio (or simulated) link that carries encoded mesh frames.
 *
 * <p>A mesh link is a broadcast medium: every frame goes to every neighbour in
 * range and relaying is decided above this port. Implementations may be backed
 * by a BLE stack, a Netty UDP socket or a test harness.</p>
 */
public interface MeshLink
{
    /**
     * Start the link and begin receiving frames.
     *
     * <p>On success the link notifies {@link MeshLinkListener#onLinkUp()} once
     * per transition.</p>
     */
    void start();

    /**
     * Stop the link and release its resources. Notifies
     * {@link MeshLinkListener#onLinkDown(Throwable)} at most once per transition.
     */
    void stop();

    /**
     * Hand one encoded frame to every neighbour. Frames sent while the link is
     * down are dropped.
     */
    void broadcast(byte[] frame);

    /**
     * Must be called before {@link #start()}.
     */
    void setListener(MeshLinkListener listener);
}
