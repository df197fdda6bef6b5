package com.questrail.mesh.transport;

/**
 * Callback sink for {@link MeshLink}.
 *
 * <p>Callbacks are serialized by the implementation; Netty links deliver them
 * on the channel's event loop.</p>
 */
public interface MeshLinkListener
{
    void onLinkUp();

    /**
     * @param cause failure that took the link down, or {@code null} on an
     *              orderly stop
     */
    void onLinkDown(Throwable cause);

    /**
     * One raw frame from a neighbour.
     *
     * @param linkAddress link-level address of the neighbour (BLE device
     *                    address or socket address), used for diagnostics only
     * @param frame       encoded frame bytes, owned by the callee
     */
    void onFrame(String linkAddress, byte[] frame);
}
