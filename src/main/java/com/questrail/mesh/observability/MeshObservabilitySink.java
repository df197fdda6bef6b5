package com.questrail.mesh.observability;

/**
 * Receives observability events from the mesh core.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Core components never log directly; they report here. Sinks must be
 * thread-safe: events arrive from the receive path and from maintenance
 * threads concurrently.</p>
 */
public interface MeshObservabilitySink {
    /**
     * Called for fragmentation and reassembly activity.
     * @param event the reassembly event
     */
    void onReassemblyEvent(ReassemblyEvent event);

    /**
     * Called for peer lifecycle changes.
     * @param event the peer event
     */
    void onPeerEvent(PeerEvent event);

    /**
     * Called when an error or anomaly occurs (listener failure, failed sweep).
     * @param event the error event
     */
    void onError(MeshErrorEvent event);
}
