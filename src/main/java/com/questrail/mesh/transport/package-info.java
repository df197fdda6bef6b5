/**
 * Mesh link ports and the adapter that joins them to the core.
 * =============================================================================
 *
 * <p>Everything above {@link com.questrail.mesh.transport.MeshLink} sees only
 * raw frames as {@code byte[]}, link addresses as strings and up/down
 * notifications. Concrete links (the Netty UDP link in
 * {@code transport.netty}, a BLE stack, test doubles) do I/O only: they never
 * decode frames, fragment packets or touch peer state.</p>
 */
package com.questrail.mesh.transport;
