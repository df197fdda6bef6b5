/**
 * Inbound packet classification.
 *
 * <p>{@link com.questrail.mesh.routing.MeshPacketRouter} sits between the
 * transport adapter and the core components; it never touches bytes on the
 * wire.</p>
 */
package com.questrail.mesh.routing;
