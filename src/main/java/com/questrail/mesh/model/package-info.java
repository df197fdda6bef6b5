/**
 * Mesh packet model.
 *
 * <p>Value types shared by every layer of the mesh core: {@link
 * com.questrail.mesh.model.MeshPacket}, {@link com.questrail.mesh.model.PeerId},
 * and the fragment sub-payload. This package has no knowledge of transports,
 * scheduling or peer state.</p>
 */
package com.questrail.mesh.model;
