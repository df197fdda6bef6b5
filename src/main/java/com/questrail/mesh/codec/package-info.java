/**
 * Mesh frame codec.
 *
 * <p>Defines the byte-level boundary between a mesh link and the packet model:</p>
 *
 * <pre>
 *   byte[] frame
 *        → MeshPacketDecoder
 *            → MeshPacket
 *                → MeshPacketRouter
 * </pre>
 *
 * <p>Only the outer frame is handled here. Payload meaning, including the
 * fragment sub-payload, belongs to the layers above.</p>
 */
package com.questrail.mesh.codec;
