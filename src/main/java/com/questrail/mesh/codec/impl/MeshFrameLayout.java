package com.questrail.mesh.codec.impl;

import com.questrail.mesh.model.PeerId;

/**
 * MeshFrameLayout
 * -----------------------------------------------------------------------------
 * Outer frame layout shared by encoder and decoder (big-endian):
 *
 * <pre>
 *   offset 0  : version         1 byte  (currently {@value #VERSION})
 *   offset 1  : type            1 byte
 *   offset 2  : sender          8 bytes
 *   offset 10 : payload length  2 bytes (unsigned)
 *   offset 12 : payload         payload length bytes
 * </pre>
 *
 * <p>Fragment packets use the same frame; their payload is a fragment
 * sub-payload. With the default 469-byte fragment data size a fragment frame
 * is 12 + 13 + 469 = 494 bytes, below the 512-byte fragmentation threshold.</p>
 */
final class MeshFrameLayout
{
    static final int VERSION = 1;

    static final int HEADER_SIZE = 1 + 1 + PeerId.LENGTH + 2;

    static final int MAX_PAYLOAD = 0xFFFF;

    private MeshFrameLayout() {}
}
