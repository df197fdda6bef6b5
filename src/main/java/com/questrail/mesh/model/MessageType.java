package com.questrail.mesh.model;

import java.util.Optional;

/**
 * Known mesh packet type tags.
 *
 * <p>The type travels on the wire as one unsigned byte. Packets carrying a tag
 * that is not listed here are still valid {@link MeshPacket}s: fragmentation
 * and reassembly are type-transparent and carry the raw byte through
 * unchanged.</p>
 */
public enum MessageType
{
    ANNOUNCE(0x01),
    MESSAGE(0x02),
    LEAVE(0x03),
    NOISE_HANDSHAKE(0x10),
    NOISE_ENCRYPTED(0x11),
    FRAGMENT(0x20),
    REQUEST_SYNC(0x21),
    FILE_TRANSFER(0x22);

    private final int value;

    MessageType(int value) {
        this.value = value;
    }

    /**
     * Unsigned wire value (0–255).
     */
    public int value() {
        return value;
    }

    public byte toByte() {
        return (byte) value;
    }

    /**
     * Maps a raw wire byte to a known type.
     *
     * @return the matching type, or empty for tags this node does not know
     */
    public static Optional<MessageType> fromValue(byte raw) {
        final int unsigned = raw & 0xFF;
        for (MessageType type : values()) {
            if (type.value == unsigned) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
