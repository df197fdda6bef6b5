package com.questrail.mesh.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * MeshPacket
 * -----------------------------------------------------------------------------
 * Immutable structured mesh frame: a type tag, the sending peer and opaque
 * payload bytes.
 *
 * <p>A packet is owned by whichever layer currently holds it (producer →
 * fragmenter → transport, or transport → reassembler → consumer). Immutability
 * holds because payload arrays are copied in and out, so a packet can be handed across threads
 * without further coordination.</p>
 *
 * <p>The type is kept as a raw byte rather than a {@link MessageType} so that
 * packets with tags unknown to this node survive fragmentation unchanged.</p>
 */
public final class MeshPacket
{
    private final byte type;
    private final PeerId sender;
    private final byte[] payload;

    public MeshPacket(byte type, PeerId sender, byte[] payload) {
        this.type = type;
        this.sender = Objects.requireNonNull(sender, "sender");
        this.payload = (payload == null) ? new byte[0] : payload.clone();
    }

    public MeshPacket(MessageType type, PeerId sender, byte[] payload) {
        this(Objects.requireNonNull(type, "type").toByte(), sender, payload);
    }

    /**
     * Raw type tag as carried on the wire.
     */
    public byte type() {
        return type;
    }

    /**
     * The known type for this packet, if any.
     */
    public Optional<MessageType> messageType() {
        return MessageType.fromValue(type);
    }

    public boolean isFragment() {
        return (type & 0xFF) == MessageType.FRAGMENT.value();
    }

    public PeerId sender() {
        return sender;
    }

    /**
     * Returns a copy of the payload bytes.
     */
    public byte[] payload() {
        return payload.clone();
    }

    public int payloadLength() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MeshPacket that)) return false;
        return type == that.type
                && sender.equals(that.sender)
                && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(type, sender);
        result = 31 * result + Arrays.hashCode(payload);
        return result;
    }

    @Override
    public String toString() {
        return "MeshPacket[" +
                "type=0x" + Integer.toHexString(type & 0xFF) +
                ", sender=" + sender +
                ", payloadLength=" + payload.length +
                ']';
    }
}
