package com.questrail.mesh.model;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * FragmentPayload
 * -----------------------------------------------------------------------------
 * Sub-payload carried by every {@link MessageType#FRAGMENT} packet.
 *
 * <h2>Wire layout (big-endian)</h2>
 * <pre>
 *   offset 0  : fragment id        8 bytes
 *   offset 8  : fragment index     2 bytes (unsigned)
 *   offset 10 : total fragments    2 bytes (unsigned)
 *   offset 12 : original type      1 byte
 *   offset 13 : data               remaining bytes
 * </pre>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code totalFragments >= 1}</li>
 *   <li>{@code fragmentIndex < totalFragments}</li>
 * </ul>
 *
 * <p>Both sides of a link must agree on this layout bit-for-bit; otherwise
 * reassembly never completes for oversized packets.</p>
 */
public final class FragmentPayload
{
    /** Size of the fixed header preceding the data bytes. */
    public static final int HEADER_SIZE = FragmentId.LENGTH + 2 + 2 + 1;

    /** Largest index/total representable in the two-byte fields. */
    public static final int MAX_FRAGMENTS = 0xFFFF;

    private final FragmentId fragmentId;
    private final int fragmentIndex;
    private final int totalFragments;
    private final byte originalType;
    private final byte[] data;

    public FragmentPayload(FragmentId fragmentId,
                           int fragmentIndex,
                           int totalFragments,
                           byte originalType,
                           byte[] data) {
        this.fragmentId = Objects.requireNonNull(fragmentId, "fragmentId");
        if (totalFragments < 1 || totalFragments > MAX_FRAGMENTS) {
            throw new IllegalArgumentException("totalFragments must be 1-" + MAX_FRAGMENTS + " (was " + totalFragments + ")");
        }
        if (fragmentIndex < 0 || fragmentIndex >= totalFragments) {
            throw new IllegalArgumentException(
                    "fragmentIndex " + fragmentIndex + " out of range for total " + totalFragments);
        }
        this.fragmentIndex = fragmentIndex;
        this.totalFragments = totalFragments;
        this.originalType = originalType;
        this.data = (data == null) ? new byte[0] : data.clone();
    }

    /**
     * Decode a fragment sub-payload received from the mesh.
     *
     * <p>Input is untrusted. Anything structurally invalid yields
     * {@link Optional#empty()}; this method never throws on malformed bytes.</p>
     */
    public static Optional<FragmentPayload> decode(byte[] bytes) {
        if (bytes == null || bytes.length < HEADER_SIZE) {
            return Optional.empty();
        }

        ByteBuffer buf = ByteBuffer.wrap(bytes);
        long id = buf.getLong();
        int index = Short.toUnsignedInt(buf.getShort());
        int total = Short.toUnsignedInt(buf.getShort());
        byte originalType = buf.get();

        if (total == 0 || index >= total) {
            return Optional.empty();
        }

        byte[] data = Arrays.copyOfRange(bytes, HEADER_SIZE, bytes.length);
        return Optional.of(new FragmentPayload(new FragmentId(id), index, total, originalType, data));
    }

    /**
     * Encode into the wire layout described above.
     */
    public byte[] encode() {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE + data.length);
        buf.putLong(fragmentId.value());
        buf.putShort((short) fragmentIndex);
        buf.putShort((short) totalFragments);
        buf.put(originalType);
        buf.put(data);
        return buf.array();
    }

    public FragmentId fragmentId() {
        return fragmentId;
    }

    public int fragmentIndex() {
        return fragmentIndex;
    }

    public int totalFragments() {
        return totalFragments;
    }

    public byte originalType() {
        return originalType;
    }

    /**
     * Returns a copy of this fragment's slice of the original payload.
     */
    public byte[] data() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FragmentPayload that)) return false;
        return fragmentIndex == that.fragmentIndex
                && totalFragments == that.totalFragments
                && originalType == that.originalType
                && fragmentId.equals(that.fragmentId)
                && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(fragmentId, fragmentIndex, totalFragments, originalType);
        result = 31 * result + Arrays.hashCode(data);
        return result;
    }

    @Override
    public String toString() {
        return "FragmentPayload[" +
                "id=" + fragmentId.hex() +
                ", index=" + fragmentIndex +
                "/" + totalFragments +
                ", originalType=0x" + Integer.toHexString(originalType & 0xFF) +
                ", dataLength=" + data.length +
                ']';
    }
}
