package com.questrail.mesh.model;

import java.security.SecureRandom;

/**
 * Opaque 64-bit token shared by every fragment of one oversized packet.
 *
 * <p>{@link #hex()} is the stable reassembly key. Ids are drawn from a
 * {@link SecureRandom} so that two senders, or one sender across restarts,
 * practically never collide within a reassembly timeout.</p>
 */
public record FragmentId(long value)
{
    /** Wire length in bytes. */
    public static final int LENGTH = Long.BYTES;

    private static final SecureRandom RANDOM = new SecureRandom();

    public static FragmentId random() {
        return new FragmentId(RANDOM.nextLong());
    }

    /**
     * 16-character lower-case hex form.
     */
    public String hex() {
        return String.format("%016x", value);
    }

    @Override
    public String toString() {
        return "FragmentId[" + hex() + "]";
    }
}
