package com.questrail.mesh.model;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * Ephemeral identifier of a mesh participant.
 *
 * <h2>Representation</h2>
 * <p>
 * On the wire a peer id is exactly {@value #LENGTH} bytes. Its canonical text
 * form is the lower-case hex encoding of those bytes (16 characters), which is
 * what the peer directory keys on, what debug dumps print, and what
 * {@link #compareTo(PeerId)} orders by.
 * </p>
 *
 * <p>
 * Shorter ids are accepted and right-padded with zero bytes, matching how
 * senders with short ids are framed. Ids longer than {@value #LENGTH} bytes or
 * containing non-hex characters are rejected.
 * </p>
 *
 * <p>
 * A peer id is ephemeral: the same cryptographic identity may re-appear under
 * a new id. Binding ids to a stable identity is the job of the fingerprint
 * registry, not of this type.
 * </p>
 */
public final class PeerId implements Comparable<PeerId>
{
    /** Wire length of a peer id in bytes. */
    public static final int LENGTH = 8;

    private static final HexFormat HEX = HexFormat.of();

    private final String value;

    private PeerId(String value) {
        this.value = value;
    }

    /**
     * Parses a hex peer id.
     *
     * @throws IllegalArgumentException if the text is empty, not hex, of odd
     *                                  length or longer than {@value #LENGTH} bytes
     */
    public static PeerId of(String hex) {
        Objects.requireNonNull(hex, "hex");
        final String clean = hex.trim().toLowerCase(Locale.ROOT);
        if (clean.isEmpty() || clean.length() % 2 != 0 || clean.length() > LENGTH * 2) {
            throw new IllegalArgumentException("Invalid peer id: '" + hex + "'");
        }
        final byte[] bytes;
        try {
            bytes = HEX.parseHex(clean);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid peer id: '" + hex + "'", e);
        }
        return fromBytes(bytes);
    }

    /**
     * Builds a peer id from wire bytes, zero-padding short input.
     */
    public static PeerId fromBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length == 0 || bytes.length > LENGTH) {
            throw new IllegalArgumentException("Peer id must be 1-" + LENGTH + " bytes (was " + bytes.length + ")");
        }
        return new PeerId(HEX.formatHex(Arrays.copyOf(bytes, LENGTH)));
    }

    /**
     * Canonical 16-character lower-case hex form.
     */
    public String value() {
        return value;
    }

    /**
     * Returns a fresh copy of the {@value #LENGTH} wire bytes.
     */
    public byte[] toBytes() {
        return HEX.parseHex(value);
    }

    @Override
    public int compareTo(PeerId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PeerId that)) return false;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
