package com.questrail.mesh.fragment;

import java.util.HashMap;
import java.util.Map;

/**
 * ReassemblyGroup
 * -----------------------------------------------------------------------------
 * In-flight state for one fragment id.
 *
 * <p>Total and original type are captured from the first fragment seen.
 * Chunks are keyed by index so duplicates overwrite rather than count twice.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe on its own. Every mutation happens inside
 * {@code ConcurrentHashMap.compute} on the owning engine's group table, which
 * serializes access per fragment id.</p>
 */
final class ReassemblyGroup
{
    private final int totalFragments;
    private final byte originalType;
    private final long createdAtNanos;
    private final Map<Integer, byte[]> chunks = new HashMap<>();

    ReassemblyGroup(int totalFragments, byte originalType, long createdAtNanos) {
        this.totalFragments = totalFragments;
        this.originalType = originalType;
        this.createdAtNanos = createdAtNanos;
    }

    int totalFragments() {
        return totalFragments;
    }

    byte originalType() {
        return originalType;
    }

    long createdAtNanos() {
        return createdAtNanos;
    }

    /**
     * Store (or replace) the chunk at {@code index}.
     */
    void put(int index, byte[] data) {
        chunks.put(index, data);
    }

    int receivedCount() {
        return chunks.size();
    }

    boolean isComplete() {
        return chunks.size() == totalFragments;
    }

    boolean isOlderThan(long cutoffNanos) {
        return createdAtNanos < cutoffNanos;
    }

    /**
     * Concatenate chunks in index order. Only valid once {@link #isComplete()}.
     */
    byte[] assemble() {
        int length = 0;
        for (int i = 0; i < totalFragments; i++) {
            length += chunks.get(i).length;
        }

        byte[] out = new byte[length];
        int offset = 0;
        for (int i = 0; i < totalFragments; i++) {
            byte[] chunk = chunks.get(i);
            System.arraycopy(chunk, 0, out, offset, chunk.length);
            offset += chunk.length;
        }
        return out;
    }
}
