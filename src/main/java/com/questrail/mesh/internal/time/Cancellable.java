package com.questrail.mesh.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for work scheduled on a {@link MonotonicScheduler}.
 *
 * <p>
 * Mesh maintenance (reassembly expiry, stale peer eviction) must be stoppable
 * when the owning component shuts down, whether the work is backed by a
 * deterministic test scheduler or a {@code ScheduledExecutorService}.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled work.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the work
     *         already ran or was previously cancelled.
     */
    boolean cancel();
}
