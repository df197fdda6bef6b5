package com.questrail.mesh.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every liveness and expiry decision in the mesh core.
 *
 * <h2>Binding invariant</h2>
 * Reassembly timeouts, peer last-seen stamps and staleness checks MUST use a
 * monotonic time source. Wall-clock time ({@code Instant.now()}) is permitted
 * only for observability events.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
