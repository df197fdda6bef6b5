package com.questrail.mesh.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used strictly to timestamp observability events.
 *
 * <p>MUST NOT be used for reassembly expiry or peer staleness.</p>
 */
public interface WallClock
{
    Instant now();
}
