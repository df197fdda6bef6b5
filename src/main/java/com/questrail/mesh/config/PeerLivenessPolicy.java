package com.questrail.mesh.config;

import java.time.Duration;
import java.util.Objects;

/**
 * PeerLivenessPolicy
 * -----------------------------------------------------------------------------
 * Timing configuration for peer liveness.
 *
 * <ul>
 *   <li><b>staleTimeout</b>: A peer not seen for longer than this is no longer
 *       active and is evicted on the next sweep. The same value drives both the
 *       active-peer query and the sweep.</li>
 *   <li><b>cleanupInterval</b>: Delay between stale-peer sweeps.</li>
 *   <li><b>recentlySeenWindow</b>: Grace window for nickname collisions: an
 *       older record sharing a newcomer's nickname is kept only if it was seen
 *       strictly within this window.</li>
 * </ul>
 */
public record PeerLivenessPolicy(
        Duration staleTimeout,
        Duration cleanupInterval,
        Duration recentlySeenWindow
) {
    public PeerLivenessPolicy {
        Objects.requireNonNull(staleTimeout, "staleTimeout");
        Objects.requireNonNull(cleanupInterval, "cleanupInterval");
        Objects.requireNonNull(recentlySeenWindow, "recentlySeenWindow");

        if (staleTimeout.isNegative()) {
            throw new IllegalArgumentException("staleTimeout must be non-negative");
        }
        if (cleanupInterval.isNegative() || cleanupInterval.isZero()) {
            throw new IllegalArgumentException("cleanupInterval must be positive");
        }
        if (recentlySeenWindow.isNegative()) {
            throw new IllegalArgumentException("recentlySeenWindow must be non-negative");
        }
        if (recentlySeenWindow.compareTo(staleTimeout) > 0) {
            throw new IllegalArgumentException("recentlySeenWindow must not exceed staleTimeout");
        }
    }

    /**
     * Defaults: 3 minute stale timeout, 1 minute sweep, 10 second collision window.
     */
    public static PeerLivenessPolicy defaults() {
        return new PeerLivenessPolicy(
                Duration.ofMinutes(3),
                Duration.ofMinutes(1),
                Duration.ofSeconds(10)
        );
    }
}
