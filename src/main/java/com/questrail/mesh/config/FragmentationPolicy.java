package com.questrail.mesh.config;

import java.time.Duration;
import java.util.Objects;

/**
 * FragmentationPolicy
 * -----------------------------------------------------------------------------
 * Size and timing constants of the fragmentation protocol.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>thresholdBytes</b>: Payloads at or below this size are sent
 *       unfragmented. It counts payload bytes only, not encoded frame bytes:
 *       the frame header adds 12 bytes, so an unfragmented frame can be up to
 *       {@code thresholdBytes + 12} bytes long.</li>
 *   <li><b>maxFragmentBytes</b>: Maximum data bytes carried by one fragment.
 *       Strictly smaller than the threshold to leave room for the fragment and
 *       frame headers.</li>
 *   <li><b>reassemblyTimeout</b>: Age after which an incomplete reassembly
 *       group is discarded.</li>
 *   <li><b>cleanupInterval</b>: Delay between expiry sweeps.</li>
 * </ul>
 *
 * <p>The two size values form part of the wire contract: both ends of a link
 * must agree on them or oversized messages never reassemble.</p>
 */
public record FragmentationPolicy(
        int thresholdBytes,
        int maxFragmentBytes,
        Duration reassemblyTimeout,
        Duration cleanupInterval
) {
    public static final int DEFAULT_THRESHOLD_BYTES = 512;
    public static final int DEFAULT_MAX_FRAGMENT_BYTES = 469;

    public FragmentationPolicy {
        Objects.requireNonNull(reassemblyTimeout, "reassemblyTimeout");
        Objects.requireNonNull(cleanupInterval, "cleanupInterval");

        validateSizes(maxFragmentBytes, thresholdBytes);
        if (reassemblyTimeout.isNegative()) {
            throw new IllegalArgumentException("reassemblyTimeout must be non-negative");
        }
        if (cleanupInterval.isNegative() || cleanupInterval.isZero()) {
            throw new IllegalArgumentException("cleanupInterval must be positive");
        }
    }

    /**
     * Checks the size pair shared by every fragmentation call.
     *
     * @throws IllegalArgumentException unless {@code 0 < maxFragmentBytes < thresholdBytes}
     */
    public static void validateSizes(int maxFragmentBytes, int thresholdBytes) {
        if (maxFragmentBytes <= 0) {
            throw new IllegalArgumentException("maxFragmentBytes must be positive");
        }
        if (maxFragmentBytes >= thresholdBytes) {
            throw new IllegalArgumentException(
                    "maxFragmentBytes (" + maxFragmentBytes + ") must be smaller than thresholdBytes ("
                            + thresholdBytes + ")");
        }
    }

    /**
     * Default values, matching deployed peers:
     * <ul>
     *   <li>thresholdBytes: 512</li>
     *   <li>maxFragmentBytes: 469</li>
     *   <li>reassemblyTimeout: 30s</li>
     *   <li>cleanupInterval: 10s</li>
     * </ul>
     */
    public static FragmentationPolicy defaults() {
        return new FragmentationPolicy(
                DEFAULT_THRESHOLD_BYTES,
                DEFAULT_MAX_FRAGMENT_BYTES,
                Duration.ofSeconds(30),
                Duration.ofSeconds(10)
        );
    }

    public FragmentationPolicy withSizes(int thresholdBytes, int maxFragmentBytes) {
        return new FragmentationPolicy(thresholdBytes, maxFragmentBytes, reassemblyTimeout, cleanupInterval);
    }
}
