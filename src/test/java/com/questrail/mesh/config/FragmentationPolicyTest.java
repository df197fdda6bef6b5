package com.questrail.mesh.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FragmentationPolicyTest
 * -----------------------------------------------------------------------------
 * Validates size/timing constraints and defaults.
 */
class FragmentationPolicyTest {

    @Test
    void defaultsMatchDeployedPeers() {
        FragmentationPolicy policy = FragmentationPolicy.defaults();

        assertEquals(512, policy.thresholdBytes());
        assertEquals(469, policy.maxFragmentBytes());
        assertEquals(Duration.ofSeconds(30), policy.reassemblyTimeout());
        assertEquals(Duration.ofSeconds(10), policy.cleanupInterval());
    }

    @Test
    void rejectsMaxNotBelowThreshold() {
        assertThrows(IllegalArgumentException.class, () -> FragmentationPolicy.defaults().withSizes(100, 100));
        assertThrows(IllegalArgumentException.class, () -> FragmentationPolicy.defaults().withSizes(100, 200));
    }

    @Test
    void rejectsNonPositiveMax() {
        assertThrows(IllegalArgumentException.class, () -> FragmentationPolicy.validateSizes(0, 10));
    }

    @Test
    void rejectsNegativeTimeout() {
        assertThrows(IllegalArgumentException.class, () ->
                new FragmentationPolicy(512, 469, Duration.ofSeconds(-1), Duration.ofSeconds(10)));
    }

    @Test
    void rejectsZeroCleanupInterval() {
        assertThrows(IllegalArgumentException.class, () ->
                new FragmentationPolicy(512, 469, Duration.ofSeconds(30), Duration.ZERO));
    }

    @Test
    void rejectsNullDurations() {
        assertThrows(NullPointerException.class, () ->
                new FragmentationPolicy(512, 469, null, Duration.ofSeconds(10)));
    }

    @Test
    void withSizesKeepsTiming() {
        FragmentationPolicy policy = FragmentationPolicy.defaults().withSizes(64, 16);

        assertEquals(64, policy.thresholdBytes());
        assertEquals(16, policy.maxFragmentBytes());
        assertEquals(Duration.ofSeconds(30), policy.reassemblyTimeout());
    }
}
