package com.questrail.mesh.config;

import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PeerLivenessPolicyTest {

    @Test
    void defaults() {
        PeerLivenessPolicy policy = PeerLivenessPolicy.defaults();

        assertEquals(Duration.ofMinutes(3), policy.staleTimeout());
        assertEquals(Duration.ofMinutes(1), policy.cleanupInterval());
        assertEquals(Duration.ofSeconds(10), policy.recentlySeenWindow());
    }

    @Test
    void rejectsWindowLongerThanStaleTimeout() {
        assertThrows(IllegalArgumentException.class, () ->
                new PeerLivenessPolicy(Duration.ofSeconds(5), Duration.ofSeconds(1), Duration.ofSeconds(6)));
    }

    @Test
    void rejectsNonPositiveCleanupInterval() {
        assertThrows(IllegalArgumentException.class, () ->
                new PeerLivenessPolicy(Duration.ofSeconds(5), Duration.ZERO, Duration.ZERO));
    }

    @Test
    void runtimeConfigBuilderAppliesDefaults() {
        InetSocketAddress neighbour = new InetSocketAddress("127.0.0.1", 9000);

        MeshRuntimeConfig config = MeshRuntimeConfig.builder()
                .addNeighbour(neighbour)
                .build();

        assertEquals(FragmentationPolicy.defaults(), config.fragmentation());
        assertEquals(PeerLivenessPolicy.defaults(), config.liveness());
        assertEquals(0, config.bindAddress().getPort());
        assertEquals(1, config.neighbours().size());
        assertThrows(UnsupportedOperationException.class, () -> config.neighbours().add(neighbour));
    }

    @Test
    void runtimeConfigRejectsMissingPolicy() {
        assertThrows(NullPointerException.class, () ->
                MeshRuntimeConfig.builder().withLiveness(null).build());
    }
}
