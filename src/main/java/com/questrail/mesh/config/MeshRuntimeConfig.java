package com.questrail.mesh.config;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated configuration for the mesh runtime.
 */
public record MeshRuntimeConfig(
    FragmentationPolicy fragmentation,
    PeerLivenessPolicy liveness,
    InetSocketAddress bindAddress,
    List<InetSocketAddress> neighbours
) {
    public MeshRuntimeConfig {
        Objects.requireNonNull(fragmentation, "fragmentation");
        Objects.requireNonNull(liveness, "liveness");
        Objects.requireNonNull(bindAddress, "bindAddress");
        neighbours = List.copyOf(Objects.requireNonNull(neighbours, "neighbours"));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private FragmentationPolicy fragmentation = FragmentationPolicy.defaults();
        private PeerLivenessPolicy liveness = PeerLivenessPolicy.defaults();
        private InetSocketAddress bindAddress = new InetSocketAddress(0);
        private final List<InetSocketAddress> neighbours = new ArrayList<>();

        public Builder withFragmentation(FragmentationPolicy fragmentation) {
            this.fragmentation = fragmentation;
            return this;
        }

        public Builder withLiveness(PeerLivenessPolicy liveness) {
            this.liveness = liveness;
            return this;
        }

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder addNeighbour(InetSocketAddress neighbour) {
            this.neighbours.add(Objects.requireNonNull(neighbour, "neighbour"));
            return this;
        }

        public MeshRuntimeConfig build() {
            return new MeshRuntimeConfig(fragmentation, liveness, bindAddress, neighbours);
        }
    }
}
