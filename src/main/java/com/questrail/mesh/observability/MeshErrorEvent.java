package com.questrail.mesh.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the mesh core.
 */
public record MeshErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
