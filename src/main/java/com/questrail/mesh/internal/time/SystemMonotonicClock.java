package com.questrail.mesh.internal.time;

/**
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Unaffected by NTP or manual wall-clock changes, so a peer's last-seen
 * stamp can never jump into the future or past. Thread-safe.</p>
 *
 * <p>For deterministic tests use {@code ManualMonotonicClock}.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
