package com.questrail.mesh.internal.time;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * PeriodicTask
 * =============================================================================
 * Fixed-delay recurring task built on the one-shot {@link MonotonicScheduler}.
 *
 * <p>Each tick re-arms the next one before returning, so a failing iteration
 * never ends the series: the exception is handed to the failure handler and
 * the following tick is scheduled as usual.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   task.start()   → first run after one interval
 *   task.cancel()  → cancels the pending tick; no further runs are armed
 * </pre>
 *
 * <p>Both operations are idempotent and safe to call from any thread. Each
 * {@code start()} opens a new series; a tick only re-arms while its own
 * series is current, so a cancel and restart during a running tick leaves
 * exactly one series.</p>
 */
public final class PeriodicTask implements Cancellable {

    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration interval;
    private final Runnable body;
    private final Consumer<RuntimeException> failureHandler;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object armLock = new Object();
    private Cancellable pending;
    private long series;

    /**
     * @param scheduler      scheduler used to arm each tick
     * @param clock          clock the scheduler's deadlines are measured against
     * @param interval       delay between the end of one tick and the next
     * @param body           work performed on each tick
     * @param failureHandler receives exceptions thrown by {@code body}
     */
    public PeriodicTask(MonotonicScheduler scheduler,
                        MonotonicClock clock,
                        Duration interval,
                        Runnable body,
                        Consumer<RuntimeException> failureHandler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.body = Objects.requireNonNull(body, "body");
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");

        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            long current;
            synchronized (armLock) {
                current = ++series;
            }
            arm(current);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean cancel() {
        if (!running.compareAndSet(true, false)) {
            return false;
        }
        synchronized (armLock) {
            series++;
            if (pending != null) {
                pending.cancel();
                pending = null;
            }
        }
        return true;
    }

    private boolean isCurrent(long owner) {
        synchronized (armLock) {
            return running.get() && owner == series;
        }
    }

    private void arm(long owner) {
        synchronized (armLock) {
            if (running.get() && owner == series) {
                pending = scheduler.scheduleAfter(interval, clock, () -> tick(owner));
            }
        }
    }

    private void tick(long owner) {
        if (!isCurrent(owner)) {
            return;
        }
        try {
            body.run();
        } catch (RuntimeException e) {
            failureHandler.accept(e);
        } finally {
            arm(owner);
        }
    }
}
