package com.ethnicthv.dynecs.core.system;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.LockSupport;

/**
 * Fixed-rate driver for a {@link SystemManager}.
 * <p>
 * {@link #run()} blocks the calling thread and calls {@link SystemManager#update(float)} once per
 * tick with the fixed delta. A {@link #stop()} request is sticky: when it arrives before
 * {@link #run()} starts, {@code run()} returns without ticking.
 */
public final class GameLoop {
    private static final Logger log = LoggerFactory.getLogger(GameLoop.class);

    // ticks further behind than this are dropped instead of replayed
    private static final int MAX_CATCH_UP_TICKS = 5;

    private final SystemManager systems;
    private final float fixedDeltaTime;
    private final long tickNanos;
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final AtomicBoolean running = new AtomicBoolean();
    private volatile long fixedTicks;

    /**
     * @param systems        the manager to drive
     * @param targetTickRate desired update rate in Hz (e.g. 60 => 1/60s)
     */
    public GameLoop(SystemManager systems, float targetTickRate) {
        if (systems == null) throw new IllegalArgumentException("systems must not be null");
        if (targetTickRate <= 0f) throw new IllegalArgumentException("targetTickRate must be > 0");
        this.systems = systems;
        this.fixedDeltaTime = 1.0f / targetTickRate;
        this.tickNanos = Math.max(1L, (long) (1_000_000_000.0 / targetTickRate));
    }

    public GameLoop(SystemManager systems) {
        this(systems, 60.0f);
    }

    /**
     * Tick until {@link #stop()} is called or the current thread is interrupted.
     *
     * @throws IllegalStateException if the loop is already running on another thread
     */
    public void run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("GameLoop is already running");
        }
        try {
            if (stopRequested.get()) {
                log.info("Game loop stopped before it started");
                return;
            }
            log.info("Game loop started (fixed step {} s)", fixedDeltaTime);
            long nextTick = System.nanoTime();
            while (!stopRequested.get() && !Thread.currentThread().isInterrupted()) {
                long now = System.nanoTime();
                if (now - nextTick < 0) {
                    LockSupport.parkNanos(this, nextTick - now);
                    continue;
                }
                systems.update(fixedDeltaTime);
                fixedTicks++;
                nextTick += tickNanos;
                if (now - nextTick > MAX_CATCH_UP_TICKS * tickNanos) {
                    nextTick = now;
                }
            }
            log.info("Game loop stopped after {} ticks", fixedTicks);
        } finally {
            running.set(false);
        }
    }

    /**
     * Request the loop to stop. The tick in progress finishes first. Once requested, the
     * stop stays in effect for every later {@link #run()} call.
     */
    public void stop() {
        stopRequested.set(true);
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public float getFixedDeltaTime() {
        return fixedDeltaTime;
    }

    public long getFixedTicks() {
        return fixedTicks;
    }
}
