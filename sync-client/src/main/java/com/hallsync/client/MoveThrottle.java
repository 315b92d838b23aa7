package com.hallsync.client;

/**
 * Rate limiter for outbound moves.
 *
 * Admits at most one call per window; calls inside the window are rejected, never
 * queued. The first call is always admitted.
 *
 * Thread Safety:
 * - {@link #tryAcquire} is synchronized; pose producers may call from any thread.
 */
public class MoveThrottle {

    private final long windowNanos;
    private boolean acquired;
    private long lastAcquired;

    public MoveThrottle(long windowNanos) {
        if (windowNanos < 0) {
            throw new IllegalArgumentException("windowNanos must not be negative: " + windowNanos);
        }
        this.windowNanos = windowNanos;
    }

    /**
     * @param nowNanos monotonic timestamp, e.g. {@link System#nanoTime()}
     * @return true if the caller may send now
     */
    public synchronized boolean tryAcquire(long nowNanos) {
        // Subtraction keeps this correct across nanoTime overflow
        if (acquired && nowNanos - lastAcquired < windowNanos) {
            return false;
        }
        acquired = true;
        lastAcquired = nowNanos;
        return true;
    }
}
