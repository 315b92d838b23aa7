package com.hallsync.client.combat;

import java.util.function.LongSupplier;

/**
 * Minimum spacing between attacks, shared by every input strategy.
 */
public class AttackCooldown {

    private final long cooldownNanos;
    private final LongSupplier clock;
    private boolean triggered;
    private long lastTriggered;

    /**
     * @param cooldownNanos minimum gap between two triggers
     * @param clock         monotonic nanosecond clock
     */
    public AttackCooldown(long cooldownNanos, LongSupplier clock) {
        this.cooldownNanos = cooldownNanos;
        this.clock = clock;
    }

    /**
     * Starts a new cooldown if the previous one has elapsed.
     *
     * @return true if the caller may attack now
     */
    public synchronized boolean tryTrigger() {
        long now = clock.getAsLong();
        if (triggered && now - lastTriggered < cooldownNanos) {
            return false;
        }
        triggered = true;
        lastTriggered = now;
        return true;
    }
}
