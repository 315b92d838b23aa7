package com.hallsync.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Move Throttle Tests")
class MoveThrottleTest {

    private static final long WINDOW = TimeUnit.MILLISECONDS.toNanos(50);

    @Test
    @DisplayName("The first call should always be admitted")
    void testFirstCallAdmitted() {
        MoveThrottle throttle = new MoveThrottle(WINDOW);
        assertTrue(throttle.tryAcquire(0));
    }

    @Test
    @DisplayName("Calls inside the window should be dropped, not deferred")
    void testWindow() {
        MoveThrottle throttle = new MoveThrottle(WINDOW);
        long t0 = 1_000_000_000L;

        assertTrue(throttle.tryAcquire(t0));
        assertFalse(throttle.tryAcquire(t0 + WINDOW / 2));
        assertFalse(throttle.tryAcquire(t0 + WINDOW - 1));
        assertTrue(throttle.tryAcquire(t0 + WINDOW));
        assertFalse(throttle.tryAcquire(t0 + WINDOW + 1), "Window restarts from the last admitted call");
    }

    @Test
    @DisplayName("At most one call per window should pass under a burst")
    void testBurst() {
        MoveThrottle throttle = new MoveThrottle(WINDOW);
        int admitted = 0;
        // 1 second of calls every millisecond
        for (long ms = 0; ms < 1000; ms++) {
            if (throttle.tryAcquire(TimeUnit.MILLISECONDS.toNanos(ms))) {
                admitted++;
            }
        }
        assertEquals(20, admitted);
    }

    @Test
    @DisplayName("Should stay correct when the nano clock wraps around")
    void testClockOverflow() {
        MoveThrottle throttle = new MoveThrottle(WINDOW);
        long nearMax = Long.MAX_VALUE - WINDOW / 2;

        assertTrue(throttle.tryAcquire(nearMax));
        assertFalse(throttle.tryAcquire(nearMax + WINDOW / 4));
        assertTrue(throttle.tryAcquire(nearMax + WINDOW));
    }

    @Test
    @DisplayName("A zero window should admit everything")
    void testZeroWindow() {
        MoveThrottle throttle = new MoveThrottle(0);
        assertTrue(throttle.tryAcquire(5));
        assertTrue(throttle.tryAcquire(5));
    }
}
