package com.hallsync.client.combat;

import javax.vecmath.Point3d;

/**
 * Estimates controller speed from successive position samples.
 *
 * The first sample after construction or {@link #reset()} only seeds the history
 * and reports zero speed.
 */
public class SwingDetector {

    private final Point3d previous = new Point3d();
    private boolean hasPrevious;

    /**
     * @param position     controller position this frame, in meters
     * @param deltaSeconds time since the previous sample
     * @return instantaneous speed in meters per second
     */
    public synchronized double sample(Point3d position, double deltaSeconds) {
        double speed = 0;
        if (hasPrevious && deltaSeconds > 0 && Double.isFinite(deltaSeconds)) {
            speed = previous.distance(position) / deltaSeconds;
        }
        previous.set(position);
        hasPrevious = true;
        return Double.isFinite(speed) ? speed : 0;
    }

    public synchronized void reset() {
        hasPrevious = false;
    }
}
