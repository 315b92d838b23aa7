package com.hallsync.state;

import com.hallsync.protocol.EnemyState;

/**
 * Server-side hostile entity.
 *
 * Mutable on purpose: the simulation moves every enemy twenty times a second.
 * Only the relay loop touches it; readers get an immutable {@link EnemyState}.
 */
public class Enemy {

    private final String id;
    private final int faceIndex;
    private double x;
    private double y;
    private double z;
    private boolean alive;

    // Heading on the XZ plane, unit length once set
    private double directionX;
    private double directionZ;
    private boolean wandered;
    private long lastDirectionChange;

    public Enemy(String id, int faceIndex, double x, double y, double z) {
        this.id = id;
        this.faceIndex = faceIndex;
        this.x = x;
        this.y = y;
        this.z = z;
        this.alive = true;
    }

    public String getId() {
        return id;
    }

    public int getFaceIndex() {
        return faceIndex;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getZ() {
        return z;
    }

    public boolean isAlive() {
        return alive;
    }

    void kill() {
        alive = false;
    }

    void moveTo(double newX, double newZ) {
        this.x = newX;
        this.z = newZ;
    }

    double getDirectionX() {
        return directionX;
    }

    double getDirectionZ() {
        return directionZ;
    }

    void setDirection(double dx, double dz) {
        this.directionX = dx;
        this.directionZ = dz;
    }

    boolean hasWandered() {
        return wandered;
    }

    long getLastDirectionChange() {
        return lastDirectionChange;
    }

    void setLastDirectionChange(long millis) {
        this.lastDirectionChange = millis;
        this.wandered = true;
    }

    public EnemyState toState() {
        return new EnemyState(id, x, y, z, alive, faceIndex);
    }

    @Override
    public String toString() {
        return "Enemy{id='" + id + "', x=" + x + ", z=" + z + ", alive=" + alive + '}';
    }
}
