package com.hallsync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Wire view of one hostile entity: flat coordinates, liveness and face texture index.
 */
@JsonPropertyOrder({"id", "x", "y", "z", "alive", "faceIndex"})
public final class EnemyState {

    private final String id;
    private final double x;
    private final double y;
    private final double z;
    private final boolean alive;
    private final int faceIndex;

    @JsonCreator
    public EnemyState(@JsonProperty("id") String id,
                      @JsonProperty("x") double x,
                      @JsonProperty("y") double y,
                      @JsonProperty("z") double z,
                      @JsonProperty("alive") boolean alive,
                      @JsonProperty("faceIndex") int faceIndex) {
        this.id = id;
        this.x = x;
        this.y = y;
        this.z = z;
        this.alive = alive;
        this.faceIndex = faceIndex;
    }

    public String getId() {
        return id;
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

    public int getFaceIndex() {
        return faceIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EnemyState)) {
            return false;
        }
        EnemyState other = (EnemyState) o;
        return Double.compare(x, other.x) == 0
                && Double.compare(y, other.y) == 0
                && Double.compare(z, other.z) == 0
                && alive == other.alive
                && faceIndex == other.faceIndex
                && Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, x, y, z, alive, faceIndex);
    }

    @Override
    public String toString() {
        return "EnemyState{" +
                "id='" + id + '\'' +
                ", x=" + x +
                ", z=" + z +
                ", alive=" + alive +
                '}';
    }
}
