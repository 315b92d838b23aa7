package com.hallsync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * World-space position {x, y, z}.
 *
 * Components missing from a decoded payload are NaN so consumers can tell
 * "absent" from "zero".
 */
public final class Vector3 {

    public static final Vector3 ZERO = new Vector3(0, 0, 0);

    private final double x;
    private final double y;
    private final double z;

    public Vector3(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    @JsonCreator
    static Vector3 fromJson(@JsonProperty("x") Double x,
                            @JsonProperty("y") Double y,
                            @JsonProperty("z") Double z) {
        return new Vector3(orNaN(x), orNaN(y), orNaN(z));
    }

    static double orNaN(Double value) {
        return value != null ? value : Double.NaN;
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

    /**
     * True if all three components are finite numbers.
     */
    @JsonIgnore
    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Vector3)) {
            return false;
        }
        Vector3 other = (Vector3) o;
        return Double.compare(x, other.x) == 0
                && Double.compare(y, other.y) == 0
                && Double.compare(z, other.z) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, z);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + z + ")";
    }
}
