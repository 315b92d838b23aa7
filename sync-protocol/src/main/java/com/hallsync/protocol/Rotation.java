package com.hallsync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Orientation quaternion {x, y, z, w}.
 *
 * The relay does not normalize or validate unit length; it only refuses
 * non-finite components. Missing components decode as NaN.
 */
public final class Rotation {

    public static final Rotation IDENTITY = new Rotation(0, 0, 0, 1);

    private final double x;
    private final double y;
    private final double z;
    private final double w;

    public Rotation(double x, double y, double z, double w) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.w = w;
    }

    @JsonCreator
    static Rotation fromJson(@JsonProperty("x") Double x,
                             @JsonProperty("y") Double y,
                             @JsonProperty("z") Double z,
                             @JsonProperty("w") Double w) {
        return new Rotation(Vector3.orNaN(x), Vector3.orNaN(y), Vector3.orNaN(z), Vector3.orNaN(w));
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

    public double getW() {
        return w;
    }

    @JsonIgnore
    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z) && Double.isFinite(w);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rotation)) {
            return false;
        }
        Rotation other = (Rotation) o;
        return Double.compare(x, other.x) == 0
                && Double.compare(y, other.y) == 0
                && Double.compare(z, other.z) == 0
                && Double.compare(w, other.w) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, z, w);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + z + ", " + w + ")";
    }
}
