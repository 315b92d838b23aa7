package com.hallsync.client.combat;

import javax.vecmath.Matrix3d;
import javax.vecmath.Quat4d;
import javax.vecmath.Vector3d;

final class Rotations {

    private Rotations() {
    }

    /**
     * Returns {@code vector} rotated by {@code orientation}. Neither argument is modified.
     */
    static Vector3d rotate(Quat4d orientation, Vector3d vector) {
        Quat4d unit = new Quat4d(orientation);
        unit.normalize();
        Matrix3d matrix = new Matrix3d();
        matrix.set(unit);
        Vector3d rotated = new Vector3d(vector);
        matrix.transform(rotated);
        return rotated;
    }
}
