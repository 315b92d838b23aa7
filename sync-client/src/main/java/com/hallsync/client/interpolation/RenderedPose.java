package com.hallsync.client.interpolation;

import com.hallsync.protocol.Rotation;
import com.hallsync.protocol.Vector3;

/**
 * Where a remote actor should be drawn this frame. Immutable copy; safe to hand to the renderer.
 */
public final class RenderedPose {

    private final String id;
    private final String color;
    private final Vector3 position;
    private final Rotation rotation;

    public RenderedPose(String id, String color, Vector3 position, Rotation rotation) {
        this.id = id;
        this.color = color;
        this.position = position;
        this.rotation = rotation;
    }

    public String getId() {
        return id;
    }

    public String getColor() {
        return color;
    }

    public Vector3 getPosition() {
        return position;
    }

    public Rotation getRotation() {
        return rotation;
    }

    @Override
    public String toString() {
        return "RenderedPose{id='" + id + "', position=" + position + ", rotation=" + rotation + '}';
    }
}
