package com.hallsync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pose proposal from a client for its own actor.
 *
 * Both fields are optional; an absent field leaves the stored value untouched.
 */
public final class MoveMessage extends Message {

    private final Vector3 position;
    private final Rotation rotation;

    @JsonCreator
    public MoveMessage(@JsonProperty("position") Vector3 position,
                       @JsonProperty("rotation") Rotation rotation) {
        super(MessageType.MOVE);
        this.position = position;
        this.rotation = rotation;
    }

    /**
     * @return the proposed position, or null if the message carried none
     */
    public Vector3 getPosition() {
        return position;
    }

    /**
     * @return the proposed rotation, or null if the message carried none
     */
    public Rotation getRotation() {
        return rotation;
    }

    @Override
    public String toString() {
        return "MoveMessage{position=" + position + ", rotation=" + rotation + '}';
    }
}
