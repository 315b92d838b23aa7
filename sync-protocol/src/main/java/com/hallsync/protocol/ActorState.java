package com.hallsync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Authoritative state of one connected participant.
 *
 * This class is immutable. When an actor moves, create a new ActorState with
 * {@link #withPosition} / {@link #withRotation} rather than modifying the
 * existing one, so snapshots already handed out never change underneath a reader.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "color", "position", "rotation"})
public final class ActorState {

    private final String id;
    private final String color;
    private final Vector3 position;
    private final Rotation rotation;

    @JsonCreator
    public ActorState(@JsonProperty("id") String id,
                      @JsonProperty("color") String color,
                      @JsonProperty("position") Vector3 position,
                      @JsonProperty("rotation") Rotation rotation) {
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

    public ActorState withPosition(Vector3 newPosition) {
        return new ActorState(id, color, newPosition, rotation);
    }

    public ActorState withRotation(Rotation newRotation) {
        return new ActorState(id, color, position, newRotation);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ActorState)) {
            return false;
        }
        ActorState other = (ActorState) o;
        return Objects.equals(id, other.id)
                && Objects.equals(color, other.color)
                && Objects.equals(position, other.position)
                && Objects.equals(rotation, other.rotation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, color, position, rotation);
    }

    @Override
    public String toString() {
        return "ActorState{" +
                "id='" + id + '\'' +
                ", color='" + color + '\'' +
                ", position=" + position +
                ", rotation=" + rotation +
                '}';
    }
}
