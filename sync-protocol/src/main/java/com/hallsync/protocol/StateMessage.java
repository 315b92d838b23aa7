package com.hallsync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Full actor snapshot. Receivers replace their copy wholesale.
 */
public final class StateMessage extends Message {

    private final List<ActorState> players;

    @JsonCreator
    public StateMessage(@JsonProperty("players") List<ActorState> players) {
        super(MessageType.STATE);
        this.players = players != null ? List.copyOf(players) : List.of();
    }

    public List<ActorState> getPlayers() {
        return players;
    }

    @Override
    public String toString() {
        return "StateMessage{players=" + players.size() + '}';
    }
}
