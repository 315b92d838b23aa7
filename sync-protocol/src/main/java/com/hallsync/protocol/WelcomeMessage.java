package com.hallsync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Sent privately to a connection right after it is accepted: its own identity
 * plus the current actor and enemy snapshots.
 */
@JsonPropertyOrder({"type", "id", "color", "players", "enemies"})
public final class WelcomeMessage extends Message {

    private final String id;
    private final String color;
    private final List<ActorState> players;
    private final List<EnemyState> enemies;

    @JsonCreator
    public WelcomeMessage(@JsonProperty("id") String id,
                          @JsonProperty("color") String color,
                          @JsonProperty("players") List<ActorState> players,
                          @JsonProperty("enemies") List<EnemyState> enemies) {
        super(MessageType.WELCOME);
        this.id = id;
        this.color = color;
        this.players = players != null ? List.copyOf(players) : List.of();
        this.enemies = enemies != null ? List.copyOf(enemies) : List.of();
    }

    public String getId() {
        return id;
    }

    public String getColor() {
        return color;
    }

    public List<ActorState> getPlayers() {
        return players;
    }

    public List<EnemyState> getEnemies() {
        return enemies;
    }

    @Override
    public String toString() {
        return "WelcomeMessage{id='" + id + "', players=" + players.size() + ", enemies=" + enemies.size() + '}';
    }
}
