package com.hallsync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Full enemy snapshot. Receivers replace their copy wholesale.
 */
public final class EnemiesMessage extends Message {

    private final List<EnemyState> enemies;

    @JsonCreator
    public EnemiesMessage(@JsonProperty("enemies") List<EnemyState> enemies) {
        super(MessageType.ENEMIES);
        this.enemies = enemies != null ? List.copyOf(enemies) : List.of();
    }

    public List<EnemyState> getEnemies() {
        return enemies;
    }

    @Override
    public String toString() {
        return "EnemiesMessage{enemies=" + enemies.size() + '}';
    }
}
