package com.hallsync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A client's intent to strike an enemy. The relay decides whether it lands.
 */
public final class AttackMessage extends Message {

    private final String enemyId;

    @JsonCreator
    public AttackMessage(@JsonProperty("enemyId") String enemyId) {
        super(MessageType.ATTACK);
        this.enemyId = enemyId;
    }

    public String getEnemyId() {
        return enemyId;
    }

    @Override
    public String toString() {
        return "AttackMessage{enemyId='" + enemyId + "'}";
    }
}
