package com.hallsync.protocol;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Defines all message kinds of the sync protocol.
 *
 * Server → Client:
 * - WELCOME: Private greeting with the client's own id/color and the current world
 * - STATE: Full replacement of the actor snapshot
 * - ENEMIES: Full replacement of the enemy snapshot
 *
 * Client → Server:
 * - MOVE: Proposed position and/or rotation for the sender's actor
 * - ATTACK: Intent to strike an enemy
 *
 * The wire name is the value of the "type" field in every JSON message.
 */
public enum MessageType {
    // Server → Client
    WELCOME("welcome"),
    STATE("state"),
    ENEMIES("enemies"),

    // Client → Server
    MOVE("move"),
    ATTACK("attack");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name to a message kind.
     *
     * @return the matching kind, or null if the name is not part of the protocol
     */
    public static MessageType fromWireName(String wireName) {
        for (MessageType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        return null;
    }
}
