package com.hallsync.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Base of the protocol's tagged union.
 *
 * Every message kind is a final subclass carrying only the fields that kind needs;
 * the discriminator is {@link #getType()}, written as the "type" field.
 *
 * Messages are immutable, so a single encoded instance can be shared across
 * threads and sent to many connections.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type"})
public abstract class Message {

    private final MessageType type;

    protected Message(MessageType type) {
        this.type = type;
    }

    @JsonProperty("type")
    public MessageType getType() {
        return type;
    }
}
