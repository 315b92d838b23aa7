package com.hallsync.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Encodes and decodes protocol messages as JSON text.
 *
 * Decoding is an explicit discriminated parse: the "type" field is read first
 * and selects the concrete message class. It fails closed:
 * - payloads that are not a JSON object with a textual "type" raise {@link ProtocolException}
 * - a recognized kind whose fields have the wrong shape raises {@link ProtocolException}
 * - an unrecognized "type" yields null, so callers can ignore it without treating it as an error
 *
 * The codec is thread-safe - ObjectMapper is thread-safe after configuration.
 */
public class MessageCodec {

    private static final String TYPE_FIELD = "type";

    // ObjectMapper is thread-safe and should be reused
    private final ObjectMapper objectMapper;

    public MessageCodec() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Serializes a message to its JSON representation.
     *
     * @param message The message to serialize
     * @return JSON string representation
     */
    public String encode(Message message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + message, e);
        }
    }

    /**
     * Parses a JSON payload into a protocol message.
     *
     * @param json raw text received from the peer
     * @return the decoded message, or null if its kind is not part of the protocol
     * @throws ProtocolException if the payload is malformed
     */
    public Message decode(String json) throws ProtocolException {
        if (json == null) {
            throw new ProtocolException("Empty payload");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Payload is not valid JSON", e);
        }

        if (root == null || !root.isObject()) {
            throw new ProtocolException("Payload is not a JSON object");
        }

        JsonNode typeNode = root.get(TYPE_FIELD);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new ProtocolException("Payload has no message type");
        }

        MessageType type = MessageType.fromWireName(typeNode.asText());
        if (type == null) {
            return null;
        }

        return switch (type) {
            case WELCOME -> read(root, WelcomeMessage.class);
            case STATE -> read(root, StateMessage.class);
            case ENEMIES -> read(root, EnemiesMessage.class);
            case MOVE -> read(root, MoveMessage.class);
            case ATTACK -> decodeAttack(root);
        };
    }

    private AttackMessage decodeAttack(JsonNode root) throws ProtocolException {
        JsonNode enemyId = root.get("enemyId");
        if (enemyId == null || !enemyId.isTextual() || enemyId.asText().isEmpty()) {
            throw new ProtocolException("Attack without enemyId");
        }
        return new AttackMessage(enemyId.asText());
    }

    private <T extends Message> T read(JsonNode root, Class<T> messageClass) throws ProtocolException {
        try {
            return objectMapper.treeToValue(root, messageClass);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException("Malformed " + messageClass.getSimpleName(), e);
        }
    }
}
