package com.hallsync.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Message Codec Tests")
class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec();
    private final ObjectMapper objectMapper = new ObjectMapper();

    // ==========================================
    // Test: Decoding client messages
    // ==========================================

    @Test
    @DisplayName("Should decode a full move")
    void testDecodeFullMove() throws Exception {
        Message message = codec.decode("""
            {
                "type": "move",
                "position": {"x": 1, "y": 0.9, "z": 2},
                "rotation": {"x": 0, "y": 0.7071, "z": 0, "w": 0.7071}
            }
            """);

        MoveMessage move = assertInstanceOf(MoveMessage.class, message);
        assertEquals(new Vector3(1, 0.9, 2), move.getPosition());
        assertEquals(new Rotation(0, 0.7071, 0, 0.7071), move.getRotation());
    }

    @Test
    @DisplayName("Omitted move fields should decode as null")
    void testDecodePartialMove() throws Exception {
        MoveMessage move = (MoveMessage) codec.decode("{\"type\":\"move\",\"rotation\":{\"x\":0,\"y\":0,\"z\":0,\"w\":1}}");

        assertNull(move.getPosition());
        assertEquals(Rotation.IDENTITY, move.getRotation());
    }

    @Test
    @DisplayName("Missing vector components should decode as NaN")
    void testMissingComponentIsNaN() throws Exception {
        MoveMessage move = (MoveMessage) codec.decode("{\"type\":\"move\",\"position\":{\"x\":3,\"z\":4}}");

        assertEquals(3, move.getPosition().getX());
        assertTrue(Double.isNaN(move.getPosition().getY()));
        assertFalse(move.getPosition().isFinite());
    }

    @Test
    @DisplayName("Should decode an attack")
    void testDecodeAttack() throws Exception {
        AttackMessage attack = (AttackMessage) codec.decode("{\"type\":\"attack\",\"enemyId\":\"enemy-0-1\"}");

        assertEquals(MessageType.ATTACK, attack.getType());
        assertEquals("enemy-0-1", attack.getEnemyId());
    }

    // ==========================================
    // Test: Fail-closed decoding
    // ==========================================

    @Test
    @DisplayName("Unknown message kinds should decode to null")
    void testUnknownKind() throws Exception {
        assertNull(codec.decode("{\"type\":\"ping\"}"));
        assertNull(codec.decode("{\"type\":\"MOVE\"}"));
    }

    @Test
    @DisplayName("Malformed payloads should raise ProtocolException")
    void testMalformedPayloads() {
        assertThrows(ProtocolException.class, () -> codec.decode("not valid json {{{"));
        assertThrows(ProtocolException.class, () -> codec.decode("[1, 2, 3]"));
        assertThrows(ProtocolException.class, () -> codec.decode("{\"position\":{}}"));
        assertThrows(ProtocolException.class, () -> codec.decode("{\"type\": 7}"));
        assertThrows(ProtocolException.class, () -> codec.decode("{\"type\":\"move\",\"position\":\"here\"}"));
        assertThrows(ProtocolException.class, () -> codec.decode("{\"type\":\"attack\"}"));
        assertThrows(ProtocolException.class, () -> codec.decode("{\"type\":\"attack\",\"enemyId\":42}"));
        assertThrows(ProtocolException.class, () -> codec.decode(null));
    }

    @Test
    @DisplayName("Unknown extra properties should be ignored")
    void testExtraPropertiesIgnored() throws Exception {
        MoveMessage move = (MoveMessage) codec.decode(
                "{\"type\":\"move\",\"seq\":12,\"position\":{\"x\":1,\"y\":2,\"z\":3,\"extra\":true}}");

        assertEquals(new Vector3(1, 2, 3), move.getPosition());
    }

    // ==========================================
    // Test: Encoding server messages
    // ==========================================

    @Test
    @DisplayName("Welcome should carry id, color, players and enemies")
    void testEncodeWelcome() throws Exception {
        ActorState actor = new ActorState("a-1", "#12ab34", new Vector3(0, 0.9, 0), Rotation.IDENTITY);
        EnemyState enemy = new EnemyState("enemy-0-0", 5, 0, -7, true, 0);

        JsonNode json = objectMapper.readTree(codec.encode(
                new WelcomeMessage("a-1", "#12ab34", List.of(actor), List.of(enemy))));

        assertEquals("welcome", json.get("type").asText());
        assertEquals("a-1", json.get("id").asText());
        assertEquals("#12ab34", json.get("color").asText());

        JsonNode player = json.get("players").get(0);
        assertEquals("a-1", player.get("id").asText());
        assertEquals(0.9, player.get("position").get("y").asDouble());
        assertEquals(1.0, player.get("rotation").get("w").asDouble());
        assertFalse(player.get("position").has("finite"), "Helper accessors must not leak onto the wire");

        JsonNode enemyNode = json.get("enemies").get(0);
        assertEquals("enemy-0-0", enemyNode.get("id").asText());
        assertTrue(enemyNode.get("alive").asBoolean());
        assertEquals(0, enemyNode.get("faceIndex").asInt());
        assertEquals(-7, enemyNode.get("z").asDouble());
    }

    @Test
    @DisplayName("Move should omit absent fields on the wire")
    void testEncodeMoveOmitsAbsentFields() throws Exception {
        JsonNode json = objectMapper.readTree(codec.encode(new MoveMessage(new Vector3(1, 2, 3), null)));

        assertEquals("move", json.get("type").asText());
        assertTrue(json.has("position"));
        assertFalse(json.has("rotation"));
    }

    @Test
    @DisplayName("State snapshots should decode back into equal actors")
    void testStateSnapshotDecodes() throws Exception {
        ActorState first = new ActorState("a", "#000000", new Vector3(1, 0.9, 2), Rotation.IDENTITY);
        ActorState second = new ActorState("b", "#ffffff", new Vector3(-4, 0.9, 8), new Rotation(0, 1, 0, 0));

        StateMessage decoded = (StateMessage) codec.decode(codec.encode(new StateMessage(List.of(first, second))));

        assertEquals(List.of(first, second), decoded.getPlayers());
    }

    @Test
    @DisplayName("Snapshot without players should decode as empty")
    void testStateWithoutPlayers() throws Exception {
        StateMessage decoded = (StateMessage) codec.decode("{\"type\":\"state\"}");

        assertTrue(decoded.getPlayers().isEmpty());
    }
}
