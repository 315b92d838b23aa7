package com.hallsync;

import com.fasterxml.jackson.databind.JsonNode;
import com.hallsync.config.RelayConfig;
import com.hallsync.server.SyncServer;
import org.junit.jupiter.api.*;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end enemy simulation and attack arbitration over a live socket.
 */
@DisplayName("Combat Flow Tests")
class CombatFlowTest {

    private static SyncServer server;
    private static final int TEST_PORT = 9092;
    private static final String WS_URL = "ws://localhost:" + TEST_PORT + "/sync";

    @BeforeAll
    static void startServer() throws Exception {
        server = new SyncServer(RelayConfig.builder()
                .port(TEST_PORT)
                .enemyCount(3)
                .build());
        server.bind();
    }

    @AfterAll
    static void stopServer() {
        if (server != null) {
            server.shutdown();
        }
    }

    private static JsonNode findEnemy(JsonNode message, String id) {
        for (JsonNode enemy : message.path("enemies")) {
            if (id.equals(enemy.path("id").asText())) {
                return enemy;
            }
        }
        return null;
    }

    @Test
    @DisplayName("Connected clients should receive periodic enemy snapshots")
    void testEnemyBroadcast() throws Exception {
        RecordingClient client = new RecordingClient(WS_URL);
        assertTrue(client.connectBlocking(5, TimeUnit.SECONDS));

        JsonNode welcome = client.awaitType("welcome", 5000);
        assertEquals(3, welcome.get("enemies").size());

        JsonNode enemies = client.awaitType("enemies", 5000);
        assertNotNull(enemies, "Enemy tick should broadcast");
        for (JsonNode enemy : enemies.get("enemies")) {
            assertTrue(enemy.has("x") && enemy.has("z") && enemy.has("alive") && enemy.has("faceIndex"));
        }

        client.closeBlocking();
        System.out.println("✓ Enemy snapshots broadcast");
    }

    @Test
    @DisplayName("An attack next to an enemy should kill it for everyone")
    void testAttackKillsEnemy() throws Exception {
        RecordingClient attacker = new RecordingClient(WS_URL);
        RecordingClient watcher = new RecordingClient(WS_URL);
        assertTrue(attacker.connectBlocking(5, TimeUnit.SECONDS));
        assertTrue(watcher.connectBlocking(5, TimeUnit.SECONDS));
        assertNotNull(attacker.awaitType("welcome", 5000));
        assertNotNull(watcher.awaitType("welcome", 5000));

        JsonNode snapshot = attacker.awaitMatching("enemies",
                m -> m.path("enemies").size() > 0 && m.path("enemies").get(0).path("alive").asBoolean(), 5000);
        assertNotNull(snapshot);
        JsonNode target = snapshot.get("enemies").get(0);
        String targetId = target.get("id").asText();

        // Stand on the enemy; it stops pursuing within stop distance
        attacker.send(RecordingClient.move(target.get("x").asDouble(), 0.9, target.get("z").asDouble()));
        assertNotNull(attacker.awaitType("state", 5000));

        attacker.send("{\"type\":\"attack\",\"enemyId\":\"" + targetId + "\"}");

        JsonNode killed = watcher.awaitMatching("enemies", m -> {
            JsonNode enemy = findEnemy(m, targetId);
            return enemy != null && !enemy.get("alive").asBoolean();
        }, 5000);
        assertNotNull(killed, "Watcher should see the enemy die");

        attacker.closeBlocking();
        watcher.closeBlocking();
        System.out.println("✓ Attack arbitrated and broadcast");
    }
}
