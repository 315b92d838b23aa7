package com.hallsync.client;

import com.hallsync.protocol.ActorState;
import com.hallsync.protocol.EnemyState;
import com.hallsync.protocol.Rotation;
import com.hallsync.protocol.Vector3;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Snapshot handling of {@link SyncClient}, fed frames directly without a socket.
 */
@DisplayName("Sync Client Tests")
class SyncClientTest {

    private static final String WELCOME = """
        {
            "type": "welcome",
            "id": "me",
            "color": "#00ff00",
            "players": [
                {"id": "me", "color": "#00ff00", "position": {"x": 0, "y": 0.9, "z": 0}, "rotation": {"x": 0, "y": 0, "z": 0, "w": 1}},
                {"id": "other", "color": "#ff0000", "position": {"x": 4, "y": 0.9, "z": 2}, "rotation": {"x": 0, "y": 0, "z": 0, "w": 1}}
            ],
            "enemies": [
                {"id": "enemy-0-0", "x": 1, "y": 0, "z": 1, "alive": true, "faceIndex": 0}
            ]
        }
        """;

    private SyncClient client;
    private List<List<ActorState>> playerUpdates;

    @BeforeEach
    void setUp() {
        playerUpdates = new ArrayList<>();
        client = SyncClient.builder(URI.create("ws://localhost:1/sync"))
                .listener(new SyncListener() {
                    @Override
                    public void onPlayers(List<ActorState> players) {
                        playerUpdates.add(players);
                    }
                })
                .build();
    }

    @Test
    @DisplayName("Welcome should set identity and both snapshots")
    void testWelcome() {
        assertNull(client.localId());

        client.handleFrame(WELCOME);

        assertEquals("me", client.localId());
        assertEquals("#00ff00", client.localColor());
        assertEquals(2, client.players().size());
        assertEquals(1, client.enemies().size());
        assertEquals(1, playerUpdates.size());

        List<ActorState> remote = client.remotePlayers();
        assertEquals(1, remote.size());
        assertEquals("other", remote.get(0).getId());
    }

    @Test
    @DisplayName("State should replace the player snapshot in full")
    void testStateReplaces() {
        client.handleFrame(WELCOME);

        client.handleFrame("""
            {"type": "state", "players": [
                {"id": "me", "color": "#00ff00", "position": {"x": 1, "y": 0.9, "z": 1}, "rotation": {"x": 0, "y": 0, "z": 0, "w": 1}}
            ]}
            """);

        assertEquals(1, client.players().size());
        assertEquals(new Vector3(1, 0.9, 1), client.players().get(0).getPosition());
        assertTrue(client.remotePlayers().isEmpty(), "Departed actor should be gone");
        assertEquals(1, client.enemies().size(), "State must not touch enemies");
    }

    @Test
    @DisplayName("Enemies should replace only the enemy snapshot")
    void testEnemiesReplaces() {
        client.handleFrame(WELCOME);

        client.handleFrame("{\"type\":\"enemies\",\"enemies\":[{\"id\":\"enemy-0-0\",\"x\":1,\"y\":0,\"z\":1,\"alive\":false,\"faceIndex\":0}]}");

        EnemyState enemy = client.enemies().get(0);
        assertFalse(enemy.isAlive());
        assertEquals(2, client.players().size());
    }

    @Test
    @DisplayName("Unparseable payloads should leave the previous snapshot intact")
    void testMalformedRetainsSnapshot() {
        client.handleFrame(WELCOME);
        List<ActorState> before = client.players();

        client.handleFrame("{ this is not json");
        client.handleFrame("{\"type\":\"state\",\"players\":[{\"id\":");
        client.handleFrame("{\"type\":\"fireworks\"}");

        assertSame(before, client.players());
        assertEquals(1, playerUpdates.size());
    }

    @Test
    @DisplayName("Sends should be refused while not connected")
    void testSendWhileClosed() {
        assertFalse(client.isOpen());
        assertFalse(client.sendMove(new Vector3(1, 1, 1), Rotation.IDENTITY));
        assertFalse(client.sendAttack("enemy-0-0"));
        assertFalse(client.combatContext().attack("enemy-0-0"));
    }

    @Test
    @DisplayName("After close, frames are ignored and the combat context goes inactive")
    void testClose() {
        client.handleFrame(WELCOME);
        assertTrue(client.combatContext().isActive());

        client.close();
        client.handleFrame("{\"type\":\"state\",\"players\":[]}");

        assertEquals(ConnectionState.CLOSED, client.getState());
        assertFalse(client.combatContext().isActive());
        assertEquals(2, client.players().size(), "Last snapshot is kept after close");
    }
}
