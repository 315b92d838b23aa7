package com.hallsync;

import com.hallsync.config.RelayConfig;
import com.hallsync.protocol.ActorState;
import com.hallsync.relay.RelayServer;
import com.hallsync.session.RecordingConnection;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the relay loop under concurrent producers.
 *
 * Transport threads call into the relay from many threads at once; the loop must
 * apply each connection's events in order and never lose one.
 */
@DisplayName("Concurrency & Event Loop Tests")
class ConcurrencyTest {

    private RelayServer relay;

    @BeforeEach
    void setUp() {
        relay = new RelayServer(RelayConfig.builder().enemyCount(0).build(),
                Executors.newSingleThreadScheduledExecutor(), new Random(1));
        relay.start();
    }

    @AfterEach
    void tearDown() {
        relay.stop();
    }

    @Test
    @DisplayName("Concurrent connects should all be registered with unique ids")
    void testConcurrentConnects() throws Exception {
        int threadCount = 32;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < threadCount; i++) {
            RecordingConnection connection = new RecordingConnection("conn-" + i);
            futures.add(executor.submit(() -> {
                startLatch.await();
                relay.onConnect(connection);
                return null;
            }));
        }

        startLatch.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        executor.shutdown();

        List<ActorState> players = relay.players();
        assertEquals(threadCount, players.size());
        assertEquals(threadCount, players.stream().map(ActorState::getId).distinct().count());
        System.out.println("✓ " + threadCount + " concurrent connects registered");
    }

    @Test
    @DisplayName("Moves from many threads should keep per-connection order")
    void testPerConnectionOrdering() throws Exception {
        int connectionCount = 8;
        int movesPerConnection = 500;
        List<RecordingConnection> connections = new ArrayList<>();
        for (int i = 0; i < connectionCount; i++) {
            RecordingConnection connection = new RecordingConnection("conn-" + i);
            connections.add(connection);
            relay.onConnect(connection);
        }

        ExecutorService executor = Executors.newFixedThreadPool(connectionCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < connectionCount; i++) {
            RecordingConnection connection = connections.get(i);
            double lane = i;
            futures.add(executor.submit(() -> {
                startLatch.await();
                for (int m = 0; m < movesPerConnection; m++) {
                    relay.onMessage(connection, RecordingClient.move(m, 0.9, lane));
                }
                return null;
            }));
        }

        long startTime = System.currentTimeMillis();
        startLatch.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        List<ActorState> players = relay.players();
        long duration = System.currentTimeMillis() - startTime;

        assertEquals(connectionCount, players.size());
        for (ActorState actor : players) {
            assertEquals(movesPerConnection - 1, actor.getPosition().getX(), 1e-9,
                    "Last move of each connection must win");
        }
        System.out.println("✓ " + (connectionCount * movesPerConnection) + " moves applied in order in " + duration + "ms");
    }

    @Test
    @DisplayName("Connects and disconnects racing with moves should leave no stale actors")
    void testDisconnectRace() throws Exception {
        int connectionCount = 50;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < connectionCount; i++) {
            RecordingConnection connection = new RecordingConnection("conn-" + i);
            futures.add(executor.submit(() -> {
                relay.onConnect(connection);
                relay.onMessage(connection, RecordingClient.move(1, 0.9, 1));
                relay.onDisconnect(connection);
                relay.onMessage(connection, RecordingClient.move(2, 0.9, 2));
                return null;
            }));
        }

        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertTrue(relay.players().isEmpty(), "Every actor should be gone");
        System.out.println("✓ No stale actors after disconnect race");
    }
}
