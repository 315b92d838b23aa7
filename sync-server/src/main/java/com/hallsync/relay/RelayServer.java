package com.hallsync.relay;

import com.hallsync.config.RelayConfig;
import com.hallsync.protocol.ActorState;
import com.hallsync.protocol.AttackMessage;
import com.hallsync.protocol.EnemiesMessage;
import com.hallsync.protocol.EnemyState;
import com.hallsync.protocol.Message;
import com.hallsync.protocol.MessageCodec;
import com.hallsync.protocol.MoveMessage;
import com.hallsync.protocol.ProtocolException;
import com.hallsync.protocol.Rotation;
import com.hallsync.protocol.StateMessage;
import com.hallsync.protocol.Vector3;
import com.hallsync.protocol.WelcomeMessage;
import com.hallsync.session.Connection;
import com.hallsync.session.SessionRegistry;
import com.hallsync.state.AttackOutcome;
import com.hallsync.state.EnemyWorld;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * The authoritative relay: owns every actor and enemy, applies inbound updates
 * and fans out snapshots.
 *
 * Threading Model:
 * - One "relay loop" thread owns the {@link SessionRegistry} and {@link EnemyWorld}
 * - Transport threads call {@link #onConnect}, {@link #onMessage} and {@link #onDisconnect},
 *   which only enqueue work onto the loop
 * - Because the loop is a single-threaded FIFO, events from one connection are applied
 *   in arrival order, and every broadcast is built from a state no other event is mutating
 *
 * No locks are needed: nothing else ever reads or writes the registry.
 */
public class RelayServer {

    private static final Logger logger = LoggerFactory.getLogger(RelayServer.class);

    public static final Vector3 SPAWN_POSITION = new Vector3(0, 0.9, 0);

    private final RelayConfig config;
    private final ScheduledExecutorService loop;
    private final MessageCodec codec;
    private final SessionRegistry registry;
    private final EnemyWorld enemyWorld;

    private volatile ScheduledFuture<?> enemyTask;
    private long lastEnemyTick;

    public RelayServer(RelayConfig config) {
        this(config, Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "relay-loop");
            thread.setDaemon(true);
            return thread;
        }), new Random());
    }

    public RelayServer(RelayConfig config, ScheduledExecutorService loop, Random random) {
        this.config = config;
        this.loop = loop;
        this.codec = new MessageCodec();
        this.registry = new SessionRegistry();
        this.enemyWorld = new EnemyWorld(config, random);
    }

    /**
     * Spawns the first enemy wave and starts the simulation tick.
     */
    public void start() {
        execute(() -> {
            if (config.getEnemyCount() == 0) {
                logger.info("Enemy simulation disabled");
                return;
            }
            enemyWorld.spawnWave();
            lastEnemyTick = nowMillis();
            enemyTask = loop.scheduleAtFixedRate(guarded(this::tickEnemies),
                    config.getEnemyTickMillis(), config.getEnemyTickMillis(), TimeUnit.MILLISECONDS);
        });
    }

    /**
     * Stops the simulation and the relay loop. Pending events are discarded.
     */
    public void stop() {
        if (enemyTask != null) {
            enemyTask.cancel(false);
        }
        loop.shutdownNow();
        logger.info("Relay stopped");
    }

    // === Transport entry points (any thread) ===

    public void onConnect(Connection connection) {
        execute(() -> handleConnect(connection));
    }

    public void onMessage(Connection connection, String payload) {
        execute(() -> handleMessage(connection, payload));
    }

    public void onDisconnect(Connection connection) {
        execute(() -> handleDisconnect(connection));
    }

    // === Event handling (relay loop only) ===

    private void handleConnect(Connection connection) {
        if (registry.actorFor(connection) != null) {
            return;
        }
        ActorState actor = new ActorState(
                UUID.randomUUID().toString(),
                randomColor(),
                SPAWN_POSITION,
                Rotation.IDENTITY);
        registry.register(connection, actor);

        List<ActorState> players = registry.snapshot();
        connection.send(codec.encode(new WelcomeMessage(actor.getId(), actor.getColor(),
                players, enemyWorld.snapshot())));
        broadcast(codec.encode(new StateMessage(players)), connection);

        logger.info("Actor {} connected via {} ({} connected)", actor.getId(), connection.label(), registry.size());
    }

    private void handleMessage(Connection connection, String payload) {
        Message message;
        try {
            message = codec.decode(payload);
        } catch (ProtocolException e) {
            logger.debug("Dropping malformed payload from {}: {}", connection.label(), e.getMessage());
            return;
        }
        if (message == null) {
            logger.debug("Ignoring unrecognized message kind from {}", connection.label());
            return;
        }

        switch (message.getType()) {
            case MOVE -> handleMove(connection, (MoveMessage) message);
            case ATTACK -> handleAttack(connection, (AttackMessage) message);
            default -> logger.debug("Ignoring {} from {}", message.getType(), connection.label());
        }
    }

    /**
     * Applies a pose proposal. This is the hot path - every client sends ~20 per second.
     */
    private void handleMove(Connection connection, MoveMessage move) {
        ActorState current = registry.actorFor(connection);
        if (current == null) {
            // Disconnect won the race against an in-flight message
            return;
        }

        ActorState updated = current;
        if (move.getPosition() != null && move.getPosition().isFinite()) {
            updated = updated.withPosition(move.getPosition());
        }
        if (move.getRotation() != null && move.getRotation().isFinite()) {
            updated = updated.withRotation(move.getRotation());
        }
        registry.update(connection, updated);

        broadcast(codec.encode(new StateMessage(registry.snapshot())), null);
    }

    private void handleAttack(Connection connection, AttackMessage attack) {
        ActorState attacker = registry.actorFor(connection);
        if (attacker == null) {
            return;
        }
        AttackOutcome outcome = enemyWorld.attack(attack.getEnemyId(), attacker, nowMillis());
        if (outcome.isHit()) {
            broadcastEnemies();
        } else {
            logger.debug("Attack by {} on {} rejected: {}", attacker.getId(), attack.getEnemyId(), outcome);
        }
    }

    private void handleDisconnect(Connection connection) {
        ActorState removed = registry.remove(connection);
        if (removed == null) {
            return;
        }
        broadcast(codec.encode(new StateMessage(registry.snapshot())), null);
        logger.info("Actor {} disconnected ({} connected)", removed.getId(), registry.size());
    }

    private void tickEnemies() {
        long now = nowMillis();
        double deltaSeconds = (now - lastEnemyTick) / 1000.0;
        lastEnemyTick = now;

        enemyWorld.tick(deltaSeconds, registry.snapshot(), now);
        broadcastEnemies();
    }

    // === Broadcasting ===

    private void broadcastEnemies() {
        if (registry.isEmpty()) {
            return;
        }
        broadcast(codec.encode(new EnemiesMessage(enemyWorld.snapshot())), null);
    }

    /**
     * Sends one encoded frame to every open connection except {@code exclude}.
     */
    private void broadcast(String json, Connection exclude) {
        for (Connection connection : registry.connections()) {
            if (connection != exclude && connection.isOpen()) {
                connection.send(json);
            }
        }
    }

    // === Consistent reads for monitoring and tests ===

    /**
     * Returns the actor snapshot as seen by the relay loop after all previously submitted events.
     */
    public List<ActorState> players() {
        return query(registry::snapshot);
    }

    /**
     * Returns the enemy snapshot as seen by the relay loop after all previously submitted events.
     */
    public List<EnemyState> enemies() {
        return query(enemyWorld::snapshot);
    }

    private <T> T query(Supplier<T> reader) {
        try {
            return CompletableFuture.supplyAsync(reader, loop).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reading relay state", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to read relay state", e.getCause());
        }
    }

    private void execute(Runnable task) {
        try {
            loop.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            logger.debug("Relay stopped, dropping event");
        }
    }

    /**
     * Keeps one failing event from killing the loop or cancelling the periodic tick.
     */
    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("Relay event failed", e);
            }
        };
    }

    private static long nowMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
    }

    /**
     * Generates a random "#rrggbb" display color.
     */
    static String randomColor() {
        return String.format("#%06x", ThreadLocalRandom.current().nextInt(0x1000000));
    }
}
