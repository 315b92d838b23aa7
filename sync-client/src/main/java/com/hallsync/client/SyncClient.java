package com.hallsync.client;

import com.hallsync.client.combat.CombatContext;
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

import org.java_websocket.client.WebSocketClient;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.java_websocket.handshake.ServerHandshake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Client side of the relay: one WebSocket connection per instance.
 *
 * Holds the latest player and enemy snapshots pushed by the relay and sends throttled
 * pose updates and attack intents. Snapshots are replaced wholesale, never merged.
 *
 * Threading Model:
 * - Inbound frames are handled on the Java-WebSocket read thread
 * - Getters and send methods may be called from any thread (typically the render loop);
 *   snapshots are immutable lists published through volatile fields
 *
 * Usage:
 * <pre>
 * SyncClient client = SyncClient.builder(URI.create("ws://localhost:4000/sync"))
 *         .listener(myListener)
 *         .build();
 * client.connectBlocking(5, TimeUnit.SECONDS);
 * client.sendMove(position, rotation);
 * </pre>
 */
public class SyncClient {

    private static final Logger logger = LoggerFactory.getLogger(SyncClient.class);

    public static final long DEFAULT_THROTTLE_MILLIS = 50;

    private final URI uri;
    private final MessageCodec codec = new MessageCodec();
    private final MoveThrottle throttle;
    private final SyncListener listener;
    private final LongSupplier clock;
    private final Transport transport;
    private final CombatContext combatContext = new SessionCombatContext();

    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile String localId;
    private volatile String localColor;
    private volatile List<ActorState> players = List.of();
    private volatile List<EnemyState> enemies = List.of();

    private SyncClient(Builder builder) {
        this.uri = builder.uri;
        this.throttle = new MoveThrottle(TimeUnit.MILLISECONDS.toNanos(builder.throttleMillis));
        this.listener = builder.listener;
        this.clock = builder.clock;
        this.transport = new Transport(uri);
    }

    public static Builder builder(URI uri) {
        return new Builder(uri);
    }

    // === Connection lifecycle ===

    /**
     * Starts connecting in the background.
     */
    public void connect() {
        transport.connect();
    }

    /**
     * Connects and waits for the handshake.
     *
     * @return true if the connection opened within the timeout
     */
    public boolean connectBlocking(long timeout, TimeUnit unit) throws InterruptedException {
        return transport.connectBlocking(timeout, unit);
    }

    /**
     * Closes the connection. There is no reconnection; build a new client instead.
     */
    public void close() {
        state = ConnectionState.CLOSED;
        transport.close();
    }

    public boolean isOpen() {
        return state == ConnectionState.OPEN && transport.isOpen();
    }

    public ConnectionState getState() {
        return state;
    }

    public URI getUri() {
        return uri;
    }

    // === Outbound ===

    /**
     * Proposes a new local pose. Either argument may be null to leave that field unchanged.
     *
     * @return false if the connection is not open or the call fell inside the throttle window
     */
    public boolean sendMove(Vector3 position, Rotation rotation) {
        if (!isOpen()) {
            return false;
        }
        if (!throttle.tryAcquire(clock.getAsLong())) {
            return false;
        }
        return send(codec.encode(new MoveMessage(position, rotation)));
    }

    /**
     * Sends an attack intent. The relay decides whether it lands.
     *
     * @return false if the connection is not open
     */
    public boolean sendAttack(String enemyId) {
        if (enemyId == null || enemyId.isEmpty() || !isOpen()) {
            return false;
        }
        return send(codec.encode(new AttackMessage(enemyId)));
    }

    private boolean send(String json) {
        try {
            transport.send(json);
            return true;
        } catch (WebsocketNotConnectedException e) {
            logger.debug("Connection to {} closed before send", uri);
            return false;
        }
    }

    // === Snapshots (any thread) ===

    /**
     * Id assigned by the relay, or null before the welcome arrives.
     */
    public String localId() {
        return localId;
    }

    public String localColor() {
        return localColor;
    }

    /**
     * Latest player snapshot, local actor included.
     */
    public List<ActorState> players() {
        return players;
    }

    /**
     * Latest player snapshot without the local actor.
     */
    public List<ActorState> remotePlayers() {
        String self = localId;
        List<ActorState> current = players;
        List<ActorState> remote = new ArrayList<>(current.size());
        for (ActorState actor : current) {
            if (!actor.getId().equals(self)) {
                remote.add(actor);
            }
        }
        return remote;
    }

    public List<EnemyState> enemies() {
        return enemies;
    }

    /**
     * Handle for the combat layer, valid until this client closes.
     */
    public CombatContext combatContext() {
        return combatContext;
    }

    // === Inbound (socket thread) ===

    void handleFrame(String payload) {
        if (state == ConnectionState.CLOSED) {
            return;
        }
        Message message;
        try {
            message = codec.decode(payload);
        } catch (ProtocolException e) {
            logger.warn("Skipping unparseable payload from {}: {}", uri, e.getMessage());
            return;
        }
        if (message == null) {
            logger.debug("Ignoring unknown message kind from {}", uri);
            return;
        }

        switch (message.getType()) {
            case WELCOME -> applyWelcome((WelcomeMessage) message);
            case STATE -> applyPlayers(((StateMessage) message).getPlayers());
            case ENEMIES -> applyEnemies(((EnemiesMessage) message).getEnemies());
            default -> logger.debug("Ignoring {} from {}", message.getType(), uri);
        }
    }

    private void applyWelcome(WelcomeMessage welcome) {
        localId = welcome.getId();
        localColor = welcome.getColor();
        players = welcome.getPlayers();
        enemies = welcome.getEnemies();
        logger.info("Joined {} as {} ({} players)", uri, localId, players.size());

        notifyListener(() -> {
            listener.onWelcome(welcome.getId(), welcome.getColor());
            listener.onPlayers(welcome.getPlayers());
            listener.onEnemies(welcome.getEnemies());
        });
    }

    private void applyPlayers(List<ActorState> snapshot) {
        players = snapshot;
        notifyListener(() -> listener.onPlayers(snapshot));
    }

    private void applyEnemies(List<EnemyState> snapshot) {
        enemies = snapshot;
        notifyListener(() -> listener.onEnemies(snapshot));
    }

    private void notifyListener(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.error("Sync listener failed", e);
        }
    }

    /**
     * Java-WebSocket transport; forwards events to the enclosing client.
     */
    private class Transport extends WebSocketClient {

        Transport(URI serverUri) {
            super(serverUri);
        }

        @Override
        public void onOpen(ServerHandshake handshake) {
            if (state == ConnectionState.CONNECTING) {
                state = ConnectionState.OPEN;
            }
            logger.debug("Connected to {}", uri);
        }

        @Override
        public void onMessage(String message) {
            handleFrame(message);
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {
            state = ConnectionState.CLOSED;
            logger.info("Connection to {} closed ({}{})", uri, code, reason == null || reason.isEmpty() ? "" : ": " + reason);
            notifyListener(() -> listener.onClosed(code, reason, remote));
        }

        @Override
        public void onError(Exception ex) {
            logger.warn("Connection error on {}: {}", uri, ex.toString());
        }
    }

    /**
     * Combat handle bound to this client's session.
     */
    private class SessionCombatContext implements CombatContext {

        @Override
        public List<EnemyState> enemies() {
            return enemies;
        }

        @Override
        public boolean attack(String enemyId) {
            return isActive() && sendAttack(enemyId);
        }

        @Override
        public boolean isActive() {
            return state != ConnectionState.CLOSED;
        }
    }

    public static class Builder {
        private final URI uri;
        private long throttleMillis = DEFAULT_THROTTLE_MILLIS;
        private SyncListener listener = new SyncListener() {
        };
        private LongSupplier clock = System::nanoTime;

        private Builder(URI uri) {
            this.uri = Objects.requireNonNull(uri, "uri");
        }

        public Builder throttleMillis(long throttleMillis) {
            if (throttleMillis < 0) {
                throw new IllegalArgumentException("throttleMillis must not be negative: " + throttleMillis);
            }
            this.throttleMillis = throttleMillis;
            return this;
        }

        public Builder listener(SyncListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener");
            return this;
        }

        /**
         * Monotonic nanosecond clock used by the move throttle.
         */
        public Builder clock(LongSupplier clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public SyncClient build() {
            return new SyncClient(this);
        }
    }
}
