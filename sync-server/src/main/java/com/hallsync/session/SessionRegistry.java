package com.hallsync.session;

import com.hallsync.protocol.ActorState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory table of connected actors and their last-known state.
 *
 * Invariant: exactly one actor per registered connection, and the mapping
 * connection ↔ actor id is a bijection while the connection is registered.
 * Iteration follows connection order, which is also the snapshot order.
 *
 * Thread Safety:
 * - None. The registry is owned by the relay loop and must only be touched from it.
 */
public class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<Connection, ActorState> actorsByConnection = new LinkedHashMap<>();
    private final Map<String, Connection> connectionsByActorId = new HashMap<>();

    /**
     * Registers a new connection with its freshly created actor.
     *
     * @throws IllegalStateException if the connection or the actor id is already registered
     */
    public void register(Connection connection, ActorState actor) {
        if (actorsByConnection.containsKey(connection)) {
            throw new IllegalStateException("Connection already registered: " + connection.label());
        }
        if (connectionsByActorId.containsKey(actor.getId())) {
            throw new IllegalStateException("Actor id already in use: " + actor.getId());
        }
        actorsByConnection.put(connection, actor);
        connectionsByActorId.put(actor.getId(), connection);
        logger.debug("Registered actor {} ({} connected)", actor.getId(), actorsByConnection.size());
    }

    /**
     * Removes a connection and its actor.
     *
     * @return the removed actor, or null if the connection was not registered
     */
    public ActorState remove(Connection connection) {
        ActorState removed = actorsByConnection.remove(connection);
        if (removed != null) {
            connectionsByActorId.remove(removed.getId());
            logger.debug("Removed actor {} ({} connected)", removed.getId(), actorsByConnection.size());
        }
        return removed;
    }

    /**
     * @return the connection's actor, or null if it is not registered
     */
    public ActorState actorFor(Connection connection) {
        return actorsByConnection.get(connection);
    }

    /**
     * Replaces the state of a registered connection's actor.
     *
     * @return false if the connection is no longer registered (the update is dropped)
     */
    public boolean update(Connection connection, ActorState actor) {
        ActorState current = actorsByConnection.get(connection);
        if (current == null) {
            return false;
        }
        if (!current.getId().equals(actor.getId())) {
            throw new IllegalArgumentException("Actor id cannot change: " + current.getId() + " -> " + actor.getId());
        }
        actorsByConnection.put(connection, actor);
        return true;
    }

    public Connection connectionFor(String actorId) {
        return connectionsByActorId.get(actorId);
    }

    public boolean contains(String actorId) {
        return connectionsByActorId.containsKey(actorId);
    }

    /**
     * Returns an immutable, ordered copy of all actors.
     */
    public List<ActorState> snapshot() {
        return List.copyOf(actorsByConnection.values());
    }

    /**
     * Returns a copy of the registered connections, safe to iterate while sending.
     */
    public List<Connection> connections() {
        return new ArrayList<>(actorsByConnection.keySet());
    }

    public int size() {
        return actorsByConnection.size();
    }

    public boolean isEmpty() {
        return actorsByConnection.isEmpty();
    }
}
