package com.hallsync.session;

/**
 * One client's open message channel, as seen by the relay.
 *
 * Implementations must accept {@link #send} from any thread and must never
 * throw when the underlying socket is already gone.
 */
public interface Connection {

    /**
     * Transport-level label used in logs. Not the actor id.
     */
    String label();

    /**
     * Queues a text frame for delivery. Silently discarded if the connection is closed.
     */
    void send(String text);

    boolean isOpen();
}
