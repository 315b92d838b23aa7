package com.hallsync.client;

/**
 * Lifecycle of a {@link SyncClient}. Moves strictly forward; a closed client is never reopened.
 */
public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSED
}
