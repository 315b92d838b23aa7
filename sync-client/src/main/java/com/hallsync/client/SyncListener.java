package com.hallsync.client;

import com.hallsync.protocol.ActorState;
import com.hallsync.protocol.EnemyState;

import java.util.List;

/**
 * Callbacks from a {@link SyncClient}.
 *
 * Invoked on the client's socket thread after the corresponding snapshot has been
 * replaced, so getters on the client already return the new values. Keep them short.
 */
public interface SyncListener {

    default void onWelcome(String localId, String localColor) {
    }

    default void onPlayers(List<ActorState> players) {
    }

    default void onEnemies(List<EnemyState> enemies) {
    }

    default void onClosed(int code, String reason, boolean remote) {
    }
}
