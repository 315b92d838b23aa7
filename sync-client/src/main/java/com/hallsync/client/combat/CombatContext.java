package com.hallsync.client.combat;

import com.hallsync.protocol.EnemyState;

import java.util.List;

/**
 * What the combat layer may see and do within one sync session.
 *
 * Issued by {@link com.hallsync.client.SyncClient#combatContext()}. Once the session
 * closes, {@link #isActive()} turns false and {@link #attack} stops forwarding.
 */
public interface CombatContext {

    /**
     * Latest enemy snapshot received from the relay.
     */
    List<EnemyState> enemies();

    /**
     * Forwards an attack intent to the relay.
     *
     * @return true if the intent was handed to the transport
     */
    boolean attack(String enemyId);

    boolean isActive();
}
