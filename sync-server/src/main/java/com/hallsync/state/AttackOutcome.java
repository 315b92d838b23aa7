package com.hallsync.state;

/**
 * Result of arbitrating one attack intent.
 */
public enum AttackOutcome {
    HIT,
    UNKNOWN_ENEMY,
    ALREADY_DEAD,
    OUT_OF_REACH;

    public boolean isHit() {
        return this == HIT;
    }
}
