package com.hallsync.client.combat;

import com.hallsync.protocol.EnemyState;

import javax.vecmath.Point3d;
import javax.vecmath.Quat4d;
import javax.vecmath.Vector3d;

import java.util.List;

/**
 * Picks the enemy a non-tracked player is looking at.
 *
 * Candidates are living enemies whose torso lies within range and inside a cone
 * around the view direction; the closest one wins.
 */
public class AimConeTargeter {

    public static final double DEFAULT_RANGE = 3.0;
    public static final double DEFAULT_MIN_DOT = 0.7;
    static final Vector3d VIEW_FORWARD = new Vector3d(0, 0, -1);

    private final double range;
    private final double minDot;

    public AimConeTargeter() {
        this(DEFAULT_RANGE, DEFAULT_MIN_DOT);
    }

    public AimConeTargeter(double range, double minDot) {
        this.range = range;
        this.minDot = minDot;
    }

    /**
     * @param eye             camera position
     * @param viewOrientation camera orientation; forward is -Z in camera space
     * @param enemies         current enemy snapshot
     * @return id of the chosen enemy, or null if none qualifies
     */
    public String findTarget(Point3d eye, Quat4d viewOrientation, List<EnemyState> enemies) {
        Vector3d forward = Rotations.rotate(viewOrientation, VIEW_FORWARD);
        String closestId = null;
        double closestDistance = Double.POSITIVE_INFINITY;

        for (EnemyState enemy : enemies) {
            if (!enemy.isAlive()) {
                continue;
            }
            Vector3d toEnemy = new Vector3d(
                    enemy.getX() - eye.x,
                    enemy.getY() + CombatEventBridge.TORSO_HEIGHT - eye.y,
                    enemy.getZ() - eye.z);
            double distance = toEnemy.length();
            if (distance > range || distance == 0) {
                continue;
            }
            double dot = toEnemy.dot(forward) / distance;
            if (dot > minDot && distance < closestDistance) {
                closestId = enemy.getId();
                closestDistance = distance;
            }
        }
        return closestId;
    }
}
