package com.hallsync.client.combat;

import com.hallsync.protocol.EnemyState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import javax.vecmath.Quat4d;
import javax.vecmath.Vector3d;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Turns local input into attack intents for the relay.
 *
 * Two strategies share one cooldown:
 * - Swing: a tracked controller moving faster than the swing threshold strikes the
 *   first living enemy whose torso is within reach of the blade tip.
 * - Aim cone: a trigger press strikes the enemy the camera is looking at.
 *
 * A strategy that fires consumes the cooldown even when nothing is hit. The bridge
 * only ever talks to the {@link CombatContext} it was built with, and goes quiet once
 * that context becomes inactive.
 *
 * Thread Safety:
 * - Safe to call from the render thread while snapshots update on the socket thread;
 *   all geometry is computed in call-local values.
 */
public class CombatEventBridge {

    private static final Logger logger = LoggerFactory.getLogger(CombatEventBridge.class);

    public static final long ATTACK_COOLDOWN_MILLIS = 300;
    public static final double SWING_SPEED_THRESHOLD = 2.5;
    public static final double HIT_RADIUS = 1.5;
    public static final double TORSO_HEIGHT = 1.0;
    static final Vector3d BLADE_TIP_OFFSET = new Vector3d(0, 0.98, -0.05);

    private final CombatContext context;
    private final AttackCooldown cooldown;
    private final SwingDetector swingDetector = new SwingDetector();
    private final AimConeTargeter aimConeTargeter;

    public CombatEventBridge(CombatContext context) {
        this(context, System::nanoTime);
    }

    public CombatEventBridge(CombatContext context, LongSupplier clock) {
        this(context, new AttackCooldown(TimeUnit.MILLISECONDS.toNanos(ATTACK_COOLDOWN_MILLIS), clock),
                new AimConeTargeter());
    }

    public CombatEventBridge(CombatContext context, AttackCooldown cooldown, AimConeTargeter aimConeTargeter) {
        this.context = context;
        this.cooldown = cooldown;
        this.aimConeTargeter = aimConeTargeter;
    }

    /**
     * Feeds one frame of tracked-controller pose.
     *
     * @return id of the enemy an attack was sent for, or null
     */
    public String onControllerSample(Point3d gripPosition, Quat4d gripOrientation, double deltaSeconds) {
        double speed = swingDetector.sample(gripPosition, deltaSeconds);
        if (speed <= SWING_SPEED_THRESHOLD || !context.isActive() || !cooldown.tryTrigger()) {
            return null;
        }

        Point3d tip = bladeTip(gripPosition, gripOrientation);
        String target = findSwingTarget(tip, context.enemies());
        if (target == null) {
            logger.debug("Swing at {} m/s hit nothing", speed);
            return null;
        }
        return dispatch(target);
    }

    /**
     * Handles a trigger press from non-tracked input (mouse, touch, gamepad).
     *
     * @return id of the enemy an attack was sent for, or null
     */
    public String onTrigger(Point3d eye, Quat4d viewOrientation) {
        if (!context.isActive() || !cooldown.tryTrigger()) {
            return null;
        }
        String target = aimConeTargeter.findTarget(eye, viewOrientation, context.enemies());
        if (target == null) {
            return null;
        }
        return dispatch(target);
    }

    /**
     * Forgets the controller history, e.g. when tracking is lost.
     */
    public void resetSwing() {
        swingDetector.reset();
    }

    private String dispatch(String enemyId) {
        if (!context.attack(enemyId)) {
            logger.debug("Attack on {} not sent, session inactive", enemyId);
            return null;
        }
        return enemyId;
    }

    static Point3d bladeTip(Point3d gripPosition, Quat4d gripOrientation) {
        Point3d tip = new Point3d(gripPosition);
        tip.add(Rotations.rotate(gripOrientation, BLADE_TIP_OFFSET));
        return tip;
    }

    static String findSwingTarget(Point3d tip, List<EnemyState> enemies) {
        for (EnemyState enemy : enemies) {
            if (!enemy.isAlive()) {
                continue;
            }
            Point3d torso = new Point3d(enemy.getX(), enemy.getY() + TORSO_HEIGHT, enemy.getZ());
            if (tip.distance(torso) < HIT_RADIUS) {
                return enemy.getId();
            }
        }
        return null;
    }
}
