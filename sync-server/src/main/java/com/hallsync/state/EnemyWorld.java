package com.hallsync.state;

import com.hallsync.config.RelayConfig;
import com.hallsync.protocol.ActorState;
import com.hallsync.protocol.EnemyState;
import com.hallsync.protocol.Vector3;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Authoritative hostile entities: movement, combat arbitration and respawn.
 *
 * Enemies spawn in waves. Each wave gets fresh ids ("enemy-&lt;wave&gt;-&lt;index&gt;"), so an
 * id never comes back to life once dead. When a whole wave is dead the next wave
 * is due after the configured respawn delay and is spawned by the first tick past
 * that deadline.
 *
 * Thread Safety:
 * - None. Owned by the relay loop, like the session registry it reads actors from.
 */
public class EnemyWorld {

    private static final Logger logger = LoggerFactory.getLogger(EnemyWorld.class);

    private static final long WANDER_INTERVAL_MILLIS = 3000;
    private static final double WANDER_SPEED_FACTOR = 0.5;
    private static final double MIN_DIRECTION_LENGTH = 0.001;

    private final RelayConfig config;
    private final Random random;
    private final Map<String, Enemy> enemies = new LinkedHashMap<>();

    private int wave = -1;
    private boolean respawnPending;
    private long respawnAt;

    public EnemyWorld(RelayConfig config, Random random) {
        this.config = config;
        this.random = random;
    }

    /**
     * Replaces all enemies with a new wave at random positions.
     */
    public void spawnWave() {
        enemies.clear();
        wave++;
        double limitX = limitX();
        double limitZ = limitZ();
        for (int i = 0; i < config.getEnemyCount(); i++) {
            String id = "enemy-" + wave + "-" + i;
            double x = (random.nextDouble() - 0.5) * 2 * limitX;
            double z = (random.nextDouble() - 0.5) * 2 * limitZ;
            enemies.put(id, new Enemy(id, i, x, 0, z));
        }
        respawnPending = false;
        logger.info("Spawned enemy wave {} ({} enemies)", wave, enemies.size());
    }

    /**
     * Advances the simulation.
     *
     * @param deltaSeconds time since the previous tick
     * @param actors       current actor snapshot, used as pursuit targets
     * @param nowMillis    monotonic time in milliseconds, may be negative
     */
    public void tick(double deltaSeconds, Collection<ActorState> actors, long nowMillis) {
        if (respawnPending && nowMillis - respawnAt >= 0) {
            spawnWave();
            return;
        }
        if (deltaSeconds <= 0 || !Double.isFinite(deltaSeconds)) {
            return;
        }
        for (Enemy enemy : enemies.values()) {
            if (enemy.isAlive()) {
                step(enemy, deltaSeconds, actors, nowMillis);
            }
        }
    }

    private void step(Enemy enemy, double deltaSeconds, Collection<ActorState> actors, long nowMillis) {
        Pursuit target = findClosest(enemy, actors);
        double speed = config.getEnemySpeed();

        if (target != null) {
            // Within stop distance the enemy holds position, ready to be struck
            if (target.distance <= config.getStopDistance()) {
                return;
            }
            if (target.distance > MIN_DIRECTION_LENGTH) {
                enemy.setDirection(target.dx / target.distance, target.dz / target.distance);
            }
        } else {
            if (!enemy.hasWandered()
                    || nowMillis - enemy.getLastDirectionChange() > WANDER_INTERVAL_MILLIS) {
                double angle = random.nextDouble() * Math.PI * 2;
                enemy.setDirection(Math.cos(angle), Math.sin(angle));
                enemy.setLastDirectionChange(nowMillis);
            }
            speed *= WANDER_SPEED_FACTOR;
        }

        double x = enemy.getX() + enemy.getDirectionX() * speed * deltaSeconds;
        double z = enemy.getZ() + enemy.getDirectionZ() * speed * deltaSeconds;
        enemy.moveTo(clamp(x, limitX()), clamp(z, limitZ()));
    }

    private Pursuit findClosest(Enemy enemy, Collection<ActorState> actors) {
        Pursuit closest = null;
        for (ActorState actor : actors) {
            Vector3 position = actor.getPosition();
            if (position == null || !position.isFinite()) {
                continue;
            }
            double dx = position.getX() - enemy.getX();
            double dz = position.getZ() - enemy.getZ();
            double distance = Math.sqrt(dx * dx + dz * dz);
            if (distance < config.getDetectionRange() && (closest == null || distance < closest.distance)) {
                closest = new Pursuit(dx, dz, distance);
            }
        }
        return closest;
    }

    /**
     * Arbitrates an attack intent. One hit kills.
     *
     * @param enemyId   target named by the client
     * @param attacker  the attacking actor's current state
     * @param nowMillis monotonic time, used to schedule the next wave
     */
    public AttackOutcome attack(String enemyId, ActorState attacker, long nowMillis) {
        Enemy enemy = enemies.get(enemyId);
        if (enemy == null) {
            return AttackOutcome.UNKNOWN_ENEMY;
        }
        if (!enemy.isAlive()) {
            return AttackOutcome.ALREADY_DEAD;
        }

        Vector3 position = attacker.getPosition();
        if (position == null || !position.isFinite()) {
            return AttackOutcome.OUT_OF_REACH;
        }
        double dx = position.getX() - enemy.getX();
        double dz = position.getZ() - enemy.getZ();
        if (Math.sqrt(dx * dx + dz * dz) > config.getAttackReach()) {
            return AttackOutcome.OUT_OF_REACH;
        }

        enemy.kill();
        logger.info("Actor {} eliminated {}", attacker.getId(), enemyId);

        if (!respawnPending && allDead()) {
            respawnPending = true;
            respawnAt = nowMillis + config.getRespawnDelayMillis();
            logger.info("All enemies eliminated, next wave in {} ms", config.getRespawnDelayMillis());
        }
        return AttackOutcome.HIT;
    }

    private boolean allDead() {
        for (Enemy enemy : enemies.values()) {
            if (enemy.isAlive()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns an immutable copy of all enemies of the current wave, dead ones included.
     */
    public List<EnemyState> snapshot() {
        List<EnemyState> states = new ArrayList<>(enemies.size());
        for (Enemy enemy : enemies.values()) {
            states.add(enemy.toState());
        }
        return List.copyOf(states);
    }

    public Enemy getEnemy(String enemyId) {
        return enemies.get(enemyId);
    }

    public int getWave() {
        return wave;
    }

    public boolean isRespawnPending() {
        return respawnPending;
    }

    private double limitX() {
        return config.getHallHalfWidth() - config.getBoundaryMargin();
    }

    private double limitZ() {
        return config.getHallHalfLength() - config.getBoundaryMargin();
    }

    private static double clamp(double value, double limit) {
        return Math.max(-limit, Math.min(limit, value));
    }

    private static final class Pursuit {
        final double dx;
        final double dz;
        final double distance;

        Pursuit(double dx, double dz, double distance) {
            this.dx = dx;
            this.dz = dz;
            this.distance = distance;
        }
    }
}
