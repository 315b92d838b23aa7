package com.hallsync.client.interpolation;

import com.hallsync.protocol.ActorState;
import com.hallsync.protocol.Rotation;
import com.hallsync.protocol.Vector3;

import javax.vecmath.Point3d;
import javax.vecmath.Quat4d;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Smooths remote actors between the relay's snapshots.
 *
 * Each remote actor has a target pose (from the latest snapshot) and a rendered pose.
 * Every frame the rendered pose moves toward the target by exponential smoothing:
 * a fraction {@code 1 - e^(-k * dt)} of the remaining gap, so convergence speed does
 * not depend on frame rate. Orientation uses slerp with the same weighting.
 *
 * Actors enter already at their target and leave as soon as a snapshot omits them.
 * Without new snapshots (e.g. after a disconnect) the last poses are kept.
 *
 * Thread Safety:
 * - All methods are synchronized. Snapshots typically arrive on the socket thread
 *   while {@link #tick} and {@link #poses} run on the render thread.
 */
public class RemoteActorInterpolator {

    public static final double DEFAULT_POSITION_RATE = 8.0;
    public static final double DEFAULT_ROTATION_RATE = 12.0;
    public static final double DEFAULT_HEIGHT = 0.9;

    private final double positionRate;
    private final double rotationRate;
    private final Map<String, Track> tracks = new LinkedHashMap<>();

    public RemoteActorInterpolator() {
        this(DEFAULT_POSITION_RATE, DEFAULT_ROTATION_RATE);
    }

    /**
     * @param positionRate smoothing constant for position, per second
     * @param rotationRate smoothing constant for orientation, per second
     */
    public RemoteActorInterpolator(double positionRate, double rotationRate) {
        if (!(positionRate > 0) || !(rotationRate > 0)) {
            throw new IllegalArgumentException("Smoothing rates must be positive");
        }
        this.positionRate = positionRate;
        this.rotationRate = rotationRate;
    }

    /**
     * Retargets every remote actor in the snapshot and drops the ones it no longer lists.
     *
     * @param players full snapshot from the relay
     * @param localId the local actor's id, which is never interpolated; may be null
     */
    public synchronized void applySnapshot(List<ActorState> players, String localId) {
        Set<String> seen = new HashSet<>();
        for (ActorState actor : players) {
            String id = actor.getId();
            if (id == null || id.equals(localId)) {
                continue;
            }
            seen.add(id);

            Point3d position = toPoint(actor.getPosition());
            Quat4d rotation = toQuat(actor.getRotation());
            Track track = tracks.get(id);
            if (track == null) {
                tracks.put(id, new Track(id, actor.getColor(), position, rotation));
            } else {
                track.color = actor.getColor();
                track.targetPosition.set(position);
                track.targetRotation.set(rotation);
            }
        }
        tracks.keySet().retainAll(seen);
    }

    /**
     * Advances every rendered pose toward its target.
     *
     * @param deltaSeconds frame time; non-positive or non-finite values are ignored
     */
    public synchronized void tick(double deltaSeconds) {
        if (!(deltaSeconds > 0) || Double.isInfinite(deltaSeconds)) {
            return;
        }
        double positionAlpha = 1.0 - Math.exp(-positionRate * deltaSeconds);
        double rotationAlpha = 1.0 - Math.exp(-rotationRate * deltaSeconds);

        for (Track track : tracks.values()) {
            track.position.interpolate(track.targetPosition, positionAlpha);

            // Quat4d.interpolate may negate its argument, so slerp toward a copy
            Quat4d goal = new Quat4d(track.targetRotation);
            track.rotation.interpolate(goal, rotationAlpha);
            track.rotation.normalize();
        }
    }

    /**
     * Current rendered poses, in the relay's snapshot order.
     */
    public synchronized List<RenderedPose> poses() {
        List<RenderedPose> poses = new ArrayList<>(tracks.size());
        for (Track track : tracks.values()) {
            poses.add(track.toPose());
        }
        return poses;
    }

    /**
     * @return the rendered pose of one actor, or null if it is not tracked
     */
    public synchronized RenderedPose pose(String id) {
        Track track = tracks.get(id);
        return track != null ? track.toPose() : null;
    }

    public synchronized int size() {
        return tracks.size();
    }

    public synchronized void clear() {
        tracks.clear();
    }

    static Point3d toPoint(Vector3 position) {
        if (position == null) {
            return new Point3d(0, DEFAULT_HEIGHT, 0);
        }
        return new Point3d(
                finiteOr(position.getX(), 0),
                finiteOr(position.getY(), DEFAULT_HEIGHT),
                finiteOr(position.getZ(), 0));
    }

    static Quat4d toQuat(Rotation rotation) {
        if (rotation == null || !rotation.isFinite()) {
            return identity();
        }
        double norm = Math.sqrt(rotation.getX() * rotation.getX()
                + rotation.getY() * rotation.getY()
                + rotation.getZ() * rotation.getZ()
                + rotation.getW() * rotation.getW());
        if (norm < 1e-9 || Double.isInfinite(norm)) {
            return identity();
        }
        return new Quat4d(rotation.getX() / norm, rotation.getY() / norm,
                rotation.getZ() / norm, rotation.getW() / norm);
    }

    private static Quat4d identity() {
        return new Quat4d(0, 0, 0, 1);
    }

    private static double finiteOr(double value, double fallback) {
        return Double.isFinite(value) ? value : fallback;
    }

    private static final class Track {
        final String id;
        String color;
        final Point3d position;
        final Point3d targetPosition;
        final Quat4d rotation;
        final Quat4d targetRotation;

        Track(String id, String color, Point3d position, Quat4d rotation) {
            this.id = id;
            this.color = color;
            this.position = new Point3d(position);
            this.targetPosition = new Point3d(position);
            this.rotation = new Quat4d(rotation);
            this.targetRotation = new Quat4d(rotation);
        }

        RenderedPose toPose() {
            return new RenderedPose(id, color,
                    new Vector3(position.x, position.y, position.z),
                    new Rotation(rotation.x, rotation.y, rotation.z, rotation.w));
        }
    }
}
