package io.github.jakubt4.astrolabe.physics;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Kinematic state of an object at a single simulation instant.
 *
 * <p>Position and velocity are expressed in one frame, either absolute or relative to a
 * primary body. Switching frames is always explicit through {@link #makeRelative},
 * {@link #makeAbsolute} or {@link #swapReferenceFrame}; every operation returns a new value.
 *
 * @param time     simulation time in seconds
 * @param position position in metres
 * @param velocity velocity in metres per second
 * @param rotation rotation angle about the object's own axis, in radians
 * @param impacted whether the object rests on the surface of its primary body
 */
public record ObjectState(double time, Vector3D position, Vector3D velocity, double rotation, boolean impacted) {

    public ObjectState {
        if (position == null || velocity == null) {
            throw new IllegalArgumentException("Position and velocity are required");
        }
    }

    public ObjectState(final double time, final Vector3D position, final Vector3D velocity) {
        this(time, position, velocity, 0.0, false);
    }

    /**
     * A state at rest in the origin of the frame.
     */
    public static ObjectState origin(final double time) {
        return new ObjectState(time, Vector3D.ZERO, Vector3D.ZERO);
    }

    public Vector3D prograde() {
        return OrbitalFrame.prograde(velocity);
    }

    public Vector3D retrograde() {
        return prograde().negate();
    }

    public Vector3D radial() {
        return OrbitalFrame.radial(position);
    }

    /**
     * Unit vector along the orbital angular momentum ({@code r x v}).
     */
    public Vector3D normal() {
        return OrbitalFrame.normal(position, velocity);
    }

    public ObjectState add(final Vector3D deltaPosition, final Vector3D deltaVelocity) {
        return new ObjectState(time, position.add(deltaPosition), velocity.add(deltaVelocity), rotation, impacted);
    }

    public ObjectState addVelocity(final Vector3D deltaVelocity) {
        return add(Vector3D.ZERO, deltaVelocity);
    }

    public ObjectState withVelocity(final Vector3D newVelocity) {
        return new ObjectState(time, position, newVelocity, rotation, impacted);
    }

    public ObjectState withTime(final double newTime) {
        return new ObjectState(newTime, position, velocity, rotation, impacted);
    }

    public ObjectState withRotation(final double newRotation) {
        return new ObjectState(time, position, velocity, newRotation, impacted);
    }

    public ObjectState withImpacted(final boolean newImpacted) {
        return new ObjectState(time, position, velocity, rotation, newImpacted);
    }

    /**
     * Expresses this state relative to the given primary body state.
     */
    public ObjectState makeRelative(final ObjectState primaryBodyState) {
        return new ObjectState(
                time,
                position.subtract(primaryBodyState.position()),
                velocity.subtract(primaryBodyState.velocity()),
                rotation,
                impacted);
    }

    /**
     * Inverse of {@link #makeRelative}.
     */
    public ObjectState makeAbsolute(final ObjectState primaryBodyState) {
        return new ObjectState(
                time,
                position.add(primaryBodyState.position()),
                velocity.add(primaryBodyState.velocity()),
                rotation,
                impacted);
    }

    public ObjectState swapReferenceFrame(final ObjectState currentPrimaryBodyState, final ObjectState newPrimaryBodyState) {
        return makeRelative(currentPrimaryBodyState).makeAbsolute(newPrimaryBodyState);
    }

    public double distance(final ObjectState other) {
        return Vector3D.distance(position, other.position());
    }
}
