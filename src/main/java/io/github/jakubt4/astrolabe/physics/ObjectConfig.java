package io.github.jakubt4.astrolabe.physics;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Static physical configuration of a body.
 *
 * @param mass             mass in kilograms
 * @param rotationalPeriod sidereal rotation period in seconds, {@code 0} for a non-rotating body
 * @param axisOfRotation   unit axis of rotation, {@code +Z} unless specified
 */
public record ObjectConfig(double mass, double rotationalPeriod, Vector3D axisOfRotation) {

    private static final ObjectConfig EMPTY = new ObjectConfig(0.0, 0.0, Vector3D.PLUS_K);

    public ObjectConfig {
        if (mass < 0.0) {
            throw new IllegalArgumentException("Mass must not be negative: " + mass);
        }
        axisOfRotation = axisOfRotation == null ? Vector3D.PLUS_K : axisOfRotation.normalize();
    }

    public ObjectConfig(final double mass) {
        this(mass, 0.0, Vector3D.PLUS_K);
    }

    public static ObjectConfig empty() {
        return EMPTY;
    }

    /**
     * Configuration of a body with the given standard gravitational parameter (m^3/s^2).
     */
    public static ObjectConfig ofGravitationalParameter(final double mu, final double rotationalPeriod) {
        return new ObjectConfig(mu / PhysicsConstants.G, rotationalPeriod, Vector3D.PLUS_K);
    }

    public double standardGravitationalParameter() {
        return mass * PhysicsConstants.G;
    }

    /**
     * Angular speed of rotation in rad/s, {@code 0} for a non-rotating body.
     */
    public double rotationalSpeed() {
        return rotationalPeriod == 0.0 ? 0.0 : PhysicsConstants.TWO_PI / rotationalPeriod;
    }

    public ObjectConfig withMass(final double newMass) {
        return new ObjectConfig(newMass, rotationalPeriod, axisOfRotation);
    }
}
