package io.github.jakubt4.astrolabe.physics;

import lombok.Getter;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * A body taking part in the two-body simulation: a star, planet, moon or spacecraft.
 *
 * <p>Bodies form a tree through {@link #getPrimaryBody()}; the root is the object of reference
 * and has no primary. The configuration is fixed at construction. The current state is replaced
 * only by the external propagation step through {@link #updateState}; the engine itself reads it
 * and never writes it.
 */
@Getter
public class Body {

    private final String name;
    private final ObjectConfig configuration;
    private final double radius;
    private final Body primaryBody;

    private volatile ObjectState state;

    public Body(final String name,
                final ObjectConfig configuration,
                final double radius,
                final Body primaryBody,
                final ObjectState state) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Body name is required");
        }
        if (radius < 0.0) {
            throw new IllegalArgumentException("Radius must not be negative: " + radius);
        }
        this.name = name;
        this.configuration = configuration == null ? ObjectConfig.empty() : configuration;
        this.radius = radius;
        this.primaryBody = primaryBody;
        this.state = state;
    }

    /**
     * Creates the root body of a scenario, fixed at the origin.
     */
    public static Body reference(final String name, final ObjectConfig configuration, final double radius) {
        return new Body(name, configuration, radius, null, ObjectState.origin(0.0));
    }

    /**
     * Creates a point-like body (no physical radius), typically a spacecraft.
     */
    public static Body craft(final String name, final double mass, final Body primaryBody, final ObjectState state) {
        return new Body(name, new ObjectConfig(mass), 0.0, primaryBody, state);
    }

    public boolean isObjectOfReference() {
        return primaryBody == null;
    }

    public boolean hasRadius() {
        return radius > 0.0;
    }

    public double getMass() {
        return configuration.mass();
    }

    public double getStandardGravitationalParameter() {
        return configuration.standardGravitationalParameter();
    }

    /**
     * Tests whether {@code position} lies inside this body when its centre is at {@code bodyPosition}.
     */
    public boolean intersects(final Vector3D bodyPosition, final Vector3D position) {
        return hasRadius() && Vector3D.distance(bodyPosition, position) < radius;
    }

    public void updateState(final ObjectState newState) {
        if (newState == null) {
            throw new IllegalArgumentException("State is required");
        }
        this.state = newState;
    }

    @Override
    public String toString() {
        return name;
    }
}
