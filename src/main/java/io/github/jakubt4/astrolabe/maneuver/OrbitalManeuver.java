package io.github.jakubt4.astrolabe.maneuver;

import io.github.jakubt4.astrolabe.orbit.OrbitPosition;
import io.github.jakubt4.astrolabe.physics.Body;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.util.Locale;

/**
 * A single impulsive burn: at {@code maneuverTime}, add {@code deltaVelocity} to the object's
 * velocity exactly once, in the frame the velocity was planned in.
 *
 * @param maneuverTime  absolute simulation time in seconds
 * @param deltaVelocity velocity change in m/s
 */
public record OrbitalManeuver(double maneuverTime, Vector3D deltaVelocity) {

    /**
     * Schedules a burn for {@code body} at a time relative to its current orbit.
     */
    public static OrbitalManeuver burn(final ManeuverContext context,
                                       final Body body,
                                       final Vector3D deltaVelocity,
                                       final ManeuverTime time) {
        final var orbitPosition = OrbitPosition.of(body);
        return new OrbitalManeuver(context.currentTime() + time.timeFromNow(orbitPosition), deltaVelocity);
    }

    public double deltaV() {
        return deltaVelocity.getNorm();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "time: %.1f s, Δv: %.3f m/s", maneuverTime, deltaV());
    }
}
