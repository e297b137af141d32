package io.github.jakubt4.astrolabe.maneuver;

import io.github.jakubt4.astrolabe.error.GeometricInfeasibilityException;
import io.github.jakubt4.astrolabe.orbit.Orbit;
import io.github.jakubt4.astrolabe.orbit.OrbitFormulas;
import io.github.jakubt4.astrolabe.orbit.OrbitPosition;
import io.github.jakubt4.astrolabe.physics.Body;
import io.github.jakubt4.astrolabe.physics.ObjectState;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;

/**
 * Single-burn changes of one orbital element.
 */
@Slf4j
public final class BasicManeuver {

    private BasicManeuver() {
    }

    /**
     * Moves the periapsis with a burn at apoapsis.
     *
     * @throws GeometricInfeasibilityException if the orbit is unbound or {@code newPeriapsis}
     *                                         lies above the current apoapsis
     */
    public static OrbitalManeuvers changePeriapsis(final ManeuverContext context, final Body body, final double newPeriapsis) {
        final var orbitPosition = OrbitPosition.of(body);
        final var orbit = orbitPosition.orbit();

        if (orbit.isUnbound()) {
            throw new GeometricInfeasibilityException("Cannot change the periapsis of an unbound orbit");
        }
        if (newPeriapsis > orbit.apoapsis()) {
            throw new GeometricInfeasibilityException(
                    "New periapsis " + newPeriapsis + " m is above the apoapsis " + orbit.apoapsis() + " m");
        }

        final var apoapsis = orbit.apoapsis();
        final var deltaV = tangentialBurn(orbit, FastMath.PI, (newPeriapsis + apoapsis) / 2.0);
        log.debug("[{}] periapsis {} -> {} m, Δv={} m/s", body.getName(), orbit.periapsis(), newPeriapsis, deltaV.getNorm());

        return OrbitalManeuvers.single(OrbitalManeuver.burn(context, body, deltaV, ManeuverTime.apoapsis()));
    }

    /**
     * Moves the apoapsis with a burn at periapsis.
     *
     * @throws GeometricInfeasibilityException if {@code newApoapsis} lies below the current periapsis
     *                                         or the periapsis of an unbound orbit has been passed
     */
    public static OrbitalManeuvers changeApoapsis(final ManeuverContext context, final Body body, final double newApoapsis) {
        final var orbitPosition = OrbitPosition.of(body);
        final var orbit = orbitPosition.orbit();

        final var periapsis = orbit.periapsis();
        if (newApoapsis < periapsis) {
            throw new GeometricInfeasibilityException(
                    "New apoapsis " + newApoapsis + " m is below the periapsis " + periapsis + " m");
        }
        if (orbit.isUnbound() && orbitPosition.timeToPeriapsis() < 0.0) {
            throw new GeometricInfeasibilityException("The periapsis of the unbound orbit has already been passed");
        }

        final var deltaV = tangentialBurn(orbit, 0.0, (newApoapsis + periapsis) / 2.0);
        log.debug("[{}] apoapsis {} -> {} m, Δv={} m/s", body.getName(), orbit.apoapsis(), newApoapsis, deltaV.getNorm());

        return OrbitalManeuvers.single(OrbitalManeuver.burn(context, body, deltaV, ManeuverTime.periapsis()));
    }

    /**
     * Rotates the orbital plane about the line of nodes with a burn at the descending node.
     */
    public static OrbitalManeuvers changeInclination(final ManeuverContext context, final Body body, final double newInclination) {
        final var orbitPosition = OrbitPosition.of(body);
        final var orbit = orbitPosition.orbit();
        if (newInclination < 0.0 || newInclination > FastMath.PI) {
            throw new IllegalArgumentException("Inclination must be within [0, pi]: " + newInclination);
        }

        // argument of latitude pi: the position lies on the node line for every inclination
        final var argumentOfPeriapsis = orbit.isCircular() ? 0.0 : orbit.argumentOfPeriapsis();
        final var nodeTrueAnomaly = OrbitFormulas.clampAngle(FastMath.PI - argumentOfPeriapsis);

        final var deltaV = orbit.withInclination(newInclination).calculateState(nodeTrueAnomaly).velocity()
                .subtract(orbit.calculateState(nodeTrueAnomaly).velocity());

        return OrbitalManeuvers.single(OrbitalManeuver.burn(
                context, body, deltaV, ManeuverTime.timeFromNow(orbitPosition.timeToTrueAnomaly(nodeTrueAnomaly))));
    }

    /**
     * Prograde burn at an apsis that leaves the object on an orbit with {@code newSemiMajorAxis}.
     * The velocity at an apsis is perpendicular to the radius, so the new orbit keeps that apsis.
     */
    private static Vector3D tangentialBurn(final Orbit orbit, final double apsisTrueAnomaly, final double newSemiMajorAxis) {
        final var atApsis = orbit.calculateState(apsisTrueAnomaly, ObjectState.origin(0.0));
        final var newSpeed = OrbitFormulas.visVivaSpeed(
                orbit.standardGravitationalParameter(), atApsis.position().getNorm(), newSemiMajorAxis);
        return atApsis.prograde().scalarMultiply(newSpeed - atApsis.velocity().getNorm());
    }
}
