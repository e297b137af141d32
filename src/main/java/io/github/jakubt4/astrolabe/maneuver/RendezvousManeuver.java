package io.github.jakubt4.astrolabe.maneuver;

import io.github.jakubt4.astrolabe.error.GeometricInfeasibilityException;
import io.github.jakubt4.astrolabe.orbit.OrbitFormulas;
import io.github.jakubt4.astrolabe.orbit.OrbitPosition;
import io.github.jakubt4.astrolabe.physics.Body;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;

import static io.github.jakubt4.astrolabe.physics.PhysicsConstants.TWO_PI;

/**
 * Rendezvous with another object orbiting the same primary.
 *
 * <p>Two configurations are supported: coplanar circular orbits of different radii, solved by a
 * Hohmann transfer timed to arrive next to the target, and a shared orbit, solved by a phasing
 * orbit that returns to periapsis together with the target.
 */
@Slf4j
public final class RendezvousManeuver {

    private RendezvousManeuver() {
    }

    /**
     * Plans a rendezvous of {@code body} with {@code target} from their current states.
     *
     * @throws GeometricInfeasibilityException if the orbits are neither coplanar circular nor the same
     */
    public static OrbitalManeuvers rendezvous(final ManeuverContext context, final Body body, final Body target) {
        if (body.getPrimaryBody() != target.getPrimaryBody()) {
            throw new GeometricInfeasibilityException(
                    "[" + body.getName() + "] and [" + target.getName() + "] orbit different primary bodies");
        }
        final var orbitPosition = OrbitPosition.of(body);
        final var targetOrbitPosition = OrbitPosition.of(target);
        final var orbit = orbitPosition.orbit();
        final var targetOrbit = targetOrbitPosition.orbit();

        if (orbit.sameOrbit(targetOrbit)) {
            return inSameOrbit(context, body, orbitPosition, targetOrbitPosition, 1);
        }
        if (orbit.isCircular() && targetOrbit.isCircular()) {
            return inCircularOrbit(context, body, orbitPosition, targetOrbitPosition);
        }
        throw new GeometricInfeasibilityException("Rendezvous from " + orbit + " to " + targetOrbit
                + " is an unsupported configuration");
    }

    /**
     * Hohmann transfer from one circular orbit to a coplanar circular orbit, started once the
     * target leads by the alignment angle.
     */
    public static OrbitalManeuvers inCircularOrbit(final ManeuverContext context,
                                                   final Body body,
                                                   final OrbitPosition orbitPosition,
                                                   final OrbitPosition targetOrbitPosition) {
        final var orbit = orbitPosition.orbit();
        final var targetOrbit = targetOrbitPosition.orbit();
        if (!orbit.isCircular() || !targetOrbit.isCircular()) {
            throw new GeometricInfeasibilityException("Both orbits must be circular");
        }
        if (!orbit.samePlane(targetOrbit)) {
            throw new GeometricInfeasibilityException("Both orbits must lie in the same plane");
        }

        final var waitTime = HohmannTransferOrbit.timeToAlignment(orbitPosition, targetOrbitPosition);
        log.debug("[{}] rendezvous by Hohmann transfer in {} s", body.getName(), waitTime);
        return HohmannTransferOrbit.create(
                context,
                body,
                body.getState(),
                orbitPosition,
                orbit.semiMajorAxis(),
                targetOrbit.semiMajorAxis(),
                ManeuverTime.timeFromNow(waitTime));
    }

    /**
     * Phasing maneuver for two objects on the same orbit.
     *
     * <p>At periapsis the object enters a phasing orbit whose period, taken {@code phasingOrbits}
     * times, brings it back to periapsis exactly when the target arrives there; a second burn
     * restores the original orbit.
     *
     * @param phasingOrbits number of revolutions on the phasing orbit, at least one
     */
    public static OrbitalManeuvers inSameOrbit(final ManeuverContext context,
                                               final Body body,
                                               final OrbitPosition orbitPosition,
                                               final OrbitPosition targetOrbitPosition,
                                               final int phasingOrbits) {
        final var orbit = orbitPosition.orbit();
        final var targetOrbit = targetOrbitPosition.orbit();
        if (!orbit.sameOrbit(targetOrbit)) {
            throw new GeometricInfeasibilityException("Both objects must be on the same orbit");
        }
        if (orbit.isUnbound()) {
            throw new GeometricInfeasibilityException("Phasing requires a bound orbit");
        }
        if (phasingOrbits < 1) {
            throw new IllegalArgumentException("At least one phasing orbit is required: " + phasingOrbits);
        }

        final var primaryBody = orbit.primaryBody();
        final var primaryBodyState = primaryBody.getState();
        final var mu = orbit.standardGravitationalParameter();

        // where the target is when the object reaches periapsis
        final var timeToPeriapsis = orbitPosition.timeToPeriapsis();
        final var targetState = targetOrbitPosition.calculateState(primaryBodyState);
        final var targetAtPeriapsis = context.keplerSolver().solve(primaryBodyState, targetState, targetOrbit, timeToPeriapsis);
        final var deltaTrueAnomaly = OrbitPosition.fromState(primaryBody, primaryBodyState, targetAtPeriapsis).trueAnomaly();

        final var period = orbit.period();
        final var e = orbit.eccentricity();
        final var eccentricAnomaly = 2.0 * FastMath.atan(FastMath.sqrt((1.0 - e) / (1.0 + e)) * FastMath.tan(deltaTrueAnomaly / 2.0));
        final var timeSincePeriapsis = period / (TWO_PI * phasingOrbits) * OrbitFormulas.meanAnomaly(e, eccentricAnomaly);
        final var phasingTime = (period - timeSincePeriapsis) * phasingOrbits;

        final var phasingPeriod = phasingTime / phasingOrbits;
        final var phasingSemiMajorAxis = FastMath.cbrt(mu * FastMath.pow(phasingPeriod / TWO_PI, 2.0));
        final var rp = orbit.periapsis();
        final var ra = 2.0 * phasingSemiMajorAxis - rp;
        if (!(ra > 0.0) || (primaryBody.hasRadius() && ra < primaryBody.getRadius())) {
            throw new GeometricInfeasibilityException(
                    "Phasing orbit with far point " + ra + " m intersects [" + primaryBody.getName() + "]");
        }

        final var h1 = FastMath.sqrt(orbit.parameter() * mu);
        final var h2 = FastMath.sqrt(2.0 * mu) * FastMath.sqrt(ra * rp / (ra + rp));
        final var deltaV = (h2 - h1) / rp;
        final var direction = orbitPosition.withTrueAnomaly(0.0).calculateState(primaryBodyState)
                .makeRelative(primaryBodyState)
                .prograde();
        log.debug("[{}] phasing over {} orbit(s): Δν={} rad, T={} s, Δv={} m/s",
                body.getName(), phasingOrbits, deltaTrueAnomaly, phasingTime, deltaV);

        final var now = context.currentTime();
        return OrbitalManeuvers.sequence(
                new OrbitalManeuver(now + timeToPeriapsis, direction.scalarMultiply(deltaV)),
                new OrbitalManeuver(now + timeToPeriapsis + phasingTime, direction.scalarMultiply(-deltaV)));
    }
}
