package io.github.jakubt4.astrolabe.maneuver;

import io.github.jakubt4.astrolabe.error.GeometricInfeasibilityException;
import io.github.jakubt4.astrolabe.orbit.OrbitFormulas;
import io.github.jakubt4.astrolabe.orbit.OrbitPosition;
import io.github.jakubt4.astrolabe.physics.Body;
import io.github.jakubt4.astrolabe.physics.ObjectState;
import io.github.jakubt4.astrolabe.solver.SolverHelpers;
import org.hipparchus.util.FastMath;

/**
 * Two-burn transfer between coplanar circular orbits.
 */
public final class HohmannTransferOrbit {

    private HohmannTransferOrbit() {
    }

    /**
     * Burn magnitudes and coast time of a Hohmann transfer.
     *
     * @param firstBurn  departure burn, m/s along prograde (negative when lowering)
     * @param secondBurn arrival burn, m/s along the arrival prograde (negative when lowering)
     * @param coastTime  half period of the transfer ellipse, seconds
     */
    public record HohmannTransferData(double firstBurn, double secondBurn, double coastTime) {
    }

    /**
     * Closed-form burns between circular radii {@code currentRadius} and {@code newRadius}.
     */
    public static HohmannTransferData calculateBurn(final double mu, final double currentRadius, final double newRadius) {
        if (!(mu > 0.0) || !(currentRadius > 0.0) || !(newRadius > 0.0)) {
            throw new IllegalArgumentException(
                    "Gravitational parameter and radii must be positive: mu=" + mu + ", r1=" + currentRadius + ", r2=" + newRadius);
        }
        final var sum = currentRadius + newRadius;
        final var firstBurn = FastMath.sqrt(mu / currentRadius) * (FastMath.sqrt(2.0 * newRadius / sum) - 1.0);
        final var secondBurn = FastMath.sqrt(mu / newRadius) * (1.0 - FastMath.sqrt(2.0 * currentRadius / sum));
        final var coastTime = FastMath.PI * FastMath.sqrt(sum * sum * sum / (8.0 * mu));
        return new HohmannTransferData(firstBurn, secondBurn, coastTime);
    }

    /**
     * Phase angle the target must lead the transferring object by at departure, radians.
     */
    public static double alignmentAngle(final double currentRadius, final double newRadius) {
        final var ratio = currentRadius / newRadius + 1.0;
        return FastMath.PI * (1.0 - 1.0 / (2.0 * FastMath.sqrt(2.0)) * FastMath.sqrt(ratio * ratio * ratio));
    }

    /**
     * Waiting time until the target leads the object by the alignment angle.
     *
     * <p>Both positions must be on circular orbits in the same plane, so that their true
     * anomalies share a reference direction.
     */
    public static double timeToAlignment(final OrbitPosition orbitPosition, final OrbitPosition targetOrbitPosition) {
        final var r1 = orbitPosition.orbit().semiMajorAxis();
        final var r2 = targetOrbitPosition.orbit().semiMajorAxis();
        final var mu = orbitPosition.orbit().standardGravitationalParameter();

        final var alpha = alignmentAngle(r1, r2);
        final var phase = targetOrbitPosition.trueAnomaly() - orbitPosition.trueAnomaly();

        final var w1 = FastMath.sqrt(mu / (r1 * r1 * r1));
        final var w2 = FastMath.sqrt(mu / (r2 * r2 * r2));

        // the phase drifts at w2 - w1: backwards when transferring outwards, forwards inwards
        if (r2 > r1) {
            return OrbitFormulas.clampAngle(phase - alpha) / (w1 - w2);
        }
        return OrbitFormulas.clampAngle(alpha - phase) / (w2 - w1);
    }

    /**
     * Plans a transfer of {@code body} from circular radius {@code currentRadius} to {@code newRadius}.
     *
     * @throws GeometricInfeasibilityException if the current orbit is not circular
     */
    public static OrbitalManeuvers create(final ManeuverContext context,
                                          final Body body,
                                          final ObjectState state,
                                          final OrbitPosition orbitPosition,
                                          final double currentRadius,
                                          final double newRadius,
                                          final ManeuverTime maneuverTime) {
        final var orbit = orbitPosition.orbit();
        if (!orbit.isCircular()) {
            throw new GeometricInfeasibilityException("The orbit is not circular (e = " + orbit.eccentricity() + ")");
        }

        final var t1 = maneuverTime.timeFromNow(orbitPosition);
        final var burn = SolverHelpers.afterTime(context.keplerSolver(), body, state, orbit, t1);
        final var prograde = burn.state().makeRelative(burn.primaryBodyState()).prograde();

        final var data = calculateBurn(orbit.standardGravitationalParameter(), currentRadius, newRadius);
        return OrbitalManeuvers.sequence(
                new OrbitalManeuver(context.currentTime() + t1, prograde.scalarMultiply(data.firstBurn())),
                new OrbitalManeuver(context.currentTime() + t1 + data.coastTime(), prograde.scalarMultiply(-data.secondBurn())));
    }

    /**
     * Plans a transfer of {@code body} from its current circular orbit to radius {@code newRadius}.
     */
    public static OrbitalManeuvers create(final ManeuverContext context,
                                          final Body body,
                                          final double newRadius,
                                          final ManeuverTime maneuverTime) {
        final var state = body.getState();
        final var orbitPosition = OrbitPosition.of(body);
        return create(
                context,
                body,
                state,
                orbitPosition,
                state.distance(body.getPrimaryBody().getState()),
                newRadius,
                maneuverTime);
    }
}
