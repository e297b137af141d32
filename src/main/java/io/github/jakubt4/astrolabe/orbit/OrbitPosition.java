package io.github.jakubt4.astrolabe.orbit;

import io.github.jakubt4.astrolabe.physics.Body;
import io.github.jakubt4.astrolabe.physics.ObjectState;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

import java.util.Locale;

import static io.github.jakubt4.astrolabe.physics.PhysicsConstants.TWO_PI;

/**
 * An {@link Orbit} together with the true anomaly of an object travelling on it.
 *
 * <p>All conversions between Cartesian states and orbital elements go through this pair:
 * {@link #fromState} inverts a state into elements, {@link #calculateState} evaluates them back.
 */
public record OrbitPosition(Orbit orbit, double trueAnomaly) {

    /** Inclinations closer than this to 0 or pi are treated as equatorial. */
    static final double EQUATORIAL_EPSILON = 1e-10;

    public OrbitPosition {
        if (orbit == null) {
            throw new IllegalArgumentException("Orbit is required");
        }
    }

    /**
     * Derives the orbit and true anomaly of {@code state} about {@code primaryBody}.
     *
     * @param primaryBody      body providing the gravitational parameter
     * @param primaryBodyState state of the primary at the same instant as {@code state}
     * @param state            absolute state of the orbiting object
     */
    public static OrbitPosition fromState(final Body primaryBody,
                                          final ObjectState primaryBodyState,
                                          final ObjectState state) {
        final var r = state.position().subtract(primaryBodyState.position());
        final var v = state.velocity().subtract(primaryBodyState.velocity());
        final var mu = primaryBody.getStandardGravitationalParameter();

        final var h = Vector3D.crossProduct(r, v);
        final var e = new Vector3D(v.getNormSq() - mu / r.getNorm(), r, -Vector3D.dotProduct(r, v), v)
                .scalarMultiply(1.0 / mu);
        final var n = Vector3D.crossProduct(Vector3D.PLUS_K, h);

        final var parameter = h.getNormSq() / mu;
        final var eccentricity = e.getNorm();
        final var inclination = safeAngle(Vector3D.PLUS_K, h);
        final var nonEquatorial = inclination > EQUATORIAL_EPSILON
                && FastMath.abs(inclination - FastMath.PI) > EQUATORIAL_EPSILON;
        final var circular = eccentricity <= Orbit.ECCENTRICITY_EPSILON;

        var longitudeOfAscendingNode = 0.0;
        if (nonEquatorial) {
            longitudeOfAscendingNode = safeAngle(Vector3D.PLUS_I, n);
            if (n.getY() < 0.0) {
                longitudeOfAscendingNode = TWO_PI - longitudeOfAscendingNode;
            }
        }

        var argumentOfPeriapsis = 0.0;
        if (!circular) {
            if (nonEquatorial) {
                argumentOfPeriapsis = safeAngle(n, e);
                if (e.getZ() < 0.0) {
                    argumentOfPeriapsis = TWO_PI - argumentOfPeriapsis;
                }
            } else {
                // longitude of periapsis, mirrored for retrograde equatorial orbits
                argumentOfPeriapsis = FastMath.atan2(e.getY(), e.getX());
                if (h.getZ() < 0.0) {
                    argumentOfPeriapsis = TWO_PI - argumentOfPeriapsis;
                }
                argumentOfPeriapsis = MathUtils.normalizeAngle(argumentOfPeriapsis, FastMath.PI);
            }
        }

        double trueAnomaly;
        if (circular && !nonEquatorial) {
            trueAnomaly = safeAngle(Vector3D.PLUS_I, r);
            if (v.getX() > 0.0) {
                trueAnomaly = TWO_PI - trueAnomaly;
            }
        } else if (circular) {
            trueAnomaly = safeAngle(n, r);
            if (r.getZ() < 0.0) {
                trueAnomaly = TWO_PI - trueAnomaly;
            }
        } else {
            trueAnomaly = safeAngle(e, r);
            if (Vector3D.dotProduct(r, v) < 0.0) {
                trueAnomaly = TWO_PI - trueAnomaly;
            }
        }
        if (Double.isNaN(trueAnomaly)) {
            trueAnomaly = 0.0;
        }

        final var orbit = new Orbit(
                primaryBody,
                parameter,
                eccentricity,
                inclination,
                longitudeOfAscendingNode,
                argumentOfPeriapsis);
        return new OrbitPosition(orbit, trueAnomaly);
    }

    /**
     * Uses the current state of {@code primaryBody}.
     */
    public static OrbitPosition fromState(final Body primaryBody, final ObjectState state) {
        return fromState(primaryBody, primaryBody.getState(), state);
    }

    /**
     * The current orbit position of {@code body} about its primary.
     *
     * @throws IllegalArgumentException if {@code body} is the object of reference
     */
    public static OrbitPosition of(final Body body) {
        if (body.isObjectOfReference()) {
            throw new IllegalArgumentException("The object of reference [" + body.getName() + "] has no orbit");
        }
        return fromState(body.getPrimaryBody(), body.getPrimaryBody().getState(), body.getState());
    }

    private static double safeAngle(final Vector3D u, final Vector3D w) {
        if (u.getNorm() == 0.0 || w.getNorm() == 0.0) {
            return Double.NaN;
        }
        return Vector3D.angle(u, w);
    }

    public OrbitPosition withTrueAnomaly(final double newTrueAnomaly) {
        return new OrbitPosition(orbit, newTrueAnomaly);
    }

    public OrbitPosition withOrbit(final Orbit newOrbit) {
        return new OrbitPosition(newOrbit, trueAnomaly);
    }

    public OrbitPosition add(final double deltaParameter,
                             final double deltaEccentricity,
                             final double deltaInclination,
                             final double deltaNode,
                             final double deltaArgument,
                             final double deltaTrueAnomaly) {
        return new OrbitPosition(
                orbit.add(deltaParameter, deltaEccentricity, deltaInclination, deltaNode, deltaArgument),
                trueAnomaly + deltaTrueAnomaly);
    }

    public double eccentricAnomaly() {
        return orbit.isBound() ? OrbitFormulas.eccentricAnomaly(orbit.eccentricity(), trueAnomaly) : 0.0;
    }

    public double hyperbolicEccentricAnomaly() {
        return orbit.isHyperbolic() ? OrbitFormulas.hyperbolicEccentricAnomaly(orbit.eccentricity(), trueAnomaly) : 0.0;
    }

    public double parabolicEccentricAnomaly() {
        return orbit.isParabolic() ? OrbitFormulas.parabolicEccentricAnomaly(trueAnomaly) : 0.0;
    }

    /**
     * Time of flight from the current true anomaly to {@code target}.
     *
     * <p>On bound orbits the result is always in [0, period). On unbound orbits it is negative
     * when the target anomaly has already been passed.
     */
    public double timeToTrueAnomaly(final double target) {
        if (orbit.isBound()) {
            return timeToTrueAnomalyElliptical(target);
        } else if (orbit.isParabolic()) {
            return timeToTrueAnomalyParabolic(target);
        }
        return timeToTrueAnomalyHyperbolic(target);
    }

    public double timeToPeriapsis() {
        return timeToTrueAnomaly(TWO_PI);
    }

    /**
     * Time to the next apoapsis, positive infinity for unbound orbits.
     */
    public double timeToApoapsis() {
        if (orbit.isBound()) {
            return timeToTrueAnomalyElliptical(FastMath.PI);
        }
        return Double.POSITIVE_INFINITY;
    }

    private double timeToTrueAnomalyElliptical(final double target) {
        final var e = orbit.eccentricity();
        final var a = orbit.semiMajorAxis();
        final var factor = FastMath.sqrt(a * a * a / orbit.standardGravitationalParameter());

        final var currentE = OrbitFormulas.eccentricAnomaly(e, trueAnomaly);
        final var targetE = OrbitFormulas.eccentricAnomaly(e, target);
        var time = factor * (OrbitFormulas.meanAnomaly(e, targetE) - OrbitFormulas.meanAnomaly(e, currentE));

        // already passed: wait for the next revolution
        if (time < 0.0) {
            time += TWO_PI * factor;
        }
        return time;
    }

    private double timeToTrueAnomalyHyperbolic(final double target) {
        final var e = orbit.eccentricity();
        final var a = orbit.semiMajorAxis();
        final var factor = FastMath.sqrt(-a * a * a / orbit.standardGravitationalParameter());

        final var currentF = OrbitFormulas.hyperbolicEccentricAnomaly(e, trueAnomaly);
        final var targetF = OrbitFormulas.hyperbolicEccentricAnomaly(e, target);
        return factor * ((e * FastMath.sinh(targetF) - targetF) - (e * FastMath.sinh(currentF) - currentF));
    }

    private double timeToTrueAnomalyParabolic(final double target) {
        final var p = orbit.parameter();
        final var sqrtP = FastMath.sqrt(p);
        final var currentD = sqrtP * OrbitFormulas.parabolicEccentricAnomaly(trueAnomaly);
        final var targetD = sqrtP * OrbitFormulas.parabolicEccentricAnomaly(target);
        final var factor = 1.0 / (2.0 * FastMath.sqrt(orbit.standardGravitationalParameter()));

        return factor * ((p * targetD + targetD * targetD * targetD / 3.0)
                - (p * currentD + currentD * currentD * currentD / 3.0));
    }

    public ObjectState calculateState(final ObjectState primaryBodyState) {
        return orbit.calculateState(trueAnomaly, primaryBodyState);
    }

    public ObjectState calculateState() {
        return orbit.calculateState(trueAnomaly);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s @ ν=%.4f deg", orbit, FastMath.toDegrees(trueAnomaly));
    }
}
