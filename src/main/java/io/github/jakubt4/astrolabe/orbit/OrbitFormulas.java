package io.github.jakubt4.astrolabe.orbit;

import io.github.jakubt4.astrolabe.physics.ObjectConfig;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

import java.util.Optional;

import static io.github.jakubt4.astrolabe.physics.PhysicsConstants.TWO_PI;

/**
 * Closed-form two-body formulas. All quantities are SI.
 */
public final class OrbitFormulas {

    /** Orbital periods closer than this (seconds) have no synodic period. */
    public static final double SYNODIC_PERIOD_EPSILON = 1e-2;

    private OrbitFormulas() {
    }

    public static double parameterFromSemiMajorAxis(final double semiMajorAxis, final double eccentricity) {
        return semiMajorAxis * (1.0 - eccentricity * eccentricity);
    }

    /**
     * Gravitational acceleration at {@code r} relative to an attractor of parameter {@code mu}.
     */
    public static Vector3D gravityAcceleration(final double mu, final Vector3D r) {
        final var normSq = r.getNormSq();
        return r.scalarMultiply(-mu / (normSq * FastMath.sqrt(normSq)));
    }

    public static double orbitalPeriod(final double mu, final double semiMajorAxis) {
        return TWO_PI / FastMath.sqrt(mu) * FastMath.pow(semiMajorAxis, 1.5);
    }

    /**
     * Time between successive alignments of two bodies with the given periods, {@code 0} when the
     * periods are (nearly) equal.
     */
    public static double synodicPeriod(final double period1, final double period2) {
        if (FastMath.abs(period1 - period2) <= SYNODIC_PERIOD_EPSILON) {
            return 0.0;
        }
        final var shorter = FastMath.min(period1, period2);
        final var longer = FastMath.max(period1, period2);
        return 1.0 / (1.0 / shorter - 1.0 / longer);
    }

    public static double semiMajorAxisFromOrbitalPeriod(final double mu, final double period) {
        return FastMath.cbrt(mu * period * period / (4.0 * FastMath.PI * FastMath.PI));
    }

    /**
     * Laplace sphere of influence radius of a body of mass {@code massSmaller} orbiting one of
     * mass {@code massLarger} at semi-major axis {@code semiMajorAxis}.
     */
    public static double sphereOfInfluence(final double semiMajorAxis, final double massSmaller, final double massLarger) {
        return semiMajorAxis * FastMath.pow(massSmaller / massLarger, 0.4);
    }

    /**
     * Speed from the vis-viva equation.
     */
    public static double visVivaSpeed(final double mu, final double distance, final double semiMajorAxis) {
        return FastMath.sqrt(mu * (2.0 / distance - 1.0 / semiMajorAxis));
    }

    public static double circularSpeed(final double mu, final double radius) {
        return FastMath.sqrt(mu / radius);
    }

    public static double escapeSpeed(final double mu, final double distance) {
        return FastMath.sqrt(2.0 * mu / distance);
    }

    /**
     * The two true anomalies at which an orbit of the given shape reaches {@code distance}.
     *
     * @return both roots in [0, 2pi), or empty if the orbit never reaches that distance
     */
    public static Optional<TrueAnomalyRoots> trueAnomalyAt(final double distance,
                                                           final double parameter,
                                                           final double eccentricity) {
        final var cosTrueAnomaly = (parameter - distance) / (eccentricity * distance);
        final var trueAnomaly = FastMath.acos(cosTrueAnomaly);
        if (Double.isNaN(trueAnomaly)) {
            return Optional.empty();
        }
        return Optional.of(new TrueAnomalyRoots(clampAngle(trueAnomaly), clampAngle(-trueAnomaly)));
    }

    /**
     * Angular velocity (rad/s) at the given distance on an orbit.
     */
    public static double angularVelocity(final double semiMajorAxis,
                                         final double eccentricity,
                                         final double period,
                                         final double distance) {
        if (eccentricity < 1e-6) {
            return TWO_PI / period;
        }
        final var semiMinorAxis = semiMajorAxis * FastMath.sqrt(1.0 - eccentricity * eccentricity);
        return TWO_PI * semiMajorAxis * semiMinorAxis / (period * distance * distance);
    }

    /**
     * Eccentric anomaly in [0, 2pi] for a true anomaly in [0, 2pi].
     */
    public static double eccentricAnomaly(final double eccentricity, final double trueAnomaly) {
        final var cosNu = FastMath.cos(trueAnomaly);
        final var sinNu = FastMath.abs(FastMath.sin(trueAnomaly));
        final var anomaly = FastMath.atan2(FastMath.sqrt(1.0 - eccentricity * eccentricity) * sinNu, eccentricity + cosNu);
        return trueAnomaly > FastMath.PI ? TWO_PI - anomaly : anomaly;
    }

    /**
     * Hyperbolic anomaly F, negative on the incoming branch (true anomaly in [pi, 2pi]).
     */
    public static double hyperbolicEccentricAnomaly(final double eccentricity, final double trueAnomaly) {
        final var cosNu = FastMath.cos(trueAnomaly);
        final var sinNu = FastMath.abs(FastMath.sin(trueAnomaly));
        final var anomaly = FastMath.asinh(FastMath.sqrt(eccentricity * eccentricity - 1.0) * sinNu
                / (1.0 + eccentricity * cosNu));
        return trueAnomaly >= FastMath.PI && trueAnomaly <= TWO_PI ? -anomaly : anomaly;
    }

    public static double parabolicEccentricAnomaly(final double trueAnomaly) {
        return FastMath.tan(trueAnomaly / 2.0);
    }

    public static double meanAnomaly(final double eccentricity, final double eccentricAnomaly) {
        return eccentricAnomaly - eccentricity * FastMath.sin(eccentricAnomaly);
    }

    public static double trueAnomalyFromEccentricAnomaly(final double eccentricity, final double eccentricAnomaly) {
        return 2.0 * FastMath.atan2(
                FastMath.sqrt(1.0 + eccentricity) * FastMath.sin(eccentricAnomaly / 2.0),
                FastMath.sqrt(1.0 - eccentricity) * FastMath.cos(eccentricAnomaly / 2.0));
    }

    public static double altitude(final Vector3D primaryBodyPosition, final double primaryBodyRadius, final Vector3D position) {
        return Vector3D.distance(position, primaryBodyPosition) - primaryBodyRadius;
    }

    /**
     * Speed of a surface point at the given latitude due to the rotation of its body.
     */
    public static double surfaceSpeedDueToRotation(final ObjectConfig primaryBodyConfig,
                                                   final double primaryBodyRadius,
                                                   final double latitude) {
        return primaryBodyConfig.rotationalSpeed() * primaryBodyRadius * FastMath.cos(latitude);
    }

    /**
     * Maps an angle to [0, 2pi).
     */
    public static double clampAngle(final double angle) {
        return MathUtils.normalizeAngle(angle, FastMath.PI);
    }

    /**
     * The two roots of {@link #trueAnomalyAt}.
     */
    public record TrueAnomalyRoots(double first, double second) {

        /**
         * The root closer to {@code trueAnomaly}.
         */
        public double nearest(final double trueAnomaly) {
            return FastMath.abs(trueAnomaly - first) < FastMath.abs(trueAnomaly - second) ? first : second;
        }
    }
}
