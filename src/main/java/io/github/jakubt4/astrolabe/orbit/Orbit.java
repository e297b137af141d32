package io.github.jakubt4.astrolabe.orbit;

import io.github.jakubt4.astrolabe.physics.Body;
import io.github.jakubt4.astrolabe.physics.ObjectState;
import org.hipparchus.geometry.euclidean.threed.Rotation;
import org.hipparchus.geometry.euclidean.threed.RotationConvention;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

import java.util.Locale;

/**
 * Classical orbital elements about a primary body.
 *
 * <p>The elements are expressed in the simulation frame: {@code +Z} is the reference pole and
 * {@code +X} the reference direction for the longitude of the ascending node. Undefined angles
 * (node of an equatorial orbit, periapsis of a circular one) are stored as {@code 0}.
 *
 * @param primaryBody              body providing the gravitational parameter
 * @param parameter                semi-latus rectum p, in metres
 * @param eccentricity             eccentricity e
 * @param inclination              inclination i, radians in [0, pi]
 * @param longitudeOfAscendingNode longitude of the ascending node, radians
 * @param argumentOfPeriapsis      argument of periapsis, radians
 */
public record Orbit(Body primaryBody,
                    double parameter,
                    double eccentricity,
                    double inclination,
                    double longitudeOfAscendingNode,
                    double argumentOfPeriapsis) {

    public static final double ECCENTRICITY_EPSILON = 1e-4;

    public Orbit {
        if (primaryBody == null) {
            throw new IllegalArgumentException("An orbit requires a primary body");
        }
        if (!(parameter >= 0.0) || !(eccentricity >= 0.0)) {
            throw new IllegalArgumentException(
                    "Invalid orbit size: p=" + parameter + ", e=" + eccentricity);
        }
        if (Double.isNaN(longitudeOfAscendingNode)) {
            longitudeOfAscendingNode = 0.0;
        }
        if (Double.isNaN(argumentOfPeriapsis)) {
            argumentOfPeriapsis = 0.0;
        }
        if (Double.isNaN(inclination)) {
            inclination = 0.0;
        }
    }

    /**
     * Builds an orbit from its semi-major axis instead of its parameter.
     */
    public static Orbit fromSemiMajorAxis(final Body primaryBody,
                                          final double semiMajorAxis,
                                          final double eccentricity,
                                          final double inclination,
                                          final double longitudeOfAscendingNode,
                                          final double argumentOfPeriapsis) {
        return new Orbit(
                primaryBody,
                OrbitFormulas.parameterFromSemiMajorAxis(semiMajorAxis, eccentricity),
                eccentricity,
                inclination,
                longitudeOfAscendingNode,
                argumentOfPeriapsis);
    }

    /**
     * Circular equatorial orbit of the given radius.
     */
    public static Orbit circular(final Body primaryBody, final double radius) {
        return new Orbit(primaryBody, radius, 0.0, 0.0, 0.0, 0.0);
    }

    /**
     * The current orbit of {@code body} about its primary.
     */
    public static Orbit of(final Body body) {
        return OrbitPosition.of(body).orbit();
    }

    public Orbit withParameter(final double newParameter) {
        return new Orbit(primaryBody, newParameter, eccentricity, inclination, longitudeOfAscendingNode, argumentOfPeriapsis);
    }

    public Orbit withEccentricity(final double newEccentricity) {
        return new Orbit(primaryBody, parameter, newEccentricity, inclination, longitudeOfAscendingNode, argumentOfPeriapsis);
    }

    public Orbit withInclination(final double newInclination) {
        return new Orbit(primaryBody, parameter, eccentricity, newInclination, longitudeOfAscendingNode, argumentOfPeriapsis);
    }

    public Orbit withLongitudeOfAscendingNode(final double newNode) {
        return new Orbit(primaryBody, parameter, eccentricity, inclination, newNode, argumentOfPeriapsis);
    }

    public Orbit withArgumentOfPeriapsis(final double newArgument) {
        return new Orbit(primaryBody, parameter, eccentricity, inclination, longitudeOfAscendingNode, newArgument);
    }

    /**
     * Offsets every element by the given amounts.
     */
    public Orbit add(final double deltaParameter,
                     final double deltaEccentricity,
                     final double deltaInclination,
                     final double deltaNode,
                     final double deltaArgument) {
        return new Orbit(
                primaryBody,
                parameter + deltaParameter,
                eccentricity + deltaEccentricity,
                inclination + deltaInclination,
                longitudeOfAscendingNode + deltaNode,
                argumentOfPeriapsis + deltaArgument);
    }

    public double standardGravitationalParameter() {
        return primaryBody.getStandardGravitationalParameter();
    }

    public OrbitType type() {
        if (isCircular()) {
            return OrbitType.CIRCULAR;
        } else if (isElliptical()) {
            return OrbitType.ELLIPTICAL;
        } else if (isParabolic()) {
            return OrbitType.PARABOLIC;
        }
        return OrbitType.HYPERBOLIC;
    }

    public boolean isCircular() {
        return eccentricity <= ECCENTRICITY_EPSILON;
    }

    public boolean isElliptical() {
        return eccentricity > ECCENTRICITY_EPSILON && eccentricity < 1.0 - ECCENTRICITY_EPSILON;
    }

    public boolean isParabolic() {
        return FastMath.abs(eccentricity - 1.0) <= ECCENTRICITY_EPSILON;
    }

    public boolean isHyperbolic() {
        return eccentricity > 1.0 + ECCENTRICITY_EPSILON;
    }

    public boolean isBound() {
        return eccentricity < 1.0 - ECCENTRICITY_EPSILON;
    }

    public boolean isUnbound() {
        return !isBound();
    }

    public boolean isRadialParabolic() {
        return parameter <= 1e-5 && isParabolic();
    }

    public double periapsis() {
        return parameter / (1.0 + eccentricity);
    }

    /**
     * Apoapsis distance, positive infinity for unbound orbits.
     */
    public double apoapsis() {
        if (isUnbound()) {
            return Double.POSITIVE_INFINITY;
        }
        return parameter / (1.0 - eccentricity);
    }

    /**
     * Periapsis height above the surface of the primary body.
     */
    public double relativePeriapsis() {
        return periapsis() - primaryBody.getRadius();
    }

    public double relativeApoapsis() {
        return apoapsis() - primaryBody.getRadius();
    }

    /**
     * Semi-major axis; negative for hyperbolic orbits, infinite for parabolic ones.
     */
    public double semiMajorAxis() {
        if (isBound() || isHyperbolic()) {
            return parameter / (1.0 - eccentricity * eccentricity);
        }
        return Double.POSITIVE_INFINITY;
    }

    /**
     * Orbital period; not finite for unbound orbits.
     */
    public double period() {
        return OrbitFormulas.orbitalPeriod(standardGravitationalParameter(), semiMajorAxis());
    }

    /**
     * Position and velocity at the given true anomaly, offset by the primary body state.
     * The returned state carries the primary state's time.
     */
    public ObjectState calculateState(final double trueAnomaly, final ObjectState primaryBodyState) {
        final var cosNu = FastMath.cos(trueAnomaly);
        final var sinNu = FastMath.sin(trueAnomaly);
        final var distance = parameter / (1.0 + eccentricity * cosNu);
        final var speedFactor = FastMath.sqrt(standardGravitationalParameter() / parameter);

        final var r = new Vector3D(distance * cosNu, distance * sinNu, 0.0);
        final var v = new Vector3D(-speedFactor * sinNu, speedFactor * (eccentricity + cosNu), 0.0);

        return new ObjectState(
                primaryBodyState.time(),
                primaryBodyState.position().add(toReferenceFrame(r)),
                primaryBodyState.velocity().add(toReferenceFrame(v)));
    }

    public ObjectState calculateState(final double trueAnomaly) {
        return calculateState(trueAnomaly, primaryBody.getState());
    }

    /**
     * Rotates a perifocal vector through the 3-1-3 sequence (omega, i, Omega).
     */
    Vector3D toReferenceFrame(final Vector3D perifocal) {
        final var omega = isCircular() ? 0.0 : argumentOfPeriapsis;
        final var periapsisRotation = new Rotation(Vector3D.PLUS_K, omega, RotationConvention.VECTOR_OPERATOR);
        final var inclinationRotation = new Rotation(Vector3D.PLUS_I, inclination, RotationConvention.VECTOR_OPERATOR);
        final var nodeRotation = new Rotation(Vector3D.PLUS_K, longitudeOfAscendingNode, RotationConvention.VECTOR_OPERATOR);
        return nodeRotation.applyTo(inclinationRotation.applyTo(periapsisRotation.applyTo(perifocal)));
    }

    /**
     * Compares all five elements. The parameter is compared relative to its size, angles
     * modulo a full turn.
     */
    public boolean sameOrbit(final Orbit other, final double epsilon) {
        return FastMath.abs(parameter - other.parameter) <= epsilon * FastMath.max(parameter, other.parameter)
                && FastMath.abs(eccentricity - other.eccentricity) <= epsilon
                && angleDifference(inclination, other.inclination) <= epsilon
                && angleDifference(longitudeOfAscendingNode, other.longitudeOfAscendingNode) <= epsilon
                && angleDifference(argumentOfPeriapsis, other.argumentOfPeriapsis) <= epsilon;
    }

    public boolean sameOrbit(final Orbit other) {
        return sameOrbit(other, ECCENTRICITY_EPSILON);
    }

    public boolean samePlane(final Orbit other, final double epsilon) {
        if (angleDifference(inclination, other.inclination) > epsilon) {
            return false;
        }
        if (FastMath.sin(inclination) <= epsilon) {
            // equatorial planes share no node
            return true;
        }
        return angleDifference(longitudeOfAscendingNode, other.longitudeOfAscendingNode) <= epsilon;
    }

    public boolean samePlane(final Orbit other) {
        return samePlane(other, ECCENTRICITY_EPSILON);
    }

    private static double angleDifference(final double a, final double b) {
        return FastMath.abs(MathUtils.normalizeAngle(a - b, 0.0));
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "{ p: %.1f m, e: %.6f, i: %.4f deg, Ω: %.4f deg, ω: %.4f deg, rp: %.1f m, ra: %.1f m, T: %.1f s }",
                parameter,
                eccentricity,
                FastMath.toDegrees(inclination),
                FastMath.toDegrees(longitudeOfAscendingNode),
                FastMath.toDegrees(argumentOfPeriapsis),
                periapsis(),
                apoapsis(),
                period());
    }
}
