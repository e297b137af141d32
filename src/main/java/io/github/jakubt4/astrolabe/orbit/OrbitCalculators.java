package io.github.jakubt4.astrolabe.orbit;

import io.github.jakubt4.astrolabe.physics.PhysicsConstants;
import io.github.jakubt4.astrolabe.solver.KeplerProblemSolver;
import org.hipparchus.optim.MaxEval;
import org.hipparchus.optim.nonlinear.scalar.GoalType;
import org.hipparchus.optim.univariate.BrentOptimizer;
import org.hipparchus.optim.univariate.SearchInterval;
import org.hipparchus.optim.univariate.UnivariateObjectiveFunction;
import org.hipparchus.util.FastMath;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.DoubleUnaryOperator;

/**
 * Derived quantities computed from one or two orbit positions: closest approach, sphere of
 * influence exit and surface impact.
 */
public final class OrbitCalculators {

    /** Sampling window used when either orbit is unbound. */
    static final double UNBOUND_APPROACH_WINDOW = PhysicsConstants.ONE_DAY;

    /** Samples per window when no explicit step is requested. */
    static final int DEFAULT_SAMPLES_PER_WINDOW = 2000;

    /** Largest widening of the sampling step while the objects separate. */
    private static final double MAX_STEP_RATE = 50.0;

    /** Smallest fraction of the base step used while the objects close in quickly. */
    static final double MIN_STEP_RATE = 0.1;

    /** True anomalies this close to a full turn are treated as periapsis. */
    private static final double FULL_TURN_EPSILON = 1e-5;

    private OrbitCalculators() {
    }

    /**
     * Finds the closest approach of two objects orbiting the same primary body within one
     * synodic period, sampling step {@code synodicPeriod / 2000}.
     *
     * @see #closestApproach(KeplerProblemSolver, OrbitPosition, OrbitPosition, double)
     */
    public static Optional<ApproachData> closestApproach(final KeplerProblemSolver solver,
                                                         final OrbitPosition orbitPosition1,
                                                         final OrbitPosition orbitPosition2) {
        return closestApproach(solver, orbitPosition1, orbitPosition2, 0.0);
    }

    /**
     * Finds the closest approach of two objects orbiting the same primary body.
     *
     * <p>Both objects are sampled over one synodic period (one day if either orbit is unbound).
     * The step widens up to fifty-fold while the separation grows, scaled by how fast it grows
     * relative to the fastest closing rate seen so far. While the objects close in, the step
     * shrinks down to a tenth of the base step so that it never covers more than half of the
     * remaining separation at the current closing rate. The best sample is then refined with
     * Brent's method between its neighbours.
     *
     * @param deltaTime base sampling step in seconds; non-positive selects {@code window / 2000}
     * @return the approach, or empty when the primaries differ or the periods are equal
     */
    public static Optional<ApproachData> closestApproach(final KeplerProblemSolver solver,
                                                         final OrbitPosition orbitPosition1,
                                                         final OrbitPosition orbitPosition2,
                                                         final double deltaTime) {
        final var orbit1 = orbitPosition1.orbit();
        final var orbit2 = orbitPosition2.orbit();
        if (orbit1.primaryBody() != orbit2.primaryBody()) {
            return Optional.empty();
        }

        final double window;
        if (orbit1.isUnbound() || orbit2.isUnbound()) {
            window = UNBOUND_APPROACH_WINDOW;
        } else {
            window = OrbitFormulas.synodicPeriod(orbit1.period(), orbit2.period());
            if (window == 0.0) {
                return Optional.empty();
            }
        }
        final var step = deltaTime > 0.0 ? deltaTime : window / DEFAULT_SAMPLES_PER_WINDOW;

        final var primaryState = orbit1.primaryBody().getState();
        final var initial1 = orbitPosition1.calculateState(primaryState);
        final var initial2 = orbitPosition2.calculateState(primaryState);
        final DoubleUnaryOperator separation = t -> solver.solve(primaryState, initial1, orbit1, t)
                .distance(solver.solve(primaryState, initial2, orbit2, t));

        var minDistance = Double.MAX_VALUE;
        var minTime = 0.0;
        var lowerNeighbour = 0.0;
        var upperNeighbour = Double.NaN;
        var awaitingUpperNeighbour = false;

        var maxClosingRate = 0.0;
        var previousDistance = 0.0;
        var previousTime = 0.0;
        var first = true;
        var t = 0.0;
        while (t <= window) {
            final var distance = separation.applyAsDouble(t);
            if (distance < minDistance) {
                minDistance = distance;
                minTime = t;
                lowerNeighbour = first ? t : previousTime;
                awaitingUpperNeighbour = true;
            } else if (awaitingUpperNeighbour) {
                upperNeighbour = t;
                awaitingUpperNeighbour = false;
            }

            var stepRate = 1.0;
            if (!first) {
                final var closingRate = (previousDistance - distance) / step;
                maxClosingRate = FastMath.max(maxClosingRate, closingRate);
                if (closingRate < 0.0) {
                    final var fraction = maxClosingRate > 0.0
                            ? FastMath.min(1.0, FastMath.abs(closingRate) / maxClosingRate)
                            : 1.0;
                    stepRate = 1.0 + (MAX_STEP_RATE - 1.0) * fraction;
                } else if (closingRate > 0.0) {
                    final var elapsedClosingRate = (previousDistance - distance) / (t - previousTime);
                    stepRate = FastMath.max(MIN_STEP_RATE,
                            FastMath.min(1.0, distance / (2.0 * elapsedClosingRate * step)));
                }
            }

            previousTime = t;
            previousDistance = distance;
            first = false;
            t += stepRate * step;
        }
        if (awaitingUpperNeighbour) {
            upperNeighbour = FastMath.min(window, minTime + step);
        }

        if (upperNeighbour > lowerNeighbour) {
            final var refined = new BrentOptimizer(1e-10, 1e-3).optimize(
                    new MaxEval(200),
                    new UnivariateObjectiveFunction(separation::applyAsDouble),
                    GoalType.MINIMIZE,
                    new SearchInterval(lowerNeighbour, upperNeighbour, minTime));
            if (refined.getValue() < minDistance) {
                minDistance = refined.getValue();
                minTime = refined.getPoint();
            }
        }

        return Optional.of(new ApproachData(minDistance, primaryState.time() + minTime));
    }

    /**
     * Time until an object on an unbound orbit leaves the sphere of influence of its primary.
     *
     * @return time in seconds, or empty if the orbit is bound, the primary has no primary of its
     *         own, the orbit never reaches the boundary or the boundary has already been crossed
     */
    public static OptionalDouble timeToLeaveSphereOfInfluence(final OrbitPosition orbitPosition) {
        final var orbit = orbitPosition.orbit();
        if (orbit.isBound()) {
            return OptionalDouble.empty();
        }

        var position = orbitPosition;
        if (2.0 * FastMath.PI - position.trueAnomaly() <= FULL_TURN_EPSILON) {
            position = position.withTrueAnomaly(0.0);
        }

        final var soiBody = orbit.primaryBody();
        final var nextSoiBody = soiBody.getPrimaryBody();
        if (nextSoiBody == null) {
            return OptionalDouble.empty();
        }

        final var soi = OrbitFormulas.sphereOfInfluence(
                Orbit.of(soiBody).semiMajorAxis(), soiBody.getMass(), nextSoiBody.getMass());
        return timeToDistance(position, soi);
    }

    /**
     * Time until an object hits the surface of its primary body.
     *
     * @return time in seconds, or empty if the periapsis clears the surface
     */
    public static OptionalDouble timeToImpact(final OrbitPosition orbitPosition) {
        final var orbit = orbitPosition.orbit();
        final var primaryBody = orbit.primaryBody();
        if (!primaryBody.hasRadius() || orbit.periapsis() > primaryBody.getRadius()) {
            return OptionalDouble.empty();
        }
        return timeToDistance(orbitPosition, primaryBody.getRadius());
    }

    private static OptionalDouble timeToDistance(final OrbitPosition position, final double distance) {
        final var orbit = position.orbit();
        final var roots = OrbitFormulas.trueAnomalyAt(distance, orbit.parameter(), orbit.eccentricity());
        if (roots.isEmpty()) {
            return OptionalDouble.empty();
        }

        final var time = position.timeToTrueAnomaly(roots.get().nearest(position.trueAnomaly()));
        return time > 0.0 ? OptionalDouble.of(time) : OptionalDouble.empty();
    }
}
