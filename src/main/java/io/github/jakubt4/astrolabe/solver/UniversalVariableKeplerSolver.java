package io.github.jakubt4.astrolabe.solver;

import io.github.jakubt4.astrolabe.error.NumericNonConvergenceException;
import io.github.jakubt4.astrolabe.orbit.Orbit;
import io.github.jakubt4.astrolabe.physics.ObjectState;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.random.RandomGenerator;
import org.hipparchus.random.Well19937c;
import org.hipparchus.util.FastMath;
import org.orekit.utils.PVCoordinates;

import java.util.Arrays;

import static io.github.jakubt4.astrolabe.physics.PhysicsConstants.TWO_PI;

/**
 * Kepler propagation with the universal variable formulation.
 *
 * <p>The universal anomaly x is found by Newton iteration on the universal Kepler equation,
 * which holds for every conic section. On bound orbits the time offset is first reduced modulo
 * the period to keep the iteration well conditioned for long propagations. A non-finite Newton
 * step restarts from a random guess seeded from the call's inputs, so results are reproducible.
 */
@Slf4j
public class UniversalVariableKeplerSolver implements KeplerProblemSolver {

    public static final int DEFAULT_MAX_ITERATIONS = 1000;
    public static final double DEFAULT_TOLERANCE = 1e-6;

    private final int maxIterations;
    private final double tolerance;

    public UniversalVariableKeplerSolver(final int maxIterations, final double tolerance) {
        if (maxIterations <= 0 || !(tolerance > 0.0)) {
            throw new IllegalArgumentException(
                    "Invalid solver settings: maxIterations=" + maxIterations + ", tolerance=" + tolerance);
        }
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    public UniversalVariableKeplerSolver() {
        this(DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
    }

    @Override
    public ObjectState solve(final ObjectState initialPrimaryBodyState,
                             final ObjectState initialState,
                             final Orbit initialOrbit,
                             final ObjectState primaryBodyStateAtTime,
                             final double time) {
        if (initialState.impacted()) {
            return SolverHelpers.moveImpactedObject(
                    initialOrbit.primaryBody(), initialPrimaryBodyState, primaryBodyStateAtTime, initialState, time);
        }

        final var relative = initialState.makeRelative(initialPrimaryBodyState);
        final var next = propagate(
                initialOrbit.standardGravitationalParameter(),
                relative.position(),
                relative.velocity(),
                time);

        return new ObjectState(
                initialState.time() + time,
                primaryBodyStateAtTime.position().add(next.getPosition()),
                primaryBodyStateAtTime.velocity().add(next.getVelocity()),
                initialState.rotation(),
                false);
    }

    /**
     * Propagates a position/velocity pair relative to an attractor of parameter {@code mu}.
     */
    public PVCoordinates propagate(final double mu, final Vector3D r0, final Vector3D v0, final double time) {
        if (time == 0.0) {
            return new PVCoordinates(r0, v0);
        }

        final var r0Norm = r0.getNorm();
        final var sqrtMu = FastMath.sqrt(mu);
        final var alpha = (2.0 * mu / r0Norm - v0.getNormSq()) / mu;
        final var radialVelocity = Vector3D.dotProduct(r0, v0) / sqrtMu;

        var t = time;
        if (alpha > 0.0) {
            final var period = TWO_PI / (sqrtMu * FastMath.pow(alpha, 1.5));
            if (FastMath.abs(time) > period / 2.0) {
                t = time - period * FastMath.rint(time / period);
            }
        }

        var x = initialGuess(mu, r0, v0, alpha, t);
        RandomGenerator random = null;

        var converged = false;
        var iteration = 0;
        while (iteration < maxIterations) {
            final var z = x * x * alpha;
            final var c = StumpffFunctions.c(z);
            final var s = StumpffFunctions.s(z);

            final var tn = (radialVelocity * x * x * c + (1.0 - r0Norm * alpha) * x * x * x * s + r0Norm * x) / sqrtMu;
            final var dtdx = (x * x * c + radialVelocity * x * (1.0 - z * s) + r0Norm * (1.0 - z * c)) / sqrtMu;
            final var dt = t - tn;

            var next = x + dt / dtdx;
            if (!Double.isFinite(next)) {
                if (random == null) {
                    random = new Well19937c(seed(r0, v0, time));
                }
                next = random.nextDouble() * sqrtMu * t / r0Norm;
            }
            x = next;
            iteration++;

            if (FastMath.abs(dt) <= FastMath.max(tolerance, 1e-13 * FastMath.abs(t))) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            log.trace("Kepler iteration did not converge: r0={}, v0={}, t={}", r0, v0, time);
            throw new NumericNonConvergenceException(
                    "Kepler problem did not converge within " + maxIterations + " iterations", iteration);
        }

        final var z = x * x * alpha;
        final var c = StumpffFunctions.c(z);
        final var s = StumpffFunctions.s(z);

        final var f = 1.0 - x * x / r0Norm * c;
        final var g = t - x * x * x / sqrtMu * s;
        final var r = new Vector3D(f, r0, g, v0);
        final var rNorm = r.getNorm();

        final var gDot = 1.0 - x * x / rNorm * c;
        final var fDot = sqrtMu / (r0Norm * rNorm) * x * (z * s - 1.0);
        final var v = new Vector3D(fDot, r0, gDot, v0);

        return new PVCoordinates(r, v);
    }

    private static double initialGuess(final double mu,
                                       final Vector3D r0,
                                       final Vector3D v0,
                                       final double alpha,
                                       final double t) {
        final var sqrtMu = FastMath.sqrt(mu);
        final var r0Norm = r0.getNorm();

        if (alpha > 0.0) {
            return sqrtMu * t * alpha;
        }
        if (alpha < 0.0) {
            final var a = 1.0 / alpha;
            final var sign = FastMath.signum(t);
            final var argument = (-2.0 * mu * alpha * t)
                    / (Vector3D.dotProduct(r0, v0) + sign * FastMath.sqrt(-mu * a) * (1.0 - r0Norm * alpha));
            final var guess = argument > 0.0 ? sign * FastMath.sqrt(-a) * FastMath.log(argument) : Double.NaN;
            if (Double.isFinite(guess)) {
                return guess;
            }
        }
        return sqrtMu * t / r0Norm;
    }

    private static int seed(final Vector3D r0, final Vector3D v0, final double time) {
        return Arrays.hashCode(new double[]{
                r0.getX(), r0.getY(), r0.getZ(), v0.getX(), v0.getY(), v0.getZ(), time
        });
    }
}
