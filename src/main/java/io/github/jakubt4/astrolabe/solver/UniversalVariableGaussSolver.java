package io.github.jakubt4.astrolabe.solver;

import io.github.jakubt4.astrolabe.error.NumericNonConvergenceException;
import io.github.jakubt4.astrolabe.physics.Body;
import io.github.jakubt4.astrolabe.physics.ObjectState;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.random.RandomGenerator;
import org.hipparchus.random.Well19937c;
import org.hipparchus.util.FastMath;

import java.util.Arrays;

import static io.github.jakubt4.astrolabe.physics.PhysicsConstants.TWO_PI;

/**
 * Lambert solver in universal variables (Bate, Mueller and White).
 *
 * <p>Newton iteration on z is kept inside a bracket that shrinks with every evaluation, since the
 * time of flight grows monotonically with z. A step that leaves the bracket, or a z where y(z)
 * is negative, restarts from a random point of the bracket. The generator is seeded from the
 * call's inputs so that concurrent searches stay reproducible.
 */
@Slf4j
public class UniversalVariableGaussSolver implements GaussProblemSolver {

    public static final int DEFAULT_MAX_ITERATIONS = 1000;
    public static final double DEFAULT_TOLERANCE = 1e-6;

    /** Upper limit of z for single-revolution transfers. */
    private static final double Z_UPPER_BOUND = 4.0 * FastMath.PI * FastMath.PI;

    /** Transfers with sin(dnu) below this are collinear and have no unique plane. */
    private static final double COLLINEARITY_EPSILON = 1e-10;

    private final int maxIterations;
    private final double tolerance;

    public UniversalVariableGaussSolver(final int maxIterations, final double tolerance) {
        if (maxIterations <= 0 || !(tolerance > 0.0)) {
            throw new IllegalArgumentException(
                    "Invalid solver settings: maxIterations=" + maxIterations + ", tolerance=" + tolerance);
        }
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    public UniversalVariableGaussSolver() {
        this(DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
    }

    @Override
    public GaussProblemResult solve(final Body primaryBody,
                                    final ObjectState primaryBodyState1,
                                    final ObjectState primaryBodyState2,
                                    final Vector3D position1,
                                    final Vector3D position2,
                                    final double time,
                                    final boolean shortWay) {
        if (!(time > 0.0)) {
            throw new IllegalArgumentException("Time of flight must be positive: " + time);
        }

        final var mu = primaryBody.getStandardGravitationalParameter();
        final var r1 = position1.subtract(primaryBodyState1.position());
        final var r2 = position2.subtract(primaryBodyState2.position());
        final var r1Norm = r1.getNorm();
        final var r2Norm = r2.getNorm();

        if (Vector3D.crossProduct(r1, r2).getNorm() <= COLLINEARITY_EPSILON * r1Norm * r2Norm) {
            throw new NumericNonConvergenceException("Lambert problem is degenerate for collinear positions");
        }

        var deltaNu = Vector3D.angle(r1, r2);
        if (!shortWay) {
            deltaNu = TWO_PI - deltaNu;
        }
        final var a = FastMath.signum(FastMath.PI - deltaNu) * FastMath.sqrt(r1Norm * r2Norm * (1.0 + FastMath.cos(deltaNu)));
        final var z = solveZ(mu, r1Norm, r2Norm, a, deltaNu, time, seed(r1, r2, time, shortWay));

        final var y = y(r1Norm, r2Norm, a, z);
        final var f = 1.0 - y / r1Norm;
        final var g = a * FastMath.sqrt(y / mu);
        final var gDot = 1.0 - y / r2Norm;

        final var v1 = new Vector3D(1.0 / g, r2, -f / g, r1);
        final var v2 = new Vector3D(gDot / g, r2, -1.0 / g, r1);
        if (!isFinite(v1) || !isFinite(v2)) {
            throw new NumericNonConvergenceException("Lambert problem produced non-finite velocities");
        }

        return new GaussProblemResult(
                v1.add(primaryBodyState1.velocity()),
                v2.add(primaryBodyState2.velocity()));
    }

    private double solveZ(final double mu,
                          final double r1,
                          final double r2,
                          final double a,
                          final double deltaNu,
                          final double timeOfFlight,
                          final int seed) {
        final var sqrtMu = FastMath.sqrt(mu);
        final var bracket = new Bracket(seed);

        var z = deltaNu * deltaNu;
        for (var iteration = 0; iteration < maxIterations; iteration++) {
            if (!bracket.contains(z)) {
                z = bracket.reseed();
            }

            final var c = StumpffFunctions.c(z);
            final var s = StumpffFunctions.s(z);
            final var y = y(r1, r2, a, z);
            if (y < 0.0) {
                // y(z) is increasing, so the solution lies above
                bracket.lower = z;
                z = bracket.reseed();
                continue;
            }

            final var x = FastMath.sqrt(y / c);
            final var sqrtY = FastMath.sqrt(y);
            final var t = (x * x * x * s + a * sqrtY) / sqrtMu;
            final var dt = timeOfFlight - t;
            if (FastMath.abs(dt) <= FastMath.max(tolerance, 1e-12 * timeOfFlight)) {
                return z;
            }

            if (dt > 0.0) {
                bracket.lower = z;
            } else {
                bracket.upper = z;
            }
            if (bracket.upper - bracket.lower <= 1e-15 * FastMath.max(1.0, FastMath.abs(z))) {
                return z;
            }

            final var sPrime = StumpffFunctions.sPrime(z, c, s);
            final var cPrime = StumpffFunctions.cPrime(z, c, s);
            final var dtdz = (x * x * x * (sPrime - 3.0 * s * cPrime / (2.0 * c))
                    + a / 8.0 * (3.0 * s * sqrtY / c + a / x)) / sqrtMu;

            final var next = z + dt / dtdz;
            z = Double.isFinite(next) && bracket.contains(next) ? next : bracket.reseed();
        }

        log.trace("Lambert iteration did not converge: r1={}, r2={}, dnu={}, tof={}", r1, r2, deltaNu, timeOfFlight);
        throw new NumericNonConvergenceException(
                "Lambert problem did not converge within " + maxIterations + " iterations", maxIterations);
    }

    private static double y(final double r1, final double r2, final double a, final double z) {
        return r1 + r2 - a * (1.0 - z * StumpffFunctions.s(z)) / FastMath.sqrt(StumpffFunctions.c(z));
    }

    private static boolean isFinite(final Vector3D v) {
        return Double.isFinite(v.getX()) && Double.isFinite(v.getY()) && Double.isFinite(v.getZ());
    }

    private static int seed(final Vector3D r1, final Vector3D r2, final double time, final boolean shortWay) {
        return Arrays.hashCode(new double[]{
                r1.getX(), r1.getY(), r1.getZ(), r2.getX(), r2.getY(), r2.getZ(), time, shortWay ? 1.0 : 0.0
        });
    }

    /**
     * Open interval known to contain the solution z.
     */
    private static final class Bracket {

        private final int seed;
        private RandomGenerator random;
        private double lower = Double.NEGATIVE_INFINITY;
        private double upper = Z_UPPER_BOUND;

        private Bracket(final int seed) {
            this.seed = seed;
        }

        private boolean contains(final double z) {
            return z > lower && z < upper;
        }

        private double reseed() {
            if (random == null) {
                random = new Well19937c(seed);
            }
            if (Double.isInfinite(lower)) {
                return FastMath.min(upper, 0.0) - (1.0 + random.nextDouble()) * FastMath.max(Z_UPPER_BOUND, FastMath.abs(upper));
            }
            return lower + (0.25 + 0.5 * random.nextDouble()) * (upper - lower);
        }
    }
}
