package io.github.jakubt4.astrolabe.solver;

import org.hipparchus.util.FastMath;

/**
 * Stumpff functions C(z), S(z) and their derivatives.
 *
 * <p>Near {@code z = 0} (near-parabolic motion) the closed forms cancel catastrophically, so
 * truncated Taylor series are used for {@code |z| < 1e-3}.
 */
public final class StumpffFunctions {

    static final double SERIES_THRESHOLD = 1e-3;

    private StumpffFunctions() {
    }

    public static double c(final double z) {
        if (FastMath.abs(z) < SERIES_THRESHOLD) {
            return 1.0 / 2.0 - z / 24.0 + z * z / 720.0 - z * z * z / 40320.0;
        }
        if (z > 0.0) {
            return (1.0 - FastMath.cos(FastMath.sqrt(z))) / z;
        }
        return (1.0 - FastMath.cosh(FastMath.sqrt(-z))) / z;
    }

    public static double s(final double z) {
        if (FastMath.abs(z) < SERIES_THRESHOLD) {
            return 1.0 / 6.0 - z / 120.0 + z * z / 5040.0 - z * z * z / 362880.0;
        }
        if (z > 0.0) {
            final var sqrtZ = FastMath.sqrt(z);
            return (sqrtZ - FastMath.sin(sqrtZ)) / (sqrtZ * sqrtZ * sqrtZ);
        }
        final var sqrtZ = FastMath.sqrt(-z);
        return (FastMath.sinh(sqrtZ) - sqrtZ) / (sqrtZ * sqrtZ * sqrtZ);
    }

    /**
     * dC/dz, given {@code c = C(z)} and {@code s = S(z)}.
     */
    public static double cPrime(final double z, final double c, final double s) {
        if (FastMath.abs(z) < SERIES_THRESHOLD) {
            return -1.0 / 24.0 + 2.0 * z / 720.0 - 3.0 * z * z / 40320.0 + 4.0 * z * z * z / 3628800.0;
        }
        return (1.0 - z * s - 2.0 * c) / (2.0 * z);
    }

    /**
     * dS/dz, given {@code c = C(z)} and {@code s = S(z)}.
     */
    public static double sPrime(final double z, final double c, final double s) {
        if (FastMath.abs(z) < SERIES_THRESHOLD) {
            return -1.0 / 120.0 + 2.0 * z / 5040.0 - 3.0 * z * z / 362880.0 + 4.0 * z * z * z / 39916800.0;
        }
        return (c - 3.0 * s) / (2.0 * z);
    }
}
