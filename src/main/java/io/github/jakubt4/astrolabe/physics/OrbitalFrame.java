package io.github.jakubt4.astrolabe.physics;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.linear.Array2DRowRealMatrix;
import org.hipparchus.linear.ArrayRealVector;
import org.hipparchus.linear.LUDecomposition;

/**
 * Local orbital axes (prograde, normal, radial) of a position/velocity pair.
 *
 * <p>Prograde and radial are not orthogonal on eccentric orbits, so velocity components are
 * obtained by solving the 3x3 basis system rather than by projection.
 */
public final class OrbitalFrame {

    private OrbitalFrame() {
    }

    public static Vector3D prograde(final Vector3D velocity) {
        return unitOrZero(velocity);
    }

    public static Vector3D radial(final Vector3D position) {
        return unitOrZero(position);
    }

    public static Vector3D normal(final Vector3D position, final Vector3D velocity) {
        final var h = Vector3D.crossProduct(position, velocity);
        if (h.getNorm() == 0.0) {
            // radial or degenerate motion has no orbital plane
            return velocity.getNorm() == 0.0 ? Vector3D.PLUS_K : velocity.orthogonal();
        }
        return h.normalize();
    }

    /**
     * Expresses {@code deltaVelocity} in the (prograde, normal, radial) basis of the given state.
     *
     * @throws org.hipparchus.exception.MathIllegalArgumentException if the basis is singular,
     *                                                               i.e. on purely radial motion
     */
    public static VelocityComponents decompose(final ObjectState state, final Vector3D deltaVelocity) {
        final var prograde = state.prograde();
        final var normal = state.normal();
        final var radial = state.radial();

        final var basis = new Array2DRowRealMatrix(new double[][]{
                {prograde.getX(), normal.getX(), radial.getX()},
                {prograde.getY(), normal.getY(), radial.getY()},
                {prograde.getZ(), normal.getZ(), radial.getZ()}
        });
        final var solution = new LUDecomposition(basis).getSolver()
                .solve(new ArrayRealVector(deltaVelocity.toArray()));
        return new VelocityComponents(solution.getEntry(0), solution.getEntry(1), solution.getEntry(2));
    }

    private static Vector3D unitOrZero(final Vector3D vector) {
        final var norm = vector.getNorm();
        return norm == 0.0 ? Vector3D.ZERO : vector.scalarMultiply(1.0 / norm);
    }

    /**
     * Velocity expressed along the prograde, normal and radial axes.
     */
    public record VelocityComponents(double prograde, double normal, double radial) {
    }
}
