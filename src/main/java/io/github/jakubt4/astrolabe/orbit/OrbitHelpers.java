package io.github.jakubt4.astrolabe.orbit;

import io.github.jakubt4.astrolabe.physics.Body;
import io.github.jakubt4.astrolabe.physics.ObjectState;
import org.hipparchus.geometry.euclidean.threed.Rotation;
import org.hipparchus.geometry.euclidean.threed.RotationConvention;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;

/**
 * Geometric helpers around orbits and body surfaces.
 */
public final class OrbitHelpers {

    private OrbitHelpers() {
    }

    /**
     * Counterclockwise angle in [0, 2pi) from {@code from} to {@code to}, measured about {@code axis}.
     * Both vectors are projected onto the plane normal to the axis first.
     */
    public static double angleAbout(final Vector3D axis, final Vector3D from, final Vector3D to) {
        final var unitAxis = axis.normalize();
        final var u = from.subtract(Vector3D.dotProduct(from, unitAxis), unitAxis);
        final var w = to.subtract(Vector3D.dotProduct(to, unitAxis), unitAxis);
        final var angle = FastMath.atan2(
                Vector3D.dotProduct(Vector3D.crossProduct(u, w), unitAxis),
                Vector3D.dotProduct(u, w));
        return OrbitFormulas.clampAngle(angle);
    }

    /**
     * Angle of an object around a primary body measured from the primary's direction of motion,
     * counterclockwise about {@code axis}.
     */
    public static double angleToPrograde(final Vector3D primaryBodyPosition,
                                         final Vector3D primaryBodyVelocity,
                                         final Vector3D objectPosition,
                                         final Vector3D axis) {
        return angleAbout(axis, primaryBodyVelocity, objectPosition.subtract(primaryBodyPosition));
    }

    public static double angleToPrograde(final Vector3D primaryBodyPosition,
                                         final Vector3D primaryBodyVelocity,
                                         final Vector3D objectPosition) {
        return angleToPrograde(primaryBodyPosition, primaryBodyVelocity, objectPosition, Vector3D.PLUS_K);
    }

    /**
     * Latitude and longitude of {@code position} on the rotating surface of {@code primaryBody}.
     */
    public static SurfaceCoordinates surfaceCoordinates(final Body primaryBody, final Vector3D position) {
        final var primaryState = primaryBody.getState();
        final var axis = primaryBody.getConfiguration().axisOfRotation();
        final var bodyFixed = new Rotation(axis, -primaryState.rotation(), RotationConvention.VECTOR_OPERATOR)
                .applyTo(position.subtract(primaryState.position()));

        final var meridian = primeMeridian(axis);
        final var east = Vector3D.crossProduct(axis, meridian);
        final var latitude = FastMath.asin(
                FastMath.max(-1.0, FastMath.min(1.0, Vector3D.dotProduct(bodyFixed, axis) / bodyFixed.getNorm())));
        final var longitude = FastMath.atan2(Vector3D.dotProduct(bodyFixed, east), Vector3D.dotProduct(bodyFixed, meridian));
        return new SurfaceCoordinates(latitude, longitude);
    }

    /**
     * Absolute position at the given coordinates and distance from the centre of {@code primaryBody}.
     */
    public static Vector3D fromSurfaceCoordinates(final Body primaryBody,
                                                  final SurfaceCoordinates coordinates,
                                                  final double elevation) {
        final var primaryState = primaryBody.getState();
        final var axis = primaryBody.getConfiguration().axisOfRotation();
        final var meridian = primeMeridian(axis);
        final var east = Vector3D.crossProduct(axis, meridian);

        final var cosLatitude = FastMath.cos(coordinates.latitude());
        final var bodyFixed = new Vector3D(
                elevation * cosLatitude * FastMath.cos(coordinates.longitude()), meridian,
                elevation * cosLatitude * FastMath.sin(coordinates.longitude()), east,
                elevation * FastMath.sin(coordinates.latitude()), axis);
        return primaryState.position().add(
                new Rotation(axis, primaryState.rotation(), RotationConvention.VECTOR_OPERATOR).applyTo(bodyFixed));
    }

    /**
     * State of an object resting on the surface of {@code primaryBody}, co-rotating with it.
     */
    public static ObjectState surfaceState(final Body primaryBody, final SurfaceCoordinates coordinates) {
        final var primaryState = primaryBody.getState();
        final var config = primaryBody.getConfiguration();
        final var position = fromSurfaceCoordinates(primaryBody, coordinates, primaryBody.getRadius());
        final var surfaceVelocity = Vector3D.crossProduct(config.axisOfRotation(), position.subtract(primaryState.position()))
                .scalarMultiply(config.rotationalSpeed());
        return new ObjectState(
                primaryState.time(),
                position,
                primaryState.velocity().add(surfaceVelocity),
                0.0,
                true);
    }

    /**
     * Whether an object on {@code orbit} can reach the orbit of the next sphere of influence.
     */
    public static boolean soiChangeLikely(final Orbit orbit, final Orbit nextSoiOrbit) {
        return orbit.apoapsis() >= nextSoiOrbit.periapsis();
    }

    private static Vector3D primeMeridian(final Vector3D axis) {
        var meridian = Vector3D.PLUS_I.subtract(Vector3D.dotProduct(Vector3D.PLUS_I, axis), axis);
        if (meridian.getNorm() < 1e-12) {
            meridian = Vector3D.PLUS_J.subtract(Vector3D.dotProduct(Vector3D.PLUS_J, axis), axis);
        }
        return meridian.normalize();
    }

    /**
     * Body-fixed spherical coordinates, radians.
     */
    public record SurfaceCoordinates(double latitude, double longitude) {
    }
}
