package io.github.jakubt4.astrolabe.orbit;

import io.github.jakubt4.astrolabe.Scenarios;
import io.github.jakubt4.astrolabe.physics.Body;
import io.github.jakubt4.astrolabe.physics.ObjectConfig;
import io.github.jakubt4.astrolabe.physics.ObjectState;
import io.github.jakubt4.astrolabe.physics.PhysicsConstants;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OrbitHelpersTest {

    @Test
    void angleAboutIsCounterclockwise() {
        assertThat(OrbitHelpers.angleAbout(Vector3D.PLUS_K, Vector3D.PLUS_I, Vector3D.PLUS_J))
                .isCloseTo(FastMath.PI / 2.0, within(1e-12));
        assertThat(OrbitHelpers.angleAbout(Vector3D.PLUS_K, Vector3D.PLUS_J, Vector3D.PLUS_I))
                .isCloseTo(3.0 * FastMath.PI / 2.0, within(1e-12));
        assertThat(OrbitHelpers.angleAbout(Vector3D.MINUS_K, Vector3D.PLUS_I, Vector3D.PLUS_J))
                .isCloseTo(3.0 * FastMath.PI / 2.0, within(1e-12));
    }

    @Test
    void angleAboutIgnoresAxialComponents() {
        final var from = new Vector3D(1.0, 0.0, 5.0);
        final var to = new Vector3D(-1.0, 0.0, -3.0);

        assertThat(OrbitHelpers.angleAbout(Vector3D.PLUS_K, from, to)).isCloseTo(FastMath.PI, within(1e-12));
    }

    @Test
    void angleToProgradeIsMeasuredFromPrimaryMotion() {
        final var primaryPosition = new Vector3D(1.0e11, 0.0, 0.0);
        final var primaryVelocity = new Vector3D(0.0, 3.0e4, 0.0);
        final var objectPosition = primaryPosition.add(new Vector3D(-7.0e6, 0.0, 0.0));

        assertThat(OrbitHelpers.angleToPrograde(primaryPosition, primaryVelocity, objectPosition))
                .isCloseTo(FastMath.PI / 2.0, within(1e-12));
    }

    @Test
    void surfaceCoordinatesFollowBodyRotation() {
        final var earth = rotatingEarth(1.0);
        final var coordinates = new OrbitHelpers.SurfaceCoordinates(0.3, -1.2);

        final var position = OrbitHelpers.fromSurfaceCoordinates(earth, coordinates, Scenarios.EARTH_RADIUS);
        final var recovered = OrbitHelpers.surfaceCoordinates(earth, position);

        assertThat(position.getNorm()).isCloseTo(Scenarios.EARTH_RADIUS, within(1e-6));
        assertThat(FastMath.asin(position.getZ() / position.getNorm())).isCloseTo(0.3, within(1e-12));
        assertThat(FastMath.atan2(position.getY(), position.getX())).isCloseTo(-0.2, within(1e-12));
        assertThat(recovered.latitude()).isCloseTo(0.3, within(1e-12));
        assertThat(recovered.longitude()).isCloseTo(-1.2, within(1e-12));
    }

    @Test
    void surfaceStateCoRotatesWithBody() {
        final var earth = rotatingEarth(0.0);
        final var latitude = 0.5;

        final var state = OrbitHelpers.surfaceState(earth, new OrbitHelpers.SurfaceCoordinates(latitude, 0.0));

        final var expectedSpeed = earth.getConfiguration().rotationalSpeed() * Scenarios.EARTH_RADIUS * FastMath.cos(latitude);
        assertThat(state.impacted()).isTrue();
        assertThat(state.velocity().getNorm()).isCloseTo(expectedSpeed, within(1e-9));
        assertThat(state.velocity().getY()).isPositive();
    }

    @Test
    void soiChangeLikelyWhenApoapsisReachesNextOrbit() {
        final var earth = Scenarios.earth();
        final var moonOrbit = new Orbit(earth, 1.5e7, 0.0, 0.0, 0.0, 0.0);

        assertThat(OrbitHelpers.soiChangeLikely(new Orbit(earth, 1.5e7, 0.5, 0.0, 0.0, 0.0), moonOrbit)).isTrue();
        assertThat(OrbitHelpers.soiChangeLikely(Orbit.circular(earth, 7.0e6), moonOrbit)).isFalse();
    }

    private static Body rotatingEarth(final double rotation) {
        final var earth = Body.reference(
                "Earth",
                ObjectConfig.ofGravitationalParameter(Scenarios.EARTH_MU, PhysicsConstants.SIDEREAL_DAY),
                Scenarios.EARTH_RADIUS);
        earth.updateState(ObjectState.origin(0.0).withRotation(rotation));
        return earth;
    }
}
