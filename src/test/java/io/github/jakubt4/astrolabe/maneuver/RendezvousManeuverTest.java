package io.github.jakubt4.astrolabe.maneuver;

import io.github.jakubt4.astrolabe.Scenarios;
import io.github.jakubt4.astrolabe.error.GeometricInfeasibilityException;
import io.github.jakubt4.astrolabe.orbit.Orbit;
import io.github.jakubt4.astrolabe.orbit.OrbitPosition;
import io.github.jakubt4.astrolabe.physics.Body;
import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RendezvousManeuverTest {

    private ManeuverContext context;
    private Body earth;

    @BeforeEach
    void setUp() {
        context = Scenarios.context(0.0);
        earth = Scenarios.earth();
    }

    @Test
    void phasingCatchesTargetAheadOnSameOrbit() {
        final var orbit = Orbit.circular(earth, 7.0e6);
        final var craft = Scenarios.craft("Shuttle", orbit, 0.0);
        final var target = Scenarios.craft("Station", orbit, 0.2);

        final var maneuvers = RendezvousManeuver.rendezvous(context, craft, target);

        assertThat(maneuvers.size()).isEqualTo(2);
        assertMeetsTarget(craft, target, maneuvers, 100.0);
        // the target is ahead: the phasing orbit is shorter, so the first burn is retrograde
        final var atBurn = ManeuverSimulation.coast(context.keplerSolver(), earth, craft.getState(), maneuvers.get(0).maneuverTime());
        assertThat(maneuvers.get(0).deltaVelocity().dotProduct(atBurn.velocity())).isNegative();
    }

    @Test
    void phasingBurnsFollowOrbitAroundMovingPrimary() {
        final var sun = Scenarios.sun();
        final var planet = Scenarios.planet("Earth", Scenarios.EARTH_MU, Scenarios.EARTH_RADIUS,
                sun, Scenarios.EARTH_ORBIT, FastMath.PI / 2.0);
        final var orbit = Orbit.circular(planet, 7.0e6);
        final var craft = Scenarios.craft("Shuttle", orbit, 0.0);
        final var target = Scenarios.craft("Station", orbit, 0.2);

        final var maneuvers = RendezvousManeuver.rendezvous(context, craft, target);

        final var solver = context.keplerSolver();
        final var first = maneuvers.get(0);
        final var relativeAtBurn = ManeuverSimulation.coast(solver, planet, craft.getState(), first.maneuverTime())
                .makeRelative(planet.getState());
        final var cosine = first.deltaVelocity().dotProduct(relativeAtBurn.velocity())
                / (first.deltaV() * relativeAtBurn.velocity().getNorm());
        assertThat(cosine).isCloseTo(-1.0, within(1e-9));

        final var meeting = maneuvers.get(1).maneuverTime();
        final var craftAtMeeting = ManeuverSimulation.fly(solver, planet, craft.getState(), OrbitalManeuvers.single(first), meeting);
        final var targetAtMeeting = ManeuverSimulation.coast(solver, planet, target.getState(), meeting);
        assertThat(craftAtMeeting.distance(targetAtMeeting)).isLessThan(100.0);
    }

    @Test
    void phasingOnEllipseWithSeveralRevolutions() {
        final var orbit = Orbit.fromSemiMajorAxis(earth, 9.0e6, 0.2, 0.4, 1.0, 0.5);
        final var craft = Scenarios.craft("Shuttle", orbit, 1.0);
        final var target = Scenarios.craft("Station", orbit, 0.7);

        final var maneuvers = RendezvousManeuver.inSameOrbit(
                context, craft, OrbitPosition.of(craft), OrbitPosition.of(target), 3);

        assertMeetsTarget(craft, target, maneuvers, 100.0);
        final var end = ManeuverSimulation.fly(context.keplerSolver(), earth, craft.getState(), maneuvers,
                maneuvers.get(1).maneuverTime() + 60.0);
        final var finalOrbit = ManeuverSimulation.orbitAt(earth, end).orbit();
        assertThat(finalOrbit.sameOrbit(orbit, 1e-6)).isTrue();
    }

    @Test
    void phasingNeedsAtLeastOneRevolution() {
        final var orbit = Orbit.circular(earth, 7.0e6);
        final var craft = Scenarios.craft("Shuttle", orbit, 0.0);
        final var target = Scenarios.craft("Station", orbit, 0.2);

        assertThatThrownBy(() -> RendezvousManeuver.inSameOrbit(
                context, craft, OrbitPosition.of(craft), OrbitPosition.of(target), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void phasingBelowTheSurfaceIsInfeasible() {
        final var orbit = Orbit.circular(earth, 6.6e6);
        final var craft = Scenarios.craft("Shuttle", orbit, 0.0);
        final var target = Scenarios.craft("Station", orbit, 2.0);

        assertThatThrownBy(() -> RendezvousManeuver.rendezvous(context, craft, target))
                .isInstanceOf(GeometricInfeasibilityException.class)
                .hasMessageContaining("intersects");
    }

    @Test
    void coplanarCircularOrbitsUseHohmannTransfer() {
        final var craft = Scenarios.craft("Shuttle", Orbit.circular(earth, 7.0e6), 0.0);
        final var target = Scenarios.craft("Station", Orbit.circular(earth, 8.0e6), 1.0);

        final var maneuvers = RendezvousManeuver.rendezvous(context, craft, target);

        assertThat(maneuvers.size()).isEqualTo(2);
        assertThat(maneuvers.get(1).maneuverTime() - maneuvers.get(0).maneuverTime())
                .isCloseTo(HohmannTransferOrbit.calculateBurn(Scenarios.EARTH_MU, 7.0e6, 8.0e6).coastTime(), within(1e-3));
        assertMeetsTarget(craft, target, maneuvers, 1000.0);
    }

    @Test
    void differentOrbitShapesAreUnsupported() {
        final var craft = Scenarios.craft("Shuttle", new Orbit(earth, 8.0e6, 0.2, 0.0, 0.0, 0.0), 0.0);
        final var target = Scenarios.craft("Station", Orbit.circular(earth, 8.0e6), 1.0);

        assertThatThrownBy(() -> RendezvousManeuver.rendezvous(context, craft, target))
                .isInstanceOf(GeometricInfeasibilityException.class)
                .hasMessageContaining("unsupported configuration");
    }

    @Test
    void circularOrbitsMustBeCoplanar() {
        final var craft = Scenarios.craft("Shuttle", Orbit.circular(earth, 7.0e6), 0.0);
        final var target = Scenarios.craft("Station", new Orbit(earth, 8.0e6, 0.0, 0.5, 0.0, 0.0), 1.0);

        assertThatThrownBy(() -> RendezvousManeuver.rendezvous(context, craft, target))
                .isInstanceOf(GeometricInfeasibilityException.class)
                .hasMessageContaining("same plane");
    }

    @Test
    void targetAroundAnotherPrimaryIsRejected() {
        final var craft = Scenarios.craft("Shuttle", Orbit.circular(earth, 7.0e6), 0.0);
        final var comet = Scenarios.craft("Comet", Orbit.circular(Scenarios.sun(), Scenarios.EARTH_ORBIT), 0.0);

        assertThatThrownBy(() -> RendezvousManeuver.rendezvous(context, craft, comet))
                .isInstanceOf(GeometricInfeasibilityException.class)
                .hasMessageContaining("different primary bodies");
    }

    private void assertMeetsTarget(final Body craft, final Body target, final OrbitalManeuvers maneuvers, final double tolerance) {
        final var solver = context.keplerSolver();
        final var meeting = maneuvers.get(1).maneuverTime();
        final var craftAtMeeting = ManeuverSimulation.fly(solver, earth, craft.getState(),
                OrbitalManeuvers.single(maneuvers.get(0)), meeting);
        final var targetAtMeeting = ManeuverSimulation.coast(solver, earth, target.getState(), meeting);

        assertThat(craftAtMeeting.distance(targetAtMeeting)).isLessThan(tolerance);
    }
}
