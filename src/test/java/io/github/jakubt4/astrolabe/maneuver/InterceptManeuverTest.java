package io.github.jakubt4.astrolabe.maneuver;

import io.github.jakubt4.astrolabe.Scenarios;
import io.github.jakubt4.astrolabe.error.GeometricInfeasibilityException;
import io.github.jakubt4.astrolabe.orbit.Orbit;
import io.github.jakubt4.astrolabe.physics.Body;
import io.github.jakubt4.astrolabe.physics.ObjectState;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class InterceptManeuverTest {

    private static final InterceptSearchSpace SPACE = InterceptSearchSpace.of(0.0, 3000.0, 1000.0, 4000.0, 300.0);

    private ManeuverContext context;
    private ExecutorService executor;
    private Body earth;
    private Body craft;
    private Body target;

    @BeforeEach
    void setUp() {
        context = Scenarios.context(0.0);
        executor = Executors.newFixedThreadPool(4);
        earth = Scenarios.earth();
        craft = Scenarios.craft("Shuttle", Orbit.circular(earth, 7.0e6), 0.0);
        target = Scenarios.craft("Station", Orbit.circular(earth, 7.5e6), 0.5);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void interceptBringsCraftToTarget() {
        final var maneuvers = InterceptManeuver.intercept(context, craft, target, SPACE).orElseThrow();

        assertThat(maneuvers.size()).isEqualTo(2);
        final var departure = maneuvers.get(0);
        final var arrival = maneuvers.get(1);
        assertThat(arrival.maneuverTime()).isGreaterThan(departure.maneuverTime());

        final var solver = context.keplerSolver();
        final var beforeArrival = ManeuverSimulation.fly(solver, earth, craft.getState(),
                OrbitalManeuvers.single(departure), arrival.maneuverTime());
        final var targetAtArrival = ManeuverSimulation.coast(solver, earth, target.getState(), arrival.maneuverTime());
        assertThat(beforeArrival.distance(targetAtArrival)).isLessThan(1000.0);

        final var matched = beforeArrival.velocity().add(arrival.deltaVelocity());
        assertThat(Vector3D.distance(matched, targetAtArrival.velocity())).isLessThan(0.1);
    }

    @Test
    void parallelSearchFindsSameBestAsInline() {
        final var inline = InterceptManeuver.search(context, craft, target, SPACE, ManeuverObserver.NONE).orElseThrow();
        final var parallel = InterceptManeuver.search(
                new ManeuverContext(0.0, context.keplerSolver(), context.gaussSolver(), executor),
                craft, target, SPACE, ManeuverObserver.NONE).orElseThrow();

        assertThat(parallel.best()).isEqualTo(inline.best());
        assertThat(inline.possibleLaunches()).isEmpty();
    }

    @Test
    void bestIsCheapestListedLaunch() {
        final var result = InterceptManeuver.search(context, craft, target, SPACE.listingPossibleLaunches(), ManeuverObserver.NONE)
                .orElseThrow();

        assertThat(result.possibleLaunches()).isNotEmpty().contains(result.best());
        assertThat(result.possibleLaunches())
                .allSatisfy(launch -> assertThat(launch.deltaV()).isGreaterThanOrEqualTo(result.best().deltaV()));
        assertThat(result.possibleLaunches())
                .allSatisfy(launch -> {
                    assertThat(launch.launchTime()).isBetween(0.0, 3000.0);
                    assertThat(launch.duration()).isBetween(1000.0, 4000.0);
                });
    }

    @Test
    void observerSeesEveryFeasibleCell() {
        final var observer = mock(ManeuverObserver.class);

        final var result = InterceptManeuver.search(context, craft, target, SPACE.listingPossibleLaunches(), observer)
                .orElseThrow();

        verify(observer, times(result.possibleLaunches().size())).onPossibleLaunch(any(PossibleLaunch.class));
    }

    @Test
    void unlistedSearchKeepsBestWithoutCollectingCells() {
        final var observer = mock(ManeuverObserver.class);
        final var listed = InterceptManeuver.search(context, craft, target, SPACE.listingPossibleLaunches(), ManeuverObserver.NONE)
                .orElseThrow();

        final var unlisted = InterceptManeuver.search(
                new ManeuverContext(0.0, context.keplerSolver(), context.gaussSolver(), executor),
                craft, target, SPACE, observer).orElseThrow();

        assertThat(unlisted.possibleLaunches()).isEmpty();
        assertThat(unlisted.best()).isEqualTo(listed.best());
        verify(observer, times(listed.possibleLaunches().size())).onPossibleLaunch(any(PossibleLaunch.class));
    }

    @Test
    void allowedDeltaVStopsAtFirstCheapEnoughCell() {
        final var space = SPACE.listingPossibleLaunches().withAllowedDeltaV(1.0e9);

        final var result = InterceptManeuver.search(context, craft, target, space, ManeuverObserver.NONE).orElseThrow();

        assertThat(result.possibleLaunches()).hasSize(1);
        assertThat(result.best().launchTime()).isZero();
        assertThat(result.best().duration()).isEqualTo(1000.0);
    }

    @Test
    void zeroDurationGridHasNoSolution() {
        final var degenerate = InterceptSearchSpace.of(0.0, 0.0, 0.0, 0.0, 100.0);

        assertThat(InterceptManeuver.intercept(context, craft, target, degenerate)).isEmpty();
    }

    @Test
    void interceptRequiresCommonPrimary() {
        final var sun = Scenarios.sun();
        final var comet = Scenarios.craft("Comet", Orbit.circular(sun, Scenarios.EARTH_ORBIT), 0.0);

        assertThatThrownBy(() -> InterceptManeuver.intercept(context, craft, comet, SPACE))
                .isInstanceOf(GeometricInfeasibilityException.class);
        assertThatThrownBy(() -> InterceptManeuver.intercept(context, craft, earth, SPACE))
                .isInstanceOf(GeometricInfeasibilityException.class);
    }

    @Test
    void slowSurfaceLaunchFallsBack() {
        final var launch = surfaceLaunch(500.0);

        assertThat(InterceptManeuver.isValidLaunch(context, earth, earth.getState(), launch, 100.0, 1000.0)).isFalse();
    }

    @Test
    void fastSurfaceLaunchClimbsAway() {
        final var launch = surfaceLaunch(11_000.0);

        assertThat(InterceptManeuver.isValidLaunch(context, earth, earth.getState(), launch, 100.0, 1000.0)).isTrue();
    }

    @Test
    void searchSpaceValidatesItsBounds() {
        assertThatThrownBy(() -> InterceptSearchSpace.of(0.0, 100.0, 0.0, 100.0, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> InterceptSearchSpace.of(100.0, 0.0, 0.0, 100.0, 10.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(SPACE.launchSteps()).isEqualTo(11);
        assertThat(SPACE.durationSteps()).isEqualTo(11);
        assertThat(SPACE.duration(10)).isEqualTo(4000.0);
    }

    private static ObjectState surfaceLaunch(final double speed) {
        return new ObjectState(0.0, new Vector3D(Scenarios.EARTH_RADIUS, 0.0, 0.0), new Vector3D(0.0, speed, 0.0))
                .withImpacted(true);
    }
}
