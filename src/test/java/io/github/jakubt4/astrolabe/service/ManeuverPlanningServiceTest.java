package io.github.jakubt4.astrolabe.service;

import io.github.jakubt4.astrolabe.Scenarios;
import io.github.jakubt4.astrolabe.config.AstrodynamicsProperties;
import io.github.jakubt4.astrolabe.config.AstrodynamicsProperties.Search;
import io.github.jakubt4.astrolabe.config.AstrodynamicsProperties.Solver;
import io.github.jakubt4.astrolabe.error.NoFeasibleSolutionException;
import io.github.jakubt4.astrolabe.orbit.Orbit;
import io.github.jakubt4.astrolabe.orbit.OrbitType;
import io.github.jakubt4.astrolabe.solver.UniversalVariableGaussSolver;
import io.github.jakubt4.astrolabe.solver.UniversalVariableKeplerSolver;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ManeuverPlanningServiceTest {

    private static final double MU = Scenarios.EARTH_MU;

    private ExecutorService executor;
    private ManeuverPlanningService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        final var properties = new AstrodynamicsProperties(
                new Solver(1000, 1e-6), new Solver(1000, 1e-6), new Search(2, 50.0, 500.0));
        service = new ManeuverPlanningService(
                new UniversalVariableKeplerSolver(), new UniversalVariableGaussSolver(), executor, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void elementsOfCircularState() {
        final var speed = FastMath.sqrt(MU / 7.0e6);

        final var position = service.elements(MU, new Vector3D(7.0e6, 0.0, 0.0), new Vector3D(0.0, speed, 0.0));

        assertThat(position.orbit().type()).isEqualTo(OrbitType.CIRCULAR);
        assertThat(position.orbit().semiMajorAxis()).isCloseTo(7.0e6, within(1.0));
        assertThat(position.orbit().inclination()).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void propagateFullPeriodReturnsToStart() {
        final var speed = FastMath.sqrt(MU / 7.0e6) * 1.1;
        final var position = new Vector3D(7.0e6, 0.0, 0.0);
        final var velocity = new Vector3D(0.0, speed, 100.0);
        final var period = service.elements(MU, position, velocity).orbit().period();

        final var state = service.propagate(MU, position, velocity, period);

        assertThat(state.time()).isCloseTo(period, within(1e-6));
        assertThat(Vector3D.distance(state.position(), position)).isLessThan(1e-2);
        assertThat(Vector3D.distance(state.velocity(), velocity)).isLessThan(1e-5);
    }

    @Test
    void searchSpaceUsesConfiguredImpactCheck() {
        final var space = service.searchSpace(0.0, 100.0, 10.0, 200.0, 10.0);

        assertThat(space.impactCheckDeltaTime()).isEqualTo(50.0);
        assertThat(space.maxImpactCheckTime()).isEqualTo(500.0);
    }

    @Test
    void interceptWithoutFeasibleCellThrows() {
        final var earth = Scenarios.earth();
        final var craft = Scenarios.craft("Shuttle", Orbit.circular(earth, 7.0e6), 0.0);
        final var target = Scenarios.craft("Station", Orbit.circular(earth, 7.5e6), 0.5);
        final var degenerate = service.searchSpace(0.0, 0.0, 0.0, 0.0, 100.0);

        assertThatThrownBy(() -> service.intercept(0.0, craft, target, degenerate))
                .isInstanceOf(NoFeasibleSolutionException.class)
                .hasMessageContaining("Station");
    }

    @Test
    void interceptFindsTransfer() {
        final var earth = Scenarios.earth();
        final var craft = Scenarios.craft("Shuttle", Orbit.circular(earth, 7.0e6), 0.0);
        final var target = Scenarios.craft("Station", Orbit.circular(earth, 7.5e6), 0.5);

        final var maneuvers = service.intercept(0.0, craft, target, service.searchSpace(0.0, 3000.0, 1000.0, 4000.0, 300.0));

        assertThat(maneuvers.size()).isEqualTo(2);
        assertThat(maneuvers.totalDeltaV()).isPositive();
    }

    @Test
    void hohmannDelegatesToClosedForm() {
        final var transfer = service.hohmann(MU, 7.0e6, 4.2164e7);

        assertThat(transfer.firstBurn()).isPositive();
        assertThat(transfer.secondBurn()).isPositive();
        assertThat(transfer.coastTime()).isPositive();
    }
}
