package io.github.jakubt4.astrolabe.service;

import io.github.jakubt4.astrolabe.config.AstrodynamicsProperties;
import io.github.jakubt4.astrolabe.error.NoFeasibleSolutionException;
import io.github.jakubt4.astrolabe.maneuver.BasicManeuver;
import io.github.jakubt4.astrolabe.maneuver.HohmannTransferOrbit;
import io.github.jakubt4.astrolabe.maneuver.HohmannTransferOrbit.HohmannTransferData;
import io.github.jakubt4.astrolabe.maneuver.InterceptManeuver;
import io.github.jakubt4.astrolabe.maneuver.InterceptSearchSpace;
import io.github.jakubt4.astrolabe.maneuver.InterplanetaryManeuver;
import io.github.jakubt4.astrolabe.maneuver.ManeuverContext;
import io.github.jakubt4.astrolabe.maneuver.ManeuverObserver;
import io.github.jakubt4.astrolabe.maneuver.OrbitalManeuvers;
import io.github.jakubt4.astrolabe.maneuver.PlanetaryTransferOptions;
import io.github.jakubt4.astrolabe.maneuver.PlanetaryTransferPlan;
import io.github.jakubt4.astrolabe.maneuver.RendezvousManeuver;
import io.github.jakubt4.astrolabe.orbit.OrbitPosition;
import io.github.jakubt4.astrolabe.physics.Body;
import io.github.jakubt4.astrolabe.physics.ObjectConfig;
import io.github.jakubt4.astrolabe.physics.ObjectState;
import io.github.jakubt4.astrolabe.solver.GaussProblemSolver;
import io.github.jakubt4.astrolabe.solver.KeplerProblemSolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;

/**
 * Stateless facade over the astrodynamics engine.
 *
 * <p>Every call builds its own {@link ManeuverContext} from the configured solvers, so requests
 * never share mutable state. Searches that come back empty are reported as
 * {@link NoFeasibleSolutionException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManeuverPlanningService {

    private final KeplerProblemSolver keplerProblemSolver;
    private final GaussProblemSolver gaussProblemSolver;
    private final ExecutorService maneuverSearchExecutor;
    private final AstrodynamicsProperties properties;

    public ManeuverContext context(final double currentTime) {
        return new ManeuverContext(currentTime, keplerProblemSolver, gaussProblemSolver, maneuverSearchExecutor);
    }

    /**
     * Orbital elements of a state given relative to a point mass with parameter {@code mu}.
     */
    public OrbitPosition elements(final double mu, final Vector3D position, final Vector3D velocity) {
        final var primary = pointMass(mu);
        return OrbitPosition.fromState(primary, new ObjectState(0.0, position, velocity));
    }

    /**
     * Propagates a state relative to a point mass with parameter {@code mu} by {@code time} seconds.
     */
    public ObjectState propagate(final double mu, final Vector3D position, final Vector3D velocity, final double time) {
        final var primary = pointMass(mu);
        final var state = new ObjectState(0.0, position, velocity);
        final var orbit = OrbitPosition.fromState(primary, state).orbit();
        final var result = keplerProblemSolver.solve(primary.getState(), state, orbit, time);
        log.debug("Propagated {} by {} s: |r| {} -> {} m", orbit.type(), time, position.getNorm(), result.position().getNorm());
        return result;
    }

    public HohmannTransferData hohmann(final double mu, final double currentRadius, final double newRadius) {
        return HohmannTransferOrbit.calculateBurn(mu, currentRadius, newRadius);
    }

    public OrbitalManeuvers changePeriapsis(final double currentTime, final Body body, final double newPeriapsis) {
        return BasicManeuver.changePeriapsis(context(currentTime), body, newPeriapsis);
    }

    public OrbitalManeuvers changeApoapsis(final double currentTime, final Body body, final double newApoapsis) {
        return BasicManeuver.changeApoapsis(context(currentTime), body, newApoapsis);
    }

    public OrbitalManeuvers changeInclination(final double currentTime, final Body body, final double newInclination) {
        return BasicManeuver.changeInclination(context(currentTime), body, newInclination);
    }

    /**
     * Search space with the configured re-impact check for surface launches.
     */
    public InterceptSearchSpace searchSpace(final double minLaunchTime,
                                            final double maxLaunchTime,
                                            final double minDuration,
                                            final double maxDuration,
                                            final double deltaTime) {
        final var search = properties.search();
        return InterceptSearchSpace.of(minLaunchTime, maxLaunchTime, minDuration, maxDuration, deltaTime)
                .withImpactCheck(search.impactCheckDeltaTime(), search.maxImpactCheckTime());
    }

    /**
     * @throws NoFeasibleSolutionException if no cell of the search space is feasible
     */
    public OrbitalManeuvers intercept(final double currentTime,
                                      final Body body,
                                      final Body target,
                                      final InterceptSearchSpace searchSpace) {
        return InterceptManeuver.intercept(context(currentTime), body, target, searchSpace)
                .orElseThrow(() -> new NoFeasibleSolutionException(
                        "No feasible intercept of [" + target.getName() + "] by [" + body.getName() + "]"));
    }

    public OrbitalManeuvers rendezvous(final double currentTime, final Body body, final Body target) {
        return RendezvousManeuver.rendezvous(context(currentTime), body, target);
    }

    /**
     * @throws NoFeasibleSolutionException if a stage of the transfer finds no solution
     */
    public PlanetaryTransferPlan planetaryTransfer(final double currentTime,
                                                  final Body craft,
                                                  final Body target,
                                                  final PlanetaryTransferOptions options) {
        return InterplanetaryManeuver.planetaryTransfer(context(currentTime), craft, target, options, ManeuverObserver.NONE)
                .orElseThrow(() -> new NoFeasibleSolutionException(
                        "No feasible transfer of [" + craft.getName() + "] to [" + target.getName() + "]"));
    }

    private static Body pointMass(final double mu) {
        return Body.reference("primary", ObjectConfig.ofGravitationalParameter(mu, 0.0), 0.0);
    }
}
