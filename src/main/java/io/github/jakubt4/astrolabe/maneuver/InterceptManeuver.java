package io.github.jakubt4.astrolabe.maneuver;

import io.github.jakubt4.astrolabe.error.AstrodynamicsException;
import io.github.jakubt4.astrolabe.error.GeometricInfeasibilityException;
import io.github.jakubt4.astrolabe.orbit.Orbit;
import io.github.jakubt4.astrolabe.orbit.OrbitPosition;
import io.github.jakubt4.astrolabe.physics.Body;
import io.github.jakubt4.astrolabe.physics.ObjectState;
import io.github.jakubt4.astrolabe.solver.SolverHelpers;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Two-burn intercept found by a grid search over launch time and transfer duration.
 *
 * <p>Every cell of the grid is a Lambert problem between the object at launch and the target at
 * arrival, solved for both the short and the long way. The cell with the smallest departure
 * burn wins. Launch rows run as separate tasks on {@link ManeuverContext#searchExecutor()}; with
 * an allowed Δv set, the first cell at or below it stops every row, so which cheap-enough cell
 * is returned then depends on scheduling.
 */
@Slf4j
public final class InterceptManeuver {

    private InterceptManeuver() {
    }

    /**
     * Plans an intercept of {@code target} by {@code body} from their current states.
     *
     * @return a departure burn and a burn matching the target's velocity on arrival, or empty
     *         if no cell of the grid is feasible
     * @throws GeometricInfeasibilityException if the two bodies orbit different primaries
     */
    public static Optional<OrbitalManeuvers> intercept(final ManeuverContext context,
                                                       final Body body,
                                                       final Body target,
                                                       final InterceptSearchSpace searchSpace) {
        return search(context, body, target, searchSpace, ManeuverObserver.NONE)
                .map(result -> toManeuvers(context.currentTime(), result.best()));
    }

    public static Optional<InterceptResult> search(final ManeuverContext context,
                                                   final Body body,
                                                   final Body target,
                                                   final InterceptSearchSpace searchSpace,
                                                   final ManeuverObserver observer) {
        if (body.isObjectOfReference() || target.isObjectOfReference()) {
            throw new GeometricInfeasibilityException("The object of reference cannot take part in an intercept");
        }
        final var primaryBody = body.getPrimaryBody();
        return search(
                context,
                primaryBody.getState(),
                body.getState(),
                Orbit.of(body),
                target.getState(),
                Orbit.of(target),
                searchSpace,
                observer);
    }

    /**
     * Searches the grid for explicit states, which need not belong to live bodies.
     *
     * @param context          solvers and executor; launch times are relative to the states
     * @param primaryBodyState state of the shared primary at the instant of both states
     * @param state            absolute state of the intercepting object
     * @param orbit            orbit of the intercepting object
     * @param targetState      absolute state of the target
     * @param targetOrbit      orbit of the target
     * @param searchSpace      grid to examine
     * @param observer         notified of every feasible cell, from the worker threads
     */
    public static Optional<InterceptResult> search(final ManeuverContext context,
                                                   final ObjectState primaryBodyState,
                                                   final ObjectState state,
                                                   final Orbit orbit,
                                                   final ObjectState targetState,
                                                   final Orbit targetOrbit,
                                                   final InterceptSearchSpace searchSpace,
                                                   final ManeuverObserver observer) {
        if (orbit.primaryBody() != targetOrbit.primaryBody()) {
            throw new GeometricInfeasibilityException("Intercept requires a common primary body: "
                    + orbit.primaryBody() + " and " + targetOrbit.primaryBody());
        }

        final var search = new GridSearch(
                context, primaryBodyState, state, orbit, targetState, targetOrbit, searchSpace, observer);
        final var outcome = search.run();
        if (outcome.best() == null) {
            log.info("Intercept search around [{}] found no feasible cell in {}x{} grid",
                    orbit.primaryBody(), searchSpace.launchSteps(), searchSpace.durationSteps());
            return Optional.empty();
        }

        final var best = outcome.best();
        log.info("Intercept search around [{}]: {} feasible cells, best launch at {} s, duration {} s, Δv {} m/s",
                orbit.primaryBody(), outcome.feasibleCells(), best.launchTime(), best.duration(), best.deltaV());
        return Optional.of(new InterceptResult(best, outcome.launches()));
    }

    /**
     * Checks that an object launched from the surface of {@code primaryBody} does not fall back
     * into it within {@code maxImpactCheckTime}.
     *
     * @param launchState absolute state right after the departure burn
     */
    public static boolean isValidLaunch(final ManeuverContext context,
                                        final Body primaryBody,
                                        final ObjectState primaryBodyState,
                                        final ObjectState launchState,
                                        final double impactCheckDeltaTime,
                                        final double maxImpactCheckTime) {
        final var flightState = launchState.withImpacted(false);
        final var orbit = OrbitPosition.fromState(primaryBody, primaryBodyState, flightState).orbit();
        for (var t = impactCheckDeltaTime; t <= maxImpactCheckTime; t += impactCheckDeltaTime) {
            final var next = context.keplerSolver().solve(primaryBodyState, flightState, orbit, t);
            if (primaryBody.intersects(primaryBodyState.position(), next.position())) {
                return false;
            }
        }
        return true;
    }

    static OrbitalManeuvers toManeuvers(final double epoch, final PossibleLaunch launch) {
        return OrbitalManeuvers.sequence(
                new OrbitalManeuver(epoch + launch.launchTime(), launch.deltaVelocity()),
                new OrbitalManeuver(epoch + launch.arrivalTime(), launch.arrivalDeltaVelocity()));
    }

    /**
     * Feasible cells of one or more launch rows; {@code launches} stays empty unless the search
     * space asks for the full list.
     */
    private record SearchOutcome(PossibleLaunch best, int feasibleCells, List<PossibleLaunch> launches) {

        static SearchOutcome empty() {
            return new SearchOutcome(null, 0, new ArrayList<>());
        }

        SearchOutcome with(final PossibleLaunch launch, final boolean listed) {
            if (listed) {
                launches.add(launch);
            }
            final var better = best == null || PossibleLaunch.BEST_FIRST.compare(launch, best) < 0;
            return new SearchOutcome(better ? launch : best, feasibleCells + 1, launches);
        }

        SearchOutcome merge(final SearchOutcome other) {
            launches.addAll(other.launches);
            final var better = other.best != null
                    && (best == null || PossibleLaunch.BEST_FIRST.compare(other.best, best) < 0);
            return new SearchOutcome(better ? other.best : best, feasibleCells + other.feasibleCells, launches);
        }
    }

    private static final class GridSearch {

        private final ManeuverContext context;
        private final Body primaryBody;
        private final ObjectState primaryBodyState;
        private final ObjectState state;
        private final Orbit orbit;
        private final ObjectState targetState;
        private final Orbit targetOrbit;
        private final InterceptSearchSpace space;
        private final ManeuverObserver observer;
        private final AtomicBoolean done = new AtomicBoolean();

        GridSearch(final ManeuverContext context,
                   final ObjectState primaryBodyState,
                   final ObjectState state,
                   final Orbit orbit,
                   final ObjectState targetState,
                   final Orbit targetOrbit,
                   final InterceptSearchSpace space,
                   final ManeuverObserver observer) {
            this.context = context;
            this.primaryBody = orbit.primaryBody();
            this.primaryBodyState = primaryBodyState;
            this.state = state;
            this.orbit = orbit;
            this.targetState = targetState;
            this.targetOrbit = targetOrbit;
            this.space = space;
            this.observer = observer == null ? ManeuverObserver.NONE : observer;
        }

        SearchOutcome run() {
            final var rows = new ArrayList<Callable<SearchOutcome>>();
            for (var i = 0; i < space.launchSteps(); i++) {
                final var launchTime = space.launchTime(i);
                rows.add(() -> searchRow(launchTime));
            }

            var outcome = SearchOutcome.empty();
            final var executor = context.searchExecutor();
            if (executor == null) {
                for (final var row : rows) {
                    outcome = outcome.merge(callInline(row));
                }
                return outcome;
            }

            try {
                for (final Future<SearchOutcome> future : executor.invokeAll(rows)) {
                    outcome = outcome.merge(future.get());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Intercept search interrupted", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                }
                throw new IllegalStateException("Intercept search failed", e.getCause());
            }
            return outcome;
        }

        private SearchOutcome searchRow(final double launchTime) {
            var row = SearchOutcome.empty();
            if (done.get()) {
                return row;
            }

            final var solver = context.keplerSolver();
            final var primaryAtLaunch = primaryStateAfter(launchTime);
            final var objectAtLaunch = solver.solve(primaryBodyState, state, orbit, primaryAtLaunch, launchTime);

            for (var j = 0; j < space.durationSteps() && !done.get(); j++) {
                final var duration = space.duration(j);
                if (duration <= 0.0) {
                    continue;
                }
                final var cell = evaluate(primaryAtLaunch, objectAtLaunch, launchTime, duration);
                if (cell.isEmpty()) {
                    continue;
                }
                final var launch = cell.get();
                row = row.with(launch, space.listPossibleLaunches());
                observer.onPossibleLaunch(launch);
                if (space.allowedDeltaV() != null && launch.deltaV() <= space.allowedDeltaV()) {
                    done.set(true);
                }
            }
            return row;
        }

        private Optional<PossibleLaunch> evaluate(final ObjectState primaryAtLaunch,
                                                  final ObjectState objectAtLaunch,
                                                  final double launchTime,
                                                  final double duration) {
            final ObjectState primaryAtArrival;
            final ObjectState targetAtArrival;
            try {
                primaryAtArrival = primaryStateAfter(launchTime + duration);
                targetAtArrival = context.keplerSolver().solve(
                        primaryBodyState, targetState, targetOrbit, primaryAtArrival, launchTime + duration);
            } catch (AstrodynamicsException e) {
                log.debug("Target propagation failed at launch {} s, duration {} s: {}", launchTime, duration, e.getMessage());
                return Optional.empty();
            }

            final var shortWay = transfer(primaryAtLaunch, primaryAtArrival, objectAtLaunch, targetAtArrival,
                    launchTime, duration, true);
            final var longWay = transfer(primaryAtLaunch, primaryAtArrival, objectAtLaunch, targetAtArrival,
                    launchTime, duration, false);
            if (shortWay.isPresent() && longWay.isPresent()) {
                return shortWay.get().deltaV() <= longWay.get().deltaV() ? shortWay : longWay;
            }
            return shortWay.isPresent() ? shortWay : longWay;
        }

        private Optional<PossibleLaunch> transfer(final ObjectState primaryAtLaunch,
                                                  final ObjectState primaryAtArrival,
                                                  final ObjectState objectAtLaunch,
                                                  final ObjectState targetAtArrival,
                                                  final double launchTime,
                                                  final double duration,
                                                  final boolean shortWay) {
            try {
                final var result = context.gaussSolver().solve(
                        primaryBody,
                        primaryAtLaunch,
                        primaryAtArrival,
                        objectAtLaunch.position(),
                        targetAtArrival.position(),
                        duration,
                        shortWay);
                final var deltaVelocity = result.velocity1().subtract(objectAtLaunch.velocity());
                final var arrivalDeltaVelocity = targetAtArrival.velocity().subtract(result.velocity2());
                if (!isFinite(deltaVelocity) || !isFinite(arrivalDeltaVelocity)) {
                    return Optional.empty();
                }
                if (objectAtLaunch.impacted() && !isValidLaunch(
                        context,
                        primaryBody,
                        primaryAtLaunch,
                        objectAtLaunch.withVelocity(result.velocity1()),
                        space.impactCheckDeltaTime(),
                        space.maxImpactCheckTime())) {
                    return Optional.empty();
                }
                return Optional.of(new PossibleLaunch(launchTime, duration, deltaVelocity, arrivalDeltaVelocity));
            } catch (AstrodynamicsException e) {
                log.debug("No {} transfer at launch {} s, duration {} s: {}",
                        shortWay ? "short way" : "long way", launchTime, duration, e.getMessage());
                return Optional.empty();
            }
        }

        private ObjectState primaryStateAfter(final double time) {
            if (primaryBody.isObjectOfReference()) {
                return primaryBodyState.withTime(primaryBodyState.time() + time);
            }
            return SolverHelpers.afterTime(
                    context.keplerSolver(), primaryBody, primaryBodyState, Orbit.of(primaryBody), time).state();
        }

        private static SearchOutcome callInline(final Callable<SearchOutcome> row) {
            try {
                return row.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException("Intercept search failed", e);
            }
        }

        private static boolean isFinite(final Vector3D vector) {
            return !vector.isNaN() && !vector.isInfinite();
        }
    }
}
