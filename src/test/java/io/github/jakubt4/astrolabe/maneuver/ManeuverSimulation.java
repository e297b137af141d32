package io.github.jakubt4.astrolabe.maneuver;

import io.github.jakubt4.astrolabe.orbit.OrbitPosition;
import io.github.jakubt4.astrolabe.physics.Body;
import io.github.jakubt4.astrolabe.physics.ObjectState;
import io.github.jakubt4.astrolabe.solver.KeplerProblemSolver;

/**
 * Flies planned burns around a fixed primary body with a Kepler solver.
 */
final class ManeuverSimulation {

    private ManeuverSimulation() {
    }

    /**
     * Applies every burn of {@code maneuvers} in order, then coasts until {@code endTime}.
     */
    static ObjectState fly(final KeplerProblemSolver solver,
                           final Body primaryBody,
                           final ObjectState start,
                           final OrbitalManeuvers maneuvers,
                           final double endTime) {
        var state = start;
        for (final var maneuver : maneuvers) {
            state = coast(solver, primaryBody, state, maneuver.maneuverTime()).addVelocity(maneuver.deltaVelocity());
        }
        return coast(solver, primaryBody, state, endTime);
    }

    static ObjectState coast(final KeplerProblemSolver solver,
                             final Body primaryBody,
                             final ObjectState state,
                             final double untilTime) {
        final var primaryState = primaryBody.getState();
        final var orbit = OrbitPosition.fromState(primaryBody, primaryState, state).orbit();
        return solver.solve(primaryState, state, orbit, untilTime - state.time());
    }

    static OrbitPosition orbitAt(final Body primaryBody, final ObjectState state) {
        return OrbitPosition.fromState(primaryBody, primaryBody.getState(), state);
    }
}
