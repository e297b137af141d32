package io.github.jakubt4.astrolabe.maneuver;

import io.github.jakubt4.astrolabe.solver.GaussProblemSolver;
import io.github.jakubt4.astrolabe.solver.KeplerProblemSolver;

import java.util.concurrent.ExecutorService;

/**
 * Everything a planner needs from its caller: the current simulation time and the solvers.
 *
 * @param currentTime    current simulation time in seconds; maneuver times are absolute to it
 * @param keplerSolver   propagation solver
 * @param gaussSolver    Lambert solver
 * @param searchExecutor executor for grid searches, or {@code null} to search on the calling thread
 */
public record ManeuverContext(double currentTime,
                              KeplerProblemSolver keplerSolver,
                              GaussProblemSolver gaussSolver,
                              ExecutorService searchExecutor) {

    public ManeuverContext {
        if (keplerSolver == null || gaussSolver == null) {
            throw new IllegalArgumentException("Both solvers are required");
        }
    }

    public ManeuverContext(final double currentTime,
                           final KeplerProblemSolver keplerSolver,
                           final GaussProblemSolver gaussSolver) {
        this(currentTime, keplerSolver, gaussSolver, null);
    }

    public ManeuverContext atTime(final double time) {
        return new ManeuverContext(time, keplerSolver, gaussSolver, searchExecutor);
    }
}
