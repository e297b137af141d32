package io.github.jakubt4.astrolabe.maneuver;

/**
 * Receives progress from planners, e.g. to visualise a search while it runs.
 *
 * <p>Grid searches call the observer from their worker threads; implementations must be
 * thread-safe.
 */
@FunctionalInterface
public interface ManeuverObserver {

    ManeuverObserver NONE = launch -> {
    };

    /**
     * Called for every feasible search cell.
     */
    void onPossibleLaunch(PossibleLaunch launch);
}
