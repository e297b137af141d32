package io.github.jakubt4.astrolabe.maneuver;

import java.util.List;

/**
 * Outcome of an intercept search that found at least one feasible cell.
 *
 * @param best              cell with the lowest departure Δv
 * @param possibleLaunches  every feasible cell in (launch, duration) order, when requested
 */
public record InterceptResult(PossibleLaunch best, List<PossibleLaunch> possibleLaunches) {

    public InterceptResult {
        possibleLaunches = List.copyOf(possibleLaunches);
    }
}
