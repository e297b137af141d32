package io.github.jakubt4.astrolabe.maneuver;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.util.Comparator;

/**
 * A feasible cell of an intercept search.
 *
 * @param launchTime            seconds from the search epoch to the departure burn
 * @param duration              transfer time in seconds
 * @param deltaVelocity         departure burn
 * @param arrivalDeltaVelocity  burn matching the target's velocity on arrival
 */
public record PossibleLaunch(double launchTime,
                             double duration,
                             Vector3D deltaVelocity,
                             Vector3D arrivalDeltaVelocity) {

    /**
     * Lowest departure Δv first, then earliest launch, then shortest transfer.
     */
    public static final Comparator<PossibleLaunch> BEST_FIRST = Comparator
            .comparingDouble(PossibleLaunch::deltaV)
            .thenComparingDouble(PossibleLaunch::launchTime)
            .thenComparingDouble(PossibleLaunch::duration);

    public double arrivalTime() {
        return launchTime + duration;
    }

    public double deltaV() {
        return deltaVelocity.getNorm();
    }
}
