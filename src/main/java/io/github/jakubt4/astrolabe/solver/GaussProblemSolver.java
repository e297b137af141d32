package io.github.jakubt4.astrolabe.solver;

import io.github.jakubt4.astrolabe.physics.Body;
import io.github.jakubt4.astrolabe.physics.ObjectState;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Solves Lambert's (Gauss') problem: the two-body arc joining two positions in a given time.
 */
public interface GaussProblemSolver {

    /**
     * @param primaryBody       attracting body
     * @param primaryBodyState1 state of the primary body at departure
     * @param primaryBodyState2 state of the primary body at arrival
     * @param position1         absolute departure position
     * @param position2         absolute arrival position
     * @param time              time of flight in seconds, strictly positive
     * @param shortWay          {@code true} for a transfer angle below pi, {@code false} for the
     *                          complementary arc
     * @return absolute velocities at departure and arrival
     * @throws io.github.jakubt4.astrolabe.error.NumericNonConvergenceException if no transfer is found
     */
    GaussProblemResult solve(Body primaryBody,
                             ObjectState primaryBodyState1,
                             ObjectState primaryBodyState2,
                             Vector3D position1,
                             Vector3D position2,
                             double time,
                             boolean shortWay);
}
