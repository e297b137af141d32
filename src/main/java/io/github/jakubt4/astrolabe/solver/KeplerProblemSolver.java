package io.github.jakubt4.astrolabe.solver;

import io.github.jakubt4.astrolabe.orbit.Orbit;
import io.github.jakubt4.astrolabe.physics.ObjectState;

/**
 * Propagates an object along its two-body orbit.
 *
 * <p>Implementations must accept any orbit type and any time offset, negative included, and
 * must be safe to call concurrently.
 */
public interface KeplerProblemSolver {

    /**
     * Propagates {@code initialState} by {@code time} seconds.
     *
     * @param initialPrimaryBodyState state of the primary body at the initial instant
     * @param initialState            absolute state of the object at the initial instant
     * @param initialOrbit            orbit of the object; supplies the gravitational parameter
     * @param primaryBodyStateAtTime  state of the primary body after {@code time}; the result is
     *                                expressed relative to it
     * @param time                    time offset in seconds
     * @return the absolute state of the object at {@code initialState.time() + time}
     * @throws io.github.jakubt4.astrolabe.error.NumericNonConvergenceException if the iteration
     *                                                                          does not converge
     */
    ObjectState solve(ObjectState initialPrimaryBodyState,
                      ObjectState initialState,
                      Orbit initialOrbit,
                      ObjectState primaryBodyStateAtTime,
                      double time);

    /**
     * Propagates in a frame that keeps the primary body at its initial state.
     */
    default ObjectState solve(final ObjectState initialPrimaryBodyState,
                              final ObjectState initialState,
                              final Orbit initialOrbit,
                              final double time) {
        return solve(initialPrimaryBodyState, initialState, initialOrbit, initialPrimaryBodyState, time);
    }
}
