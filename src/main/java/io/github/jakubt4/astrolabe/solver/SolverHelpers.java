package io.github.jakubt4.astrolabe.solver;

import io.github.jakubt4.astrolabe.orbit.Orbit;
import io.github.jakubt4.astrolabe.orbit.OrbitFormulas;
import io.github.jakubt4.astrolabe.physics.Body;
import io.github.jakubt4.astrolabe.physics.ObjectState;
import org.hipparchus.geometry.euclidean.threed.Rotation;
import org.hipparchus.geometry.euclidean.threed.RotationConvention;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Propagation helpers built on top of a {@link KeplerProblemSolver}.
 */
public final class SolverHelpers {

    private SolverHelpers() {
    }

    /**
     * Rotation angle of a body after {@code time}, in [0, 2pi).
     */
    public static double calculateRotation(final double rotationalPeriod, final double rotation, final double time) {
        if (rotationalPeriod == 0.0) {
            return rotation;
        }
        return OrbitFormulas.clampAngle(rotation + 2.0 * Math.PI / rotationalPeriod * time);
    }

    /**
     * Moves an object resting on the surface of {@code primaryBody} along with the body's rotation.
     *
     * @param primaryBody             body the object rests on
     * @param initialPrimaryBodyState state of the body at the initial instant
     * @param nextPrimaryBodyState    state of the body after {@code time}
     * @param state                   absolute state of the object at the initial instant
     * @param time                    elapsed time in seconds
     */
    public static ObjectState moveImpactedObject(final Body primaryBody,
                                                 final ObjectState initialPrimaryBodyState,
                                                 final ObjectState nextPrimaryBodyState,
                                                 final ObjectState state,
                                                 final double time) {
        final var config = primaryBody.getConfiguration();
        if (config.rotationalSpeed() == 0.0) {
            return state.swapReferenceFrame(initialPrimaryBodyState, nextPrimaryBodyState)
                    .withTime(state.time() + time);
        }

        final var axis = config.axisOfRotation();
        final var spin = new Rotation(axis, config.rotationalSpeed() * time, RotationConvention.VECTOR_OPERATOR);
        final var r = spin.applyTo(state.position().subtract(initialPrimaryBodyState.position()));
        final var surfaceVelocity = Vector3D.crossProduct(axis, r).scalarMultiply(config.rotationalSpeed());

        return new ObjectState(
                state.time() + time,
                nextPrimaryBodyState.position().add(r),
                nextPrimaryBodyState.velocity().add(surfaceVelocity),
                state.rotation(),
                state.impacted());
    }

    /**
     * Propagates {@code state} of {@code body} by {@code time}, moving its primary body (and
     * that body's primaries, recursively) along their own orbits.
     *
     * <p>{@code state} must be at the same instant as the current state of the primary body.
     */
    public static PropagatedState afterTime(final KeplerProblemSolver solver,
                                            final Body body,
                                            final ObjectState state,
                                            final Orbit orbit,
                                            final double time) {
        final var primaryBody = orbit.primaryBody();
        final var primaryBodyState = primaryBody.getState();

        final ObjectState nextPrimaryBodyState;
        if (primaryBody.isObjectOfReference()) {
            nextPrimaryBodyState = primaryBodyState.withTime(primaryBodyState.time() + time);
        } else {
            nextPrimaryBodyState = afterTime(
                    solver, primaryBody, primaryBodyState, Orbit.of(primaryBody), time).state();
        }

        final var nextState = solver.solve(primaryBodyState, state, orbit, nextPrimaryBodyState, time)
                .withRotation(calculateRotation(body.getConfiguration().rotationalPeriod(), state.rotation(), time));
        return new PropagatedState(nextState, nextPrimaryBodyState);
    }

    /**
     * Propagates {@code body} from its current state along its current orbit.
     */
    public static PropagatedState afterTime(final KeplerProblemSolver solver, final Body body, final double time) {
        return afterTime(solver, body, body.getState(), Orbit.of(body), time);
    }

    /**
     * A propagated state together with the state of its primary body at the same instant.
     */
    public record PropagatedState(ObjectState state, ObjectState primaryBodyState) {
    }
}
