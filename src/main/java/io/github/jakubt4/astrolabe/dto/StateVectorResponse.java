package io.github.jakubt4.astrolabe.dto;

import io.github.jakubt4.astrolabe.physics.ObjectState;

/**
 * A propagated state relative to the primary.
 */
public record StateVectorResponse(String status, String message, double[] position, double[] velocity) {

    public static StateVectorResponse of(final ObjectState state) {
        return new StateVectorResponse(
                "OK", "State propagated", state.position().toArray(), state.velocity().toArray());
    }

    public static StateVectorResponse rejected(final String status, final String message) {
        return new StateVectorResponse(status, message, null, null);
    }
}
