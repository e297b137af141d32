package io.github.jakubt4.astrolabe.error;

/**
 * A requested orbital change is impossible from the current orbit, or the orbital
 * relationship between two objects is not supported by the planner.
 */
public class GeometricInfeasibilityException extends AstrodynamicsException {

    public GeometricInfeasibilityException(final String message) {
        super(message);
    }
}
