package io.github.jakubt4.astrolabe.error;

/**
 * A search exhausted its domain without a solvable and physically valid candidate.
 */
public class NoFeasibleSolutionException extends AstrodynamicsException {

    public NoFeasibleSolutionException(final String message) {
        super(message);
    }
}
