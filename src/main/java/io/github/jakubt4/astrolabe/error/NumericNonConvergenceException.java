package io.github.jakubt4.astrolabe.error;

/**
 * An iterative solver exhausted its iteration budget or left its valid solution domain.
 */
public class NumericNonConvergenceException extends AstrodynamicsException {

    private final int iterations;

    public NumericNonConvergenceException(final String message, final int iterations) {
        super(message);
        this.iterations = iterations;
    }

    public NumericNonConvergenceException(final String message) {
        this(message, 0);
    }

    public int getIterations() {
        return iterations;
    }
}
