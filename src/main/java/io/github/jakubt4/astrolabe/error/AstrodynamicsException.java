package io.github.jakubt4.astrolabe.error;

/**
 * Root of the engine's failure taxonomy.
 */
public abstract class AstrodynamicsException extends RuntimeException {

    protected AstrodynamicsException(final String message) {
        super(message);
    }

    protected AstrodynamicsException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
