package io.github.jakubt4.astrolabe.orbit;

/**
 * Conic section of an orbit, derived from its eccentricity.
 */
public enum OrbitType {
    CIRCULAR,
    ELLIPTICAL,
    PARABOLIC,
    HYPERBOLIC
}
