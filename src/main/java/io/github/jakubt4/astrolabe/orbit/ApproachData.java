package io.github.jakubt4.astrolabe.orbit;

/**
 * Closest approach between two objects.
 *
 * @param distance minimum separation in metres
 * @param time     absolute simulation time of the approach
 */
public record ApproachData(double distance, double time) {
}
