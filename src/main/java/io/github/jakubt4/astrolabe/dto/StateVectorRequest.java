package io.github.jakubt4.astrolabe.dto;

/**
 * A state relative to a point-mass primary.
 *
 * @param mu       standard gravitational parameter of the primary, m^3/s^2
 * @param position relative position [x, y, z] in metres
 * @param velocity relative velocity [vx, vy, vz] in m/s
 * @param time     propagation time in seconds (propagation only)
 */
public record StateVectorRequest(Double mu, double[] position, double[] velocity, Double time) {
}
