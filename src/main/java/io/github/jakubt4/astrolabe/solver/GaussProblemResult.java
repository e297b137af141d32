package io.github.jakubt4.astrolabe.solver;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Velocities at both ends of a Lambert transfer arc.
 *
 * @param velocity1 absolute velocity at the first position
 * @param velocity2 absolute velocity at the second position
 */
public record GaussProblemResult(Vector3D velocity1, Vector3D velocity2) {
}
