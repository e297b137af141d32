package io.github.jakubt4.astrolabe.dto;

import io.github.jakubt4.astrolabe.orbit.OrbitPosition;

/**
 * Orbital elements derived from a state vector. Angles are in radians.
 *
 * @param status  {@code "OK"}, {@code "REJECTED"} or {@code "INFEASIBLE"}
 * @param message human-readable detail
 */
public record OrbitElementsResponse(String status,
                                    String message,
                                    String type,
                                    Double parameter,
                                    Double semiMajorAxis,
                                    Double eccentricity,
                                    Double inclination,
                                    Double longitudeOfAscendingNode,
                                    Double argumentOfPeriapsis,
                                    Double trueAnomaly) {

    public static OrbitElementsResponse of(final OrbitPosition orbitPosition) {
        final var orbit = orbitPosition.orbit();
        return new OrbitElementsResponse(
                "OK",
                "Elements computed",
                orbit.type().name(),
                orbit.parameter(),
                orbit.semiMajorAxis(),
                orbit.eccentricity(),
                orbit.inclination(),
                orbit.longitudeOfAscendingNode(),
                orbit.argumentOfPeriapsis(),
                orbitPosition.trueAnomaly());
    }

    public static OrbitElementsResponse rejected(final String status, final String message) {
        return new OrbitElementsResponse(status, message, null, null, null, null, null, null, null, null);
    }
}
