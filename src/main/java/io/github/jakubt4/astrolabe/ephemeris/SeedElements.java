package io.github.jakubt4.astrolabe.ephemeris;

import io.github.jakubt4.astrolabe.orbit.Orbit;
import io.github.jakubt4.astrolabe.orbit.OrbitFormulas;
import io.github.jakubt4.astrolabe.orbit.OrbitPosition;
import io.github.jakubt4.astrolabe.physics.Body;

/**
 * Classical elements used to seed a scenario, e.g. from a planetary ephemeris table.
 *
 * @param parameter                semi-latus rectum in metres
 * @param eccentricity             eccentricity
 * @param inclination              radians
 * @param longitudeOfAscendingNode radians
 * @param argumentOfPeriapsis      radians
 * @param trueAnomaly              radians
 * @param epoch                    simulation time the elements refer to, seconds
 */
public record SeedElements(double parameter,
                           double eccentricity,
                           double inclination,
                           double longitudeOfAscendingNode,
                           double argumentOfPeriapsis,
                           double trueAnomaly,
                           double epoch) {

    public static SeedElements ofSemiMajorAxis(final double semiMajorAxis,
                                               final double eccentricity,
                                               final double inclination,
                                               final double longitudeOfAscendingNode,
                                               final double argumentOfPeriapsis,
                                               final double trueAnomaly,
                                               final double epoch) {
        return new SeedElements(
                OrbitFormulas.parameterFromSemiMajorAxis(semiMajorAxis, eccentricity),
                eccentricity,
                inclination,
                longitudeOfAscendingNode,
                argumentOfPeriapsis,
                trueAnomaly,
                epoch);
    }

    public static SeedElements of(final OrbitPosition orbitPosition, final double epoch) {
        final var orbit = orbitPosition.orbit();
        return new SeedElements(
                orbit.parameter(),
                orbit.eccentricity(),
                orbit.inclination(),
                orbit.longitudeOfAscendingNode(),
                orbit.argumentOfPeriapsis(),
                orbitPosition.trueAnomaly(),
                epoch);
    }

    public OrbitPosition toOrbitPosition(final Body primaryBody) {
        final var orbit = new Orbit(
                primaryBody, parameter, eccentricity, inclination, longitudeOfAscendingNode, argumentOfPeriapsis);
        return new OrbitPosition(orbit, trueAnomaly);
    }
}
