package io.github.jakubt4.astrolabe.maneuver;

import io.github.jakubt4.astrolabe.orbit.OrbitPosition;
import io.github.jakubt4.astrolabe.physics.ObjectState;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.util.List;

/**
 * Result of a {@link PlanetaryTransfer}: the two burns plus the output of every stage that led
 * to them.
 *
 * <p>Stage times are relative to the instant the transfer was planned unless noted otherwise.
 */
public record PlanetaryTransferPlan(OrbitalManeuvers maneuvers,
                                    HeliocentricLeg heliocentricLeg,
                                    InjectionBurn injectionBurn,
                                    SoiExit soiExit,
                                    MidcourseCorrection midcourseCorrection) {

    public double totalDeltaV() {
        return maneuvers.totalDeltaV();
    }

    public List<PossibleLaunch> possibleDepartureBurns() {
        return heliocentricLeg.possibleDepartureBurns();
    }

    /**
     * Planet-to-planet transfer ignoring the planets' own gravity.
     *
     * @param departureTime           when the origin planet should leave its orbit
     * @param coastTime               heliocentric flight time
     * @param transferSpeed           hyperbolic excess speed required at departure, m/s
     * @param possibleDepartureBurns  feasible departures found by the search, if one was run
     */
    public record HeliocentricLeg(double departureTime,
                                  double coastTime,
                                  double transferSpeed,
                                  List<PossibleLaunch> possibleDepartureBurns) {

        public HeliocentricLeg {
            possibleDepartureBurns = List.copyOf(possibleDepartureBurns);
        }
    }

    /**
     * Burn from the parking orbit onto the escape hyperbola.
     *
     * @param burnTime         time of the burn
     * @param deltaVelocity    burn, along the prograde relative to the origin planet
     * @param burnState        absolute state right before the burn
     * @param primaryBodyState state of the origin planet at the burn
     */
    public record InjectionBurn(double burnTime,
                                Vector3D deltaVelocity,
                                ObjectState burnState,
                                ObjectState primaryBodyState) {
    }

    /**
     * The moment the craft leaves the sphere of influence of the origin planet.
     *
     * @param timeToLeave         time from the injection burn
     * @param state               absolute state of the craft
     * @param orbitPosition       heliocentric orbit of the craft
     * @param targetState         absolute state of the target planet
     * @param targetOrbitPosition heliocentric orbit of the target planet
     */
    public record SoiExit(double timeToLeave,
                          ObjectState state,
                          OrbitPosition orbitPosition,
                          ObjectState targetState,
                          OrbitPosition targetOrbitPosition) {
    }

    /**
     * Correction burn on the heliocentric leg.
     *
     * @param burnTime      time of the burn after leaving the sphere of influence
     * @param deltaVelocity burn
     * @param duration      flight time from the burn to the target
     */
    public record MidcourseCorrection(double burnTime, Vector3D deltaVelocity, double duration) {
    }
}
