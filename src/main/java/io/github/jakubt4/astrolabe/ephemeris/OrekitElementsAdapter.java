package io.github.jakubt4.astrolabe.ephemeris;

import io.github.jakubt4.astrolabe.error.GeometricInfeasibilityException;
import io.github.jakubt4.astrolabe.orbit.OrbitFormulas;
import io.github.jakubt4.astrolabe.orbit.OrbitPosition;
import io.github.jakubt4.astrolabe.physics.Body;
import lombok.extern.slf4j.Slf4j;
import org.orekit.frames.Frame;
import org.orekit.frames.FramesFactory;
import org.orekit.orbits.KeplerianOrbit;
import org.orekit.orbits.OrbitType;
import org.orekit.orbits.PositionAngleType;
import org.orekit.time.AbsoluteDate;

/**
 * Converts between the engine's elements and Orekit orbits.
 *
 * <p>Simulation time 0 maps to {@code simulationEpoch}. All Orekit orbits are expressed in the
 * inertial {@code frame}, whose axes are taken to coincide with the simulation axes.
 */
@Slf4j
public class OrekitElementsAdapter {

    private final AbsoluteDate simulationEpoch;
    private final Frame frame;

    public OrekitElementsAdapter(final AbsoluteDate simulationEpoch, final Frame frame) {
        if (!frame.isPseudoInertial()) {
            throw new IllegalArgumentException("Frame " + frame.getName() + " is not pseudo-inertial");
        }
        this.simulationEpoch = simulationEpoch;
        this.frame = frame;
    }

    /**
     * Simulation time 0 at J2000, elements in GCRF.
     */
    public OrekitElementsAdapter() {
        this(AbsoluteDate.J2000_EPOCH, FramesFactory.getGCRF());
    }

    public double simulationTime(final AbsoluteDate date) {
        return date.durationFrom(simulationEpoch);
    }

    public AbsoluteDate date(final double simulationTime) {
        return simulationEpoch.shiftedBy(simulationTime);
    }

    /**
     * @throws GeometricInfeasibilityException for parabolic orbits, which Orekit does not represent
     */
    public KeplerianOrbit toKeplerianOrbit(final OrbitPosition orbitPosition, final double simulationTime) {
        final var orbit = orbitPosition.orbit();
        if (orbit.isParabolic()) {
            throw new GeometricInfeasibilityException("Parabolic orbits have no Keplerian representation");
        }
        return new KeplerianOrbit(
                orbit.semiMajorAxis(),
                orbit.eccentricity(),
                orbit.inclination(),
                orbit.argumentOfPeriapsis(),
                orbit.longitudeOfAscendingNode(),
                orbitPosition.trueAnomaly(),
                PositionAngleType.TRUE,
                frame,
                date(simulationTime),
                orbit.standardGravitationalParameter());
    }

    public KeplerianOrbit toKeplerianOrbit(final SeedElements elements, final Body primaryBody) {
        return toKeplerianOrbit(elements.toOrbitPosition(primaryBody), elements.epoch());
    }

    /**
     * Reads any Orekit orbit as elements about {@code primaryBody}.
     *
     * <p>The primary body's gravitational parameter wins over the orbit's own; a mismatch is logged.
     */
    public SeedElements toSeedElements(final org.orekit.orbits.Orbit orekitOrbit, final Body primaryBody) {
        final var mu = primaryBody.getStandardGravitationalParameter();
        if (Math.abs(orekitOrbit.getMu() - mu) > 1e-9 * mu) {
            log.warn("Gravitational parameter of [{}] ({}) differs from the orbit's ({})",
                    primaryBody.getName(), mu, orekitOrbit.getMu());
        }

        final var keplerian = (KeplerianOrbit) OrbitType.KEPLERIAN.convertType(
                orekitOrbit.getFrame() == frame ? orekitOrbit : inFrame(orekitOrbit));
        return SeedElements.ofSemiMajorAxis(
                keplerian.getA(),
                keplerian.getE(),
                keplerian.getI(),
                OrbitFormulas.clampAngle(keplerian.getRightAscensionOfAscendingNode()),
                OrbitFormulas.clampAngle(keplerian.getPerigeeArgument()),
                OrbitFormulas.clampAngle(keplerian.getTrueAnomaly()),
                simulationTime(keplerian.getDate()));
    }

    public OrbitPosition toOrbitPosition(final org.orekit.orbits.Orbit orekitOrbit, final Body primaryBody) {
        return toSeedElements(orekitOrbit, primaryBody).toOrbitPosition(primaryBody);
    }

    private org.orekit.orbits.Orbit inFrame(final org.orekit.orbits.Orbit orekitOrbit) {
        return new org.orekit.orbits.CartesianOrbit(
                orekitOrbit.getPVCoordinates(frame), frame, orekitOrbit.getDate(), orekitOrbit.getMu());
    }
}
