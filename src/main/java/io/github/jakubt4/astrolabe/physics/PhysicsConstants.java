package io.github.jakubt4.astrolabe.physics;

import org.orekit.utils.Constants;

/**
 * Physical constants shared by the engine.
 */
public final class PhysicsConstants {

    /** Newtonian constant of gravitation (CODATA 2014), m^3 kg^-1 s^-2. */
    public static final double G = 6.67408e-11;

    public static final double ASTRONOMICAL_UNIT = Constants.IAU_2012_ASTRONOMICAL_UNIT;

    public static final double ONE_DAY = Constants.JULIAN_DAY;

    public static final double SIDEREAL_DAY = 23.0 * 3600.0 + 56.0 * 60.0 + 4.0916;

    public static final double STANDARD_GRAVITY = Constants.G0_STANDARD_GRAVITY;

    public static final double TWO_PI = 2.0 * Math.PI;

    private PhysicsConstants() {
    }

    /**
     * Rounds a duration in seconds to whole days.
     */
    public static double roundToDays(final double seconds) {
        return Math.round(seconds / ONE_DAY) * ONE_DAY;
    }
}
