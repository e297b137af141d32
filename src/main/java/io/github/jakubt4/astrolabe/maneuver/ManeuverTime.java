package io.github.jakubt4.astrolabe.maneuver;

import io.github.jakubt4.astrolabe.orbit.OrbitPosition;

/**
 * When a burn should happen, relative to the current position on the orbit.
 */
public record ManeuverTime(Type type, double value) {

    public enum Type {
        PERIAPSIS,
        APOAPSIS,
        NOW,
        TIME_FROM_NOW
    }

    public static ManeuverTime periapsis() {
        return new ManeuverTime(Type.PERIAPSIS, 0.0);
    }

    public static ManeuverTime apoapsis() {
        return new ManeuverTime(Type.APOAPSIS, 0.0);
    }

    public static ManeuverTime now() {
        return new ManeuverTime(Type.NOW, 0.0);
    }

    public static ManeuverTime timeFromNow(final double seconds) {
        return new ManeuverTime(Type.TIME_FROM_NOW, seconds);
    }

    /**
     * Seconds from now until the burn for an object at {@code orbitPosition}.
     */
    public double timeFromNow(final OrbitPosition orbitPosition) {
        return switch (type) {
            case PERIAPSIS -> orbitPosition.timeToPeriapsis();
            case APOAPSIS -> orbitPosition.timeToApoapsis();
            case NOW -> 0.0;
            case TIME_FROM_NOW -> value;
        };
    }
}
