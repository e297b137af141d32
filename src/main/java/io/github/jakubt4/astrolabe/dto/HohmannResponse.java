package io.github.jakubt4.astrolabe.dto;

/**
 * Hohmann transfer burns (m/s), coast time (s) and departure phase angle (rad).
 */
public record HohmannResponse(String status,
                              String message,
                              Double firstBurn,
                              Double secondBurn,
                              Double coastTime,
                              Double alignmentAngle) {

    public static HohmannResponse rejected(final String status, final String message) {
        return new HohmannResponse(status, message, null, null, null, null);
    }
}
