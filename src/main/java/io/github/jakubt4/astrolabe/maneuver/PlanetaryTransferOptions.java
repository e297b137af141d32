package io.github.jakubt4.astrolabe.maneuver;

import static io.github.jakubt4.astrolabe.physics.PhysicsConstants.ONE_DAY;

/**
 * Tuning of a {@link PlanetaryTransfer}.
 *
 * <p>Heliocentric durations are ratios of the Hohmann coast time between the two planets and the
 * launch window is a ratio of their synodic period. Midcourse ratios are relative to the coast
 * time of the heliocentric leg.
 */
public record PlanetaryTransferOptions(HeliocentricStrategy strategy,
                                       double minCoastRatio,
                                       double maxCoastRatio,
                                       double maxLaunchRatio,
                                       double heliocentricStep,
                                       double midcourseMinCoastRatio,
                                       double midcourseMaxCoastRatio,
                                       double midcourseMaxLaunchRatio,
                                       double midcourseStep,
                                       double allowedMidcourseDeltaV) {

    /**
     * How the heliocentric leg between the two planets is found.
     */
    public enum HeliocentricStrategy {
        /** Grid search over one synodic period; also lists every feasible departure. */
        INTERCEPT_SEARCH,
        /** Closed-form Hohmann transfer timed by phase alignment; assumes circular coplanar planets. */
        HOHMANN
    }

    public PlanetaryTransferOptions {
        if (strategy == null) {
            throw new IllegalArgumentException("Heliocentric strategy is required");
        }
        if (!(heliocentricStep > 0.0) || !(midcourseStep > 0.0)) {
            throw new IllegalArgumentException("Search steps must be positive");
        }
        if (maxCoastRatio < minCoastRatio || midcourseMaxCoastRatio < midcourseMinCoastRatio) {
            throw new IllegalArgumentException("Coast ratios are inverted");
        }
    }

    public static PlanetaryTransferOptions defaults() {
        return new PlanetaryTransferOptions(
                HeliocentricStrategy.INTERCEPT_SEARCH,
                0.5, 2.0, 1.0, ONE_DAY,
                0.75, 2.0, 0.5, 0.5 * ONE_DAY,
                150.0);
    }

    public PlanetaryTransferOptions withStrategy(final HeliocentricStrategy newStrategy) {
        return new PlanetaryTransferOptions(newStrategy, minCoastRatio, maxCoastRatio, maxLaunchRatio, heliocentricStep,
                midcourseMinCoastRatio, midcourseMaxCoastRatio, midcourseMaxLaunchRatio, midcourseStep, allowedMidcourseDeltaV);
    }

    public PlanetaryTransferOptions withHeliocentricStep(final double newStep) {
        return new PlanetaryTransferOptions(strategy, minCoastRatio, maxCoastRatio, maxLaunchRatio, newStep,
                midcourseMinCoastRatio, midcourseMaxCoastRatio, midcourseMaxLaunchRatio, midcourseStep, allowedMidcourseDeltaV);
    }

    public PlanetaryTransferOptions withMidcourseStep(final double newStep) {
        return new PlanetaryTransferOptions(strategy, minCoastRatio, maxCoastRatio, maxLaunchRatio, heliocentricStep,
                midcourseMinCoastRatio, midcourseMaxCoastRatio, midcourseMaxLaunchRatio, newStep, allowedMidcourseDeltaV);
    }

    public PlanetaryTransferOptions withAllowedMidcourseDeltaV(final double newAllowedDeltaV) {
        return new PlanetaryTransferOptions(strategy, minCoastRatio, maxCoastRatio, maxLaunchRatio, heliocentricStep,
                midcourseMinCoastRatio, midcourseMaxCoastRatio, midcourseMaxLaunchRatio, midcourseStep, newAllowedDeltaV);
    }
}
