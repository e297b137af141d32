package io.github.jakubt4.astrolabe.maneuver;

/**
 * Grid of (launch time, transfer duration) cells examined by {@link InterceptManeuver}.
 *
 * @param minLaunchTime         first launch time, seconds from the search epoch
 * @param maxLaunchTime         last launch time (inclusive)
 * @param minDuration           shortest transfer duration
 * @param maxDuration           longest transfer duration (inclusive)
 * @param deltaTime             grid step on both axes
 * @param allowedDeltaV         stop early once a departure burn at or below this is found;
 *                              {@code null} searches the whole grid
 * @param listPossibleLaunches  collect every feasible cell in the result
 * @param impactCheckDeltaTime  sampling step of the re-impact check for surface launches
 * @param maxImpactCheckTime    look-ahead window of the re-impact check
 */
public record InterceptSearchSpace(double minLaunchTime,
                                   double maxLaunchTime,
                                   double minDuration,
                                   double maxDuration,
                                   double deltaTime,
                                   Double allowedDeltaV,
                                   boolean listPossibleLaunches,
                                   double impactCheckDeltaTime,
                                   double maxImpactCheckTime) {

    public static final double DEFAULT_IMPACT_CHECK_DELTA_TIME = 100.0;
    public static final double DEFAULT_MAX_IMPACT_CHECK_TIME = 1000.0;

    public InterceptSearchSpace {
        if (!(deltaTime > 0.0)) {
            throw new IllegalArgumentException("Search step must be positive: " + deltaTime);
        }
        if (maxLaunchTime < minLaunchTime || maxDuration < minDuration) {
            throw new IllegalArgumentException("Search bounds are inverted");
        }
        if (!(impactCheckDeltaTime > 0.0)) {
            throw new IllegalArgumentException("Impact check step must be positive: " + impactCheckDeltaTime);
        }
    }

    public static InterceptSearchSpace of(final double minLaunchTime,
                                          final double maxLaunchTime,
                                          final double minDuration,
                                          final double maxDuration,
                                          final double deltaTime) {
        return new InterceptSearchSpace(
                minLaunchTime, maxLaunchTime, minDuration, maxDuration, deltaTime, null, false,
                DEFAULT_IMPACT_CHECK_DELTA_TIME, DEFAULT_MAX_IMPACT_CHECK_TIME);
    }

    public InterceptSearchSpace withAllowedDeltaV(final double newAllowedDeltaV) {
        return new InterceptSearchSpace(minLaunchTime, maxLaunchTime, minDuration, maxDuration, deltaTime,
                newAllowedDeltaV, listPossibleLaunches, impactCheckDeltaTime, maxImpactCheckTime);
    }

    public InterceptSearchSpace listingPossibleLaunches() {
        return new InterceptSearchSpace(minLaunchTime, maxLaunchTime, minDuration, maxDuration, deltaTime,
                allowedDeltaV, true, impactCheckDeltaTime, maxImpactCheckTime);
    }

    public InterceptSearchSpace withImpactCheck(final double newImpactCheckDeltaTime, final double newMaxImpactCheckTime) {
        return new InterceptSearchSpace(minLaunchTime, maxLaunchTime, minDuration, maxDuration, deltaTime,
                allowedDeltaV, listPossibleLaunches, newImpactCheckDeltaTime, newMaxImpactCheckTime);
    }

    int launchSteps() {
        return steps(minLaunchTime, maxLaunchTime);
    }

    int durationSteps() {
        return steps(minDuration, maxDuration);
    }

    double launchTime(final int index) {
        return minLaunchTime + index * deltaTime;
    }

    double duration(final int index) {
        return minDuration + index * deltaTime;
    }

    private int steps(final double min, final double max) {
        return (int) Math.floor((max - min) / deltaTime + 1e-9) + 1;
    }
}
