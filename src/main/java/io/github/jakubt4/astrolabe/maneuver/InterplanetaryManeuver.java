package io.github.jakubt4.astrolabe.maneuver;

import io.github.jakubt4.astrolabe.physics.Body;

import java.util.Optional;

/**
 * Entry points for transfers between planets.
 */
public final class InterplanetaryManeuver {

    private InterplanetaryManeuver() {
    }

    /**
     * Transfers {@code craft} from the planet it orbits to {@code target} with the default options.
     */
    public static Optional<PlanetaryTransferPlan> planetaryTransfer(final ManeuverContext context,
                                                                    final Body craft,
                                                                    final Body target) {
        return planetaryTransfer(context, craft, target, PlanetaryTransferOptions.defaults(), ManeuverObserver.NONE);
    }

    /**
     * @param observer notified of every feasible heliocentric departure while the search runs
     */
    public static Optional<PlanetaryTransferPlan> planetaryTransfer(final ManeuverContext context,
                                                                    final Body craft,
                                                                    final Body target,
                                                                    final PlanetaryTransferOptions options,
                                                                    final ManeuverObserver observer) {
        return new PlanetaryTransfer(context, craft, target, options, observer).compute();
    }
}
