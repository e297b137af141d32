package io.github.jakubt4.astrolabe.maneuver;

import java.util.Iterator;
import java.util.List;

/**
 * Ordered sequence of burns produced by a planner.
 */
public record OrbitalManeuvers(List<OrbitalManeuver> maneuvers) implements Iterable<OrbitalManeuver> {

    public OrbitalManeuvers {
        maneuvers = List.copyOf(maneuvers);
    }

    public static OrbitalManeuvers single(final OrbitalManeuver maneuver) {
        return new OrbitalManeuvers(List.of(maneuver));
    }

    public static OrbitalManeuvers sequence(final OrbitalManeuver... maneuvers) {
        return new OrbitalManeuvers(List.of(maneuvers));
    }

    public OrbitalManeuver get(final int index) {
        return maneuvers.get(index);
    }

    public int size() {
        return maneuvers.size();
    }

    /**
     * Sum of the burn magnitudes, m/s.
     */
    public double totalDeltaV() {
        return maneuvers.stream().mapToDouble(OrbitalManeuver::deltaV).sum();
    }

    @Override
    public Iterator<OrbitalManeuver> iterator() {
        return maneuvers.iterator();
    }
}
