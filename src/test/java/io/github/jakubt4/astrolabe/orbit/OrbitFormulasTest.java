package io.github.jakubt4.astrolabe.orbit;

import io.github.jakubt4.astrolabe.Scenarios;
import io.github.jakubt4.astrolabe.physics.ObjectConfig;
import io.github.jakubt4.astrolabe.physics.PhysicsConstants;
import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OrbitFormulasTest {

    @Test
    void synodicPeriodOfEarthAndMars() {
        final var earthPeriod = OrbitFormulas.orbitalPeriod(Scenarios.SUN_MU, Scenarios.EARTH_ORBIT);
        final var marsPeriod = OrbitFormulas.orbitalPeriod(Scenarios.SUN_MU, Scenarios.MARS_ORBIT);

        final var synodic = OrbitFormulas.synodicPeriod(earthPeriod, marsPeriod);

        assertThat(synodic / PhysicsConstants.ONE_DAY).isCloseTo(780.0, within(3.0));
        assertThat(OrbitFormulas.synodicPeriod(marsPeriod, earthPeriod)).isEqualTo(synodic);
    }

    @Test
    void equalPeriodsHaveNoSynodicPeriod() {
        assertThat(OrbitFormulas.synodicPeriod(5400.0, 5400.001)).isZero();
    }

    @Test
    void sphereOfInfluenceOfEarth() {
        final var soi = OrbitFormulas.sphereOfInfluence(
                Scenarios.EARTH_ORBIT, Scenarios.EARTH_MU / PhysicsConstants.G, Scenarios.SUN_MU / PhysicsConstants.G);

        assertThat(soi).isCloseTo(9.247e8, within(1.0e6));
    }

    @Test
    void periodAndSemiMajorAxisAreInverse() {
        final var period = OrbitFormulas.orbitalPeriod(Scenarios.EARTH_MU, 4.2164e7);

        assertThat(period).isCloseTo(86_164.0, within(50.0));
        assertThat(OrbitFormulas.semiMajorAxisFromOrbitalPeriod(Scenarios.EARTH_MU, period)).isCloseTo(4.2164e7, within(1e-3));
    }

    @Test
    void visVivaReducesToCircularAndEscapeSpeeds() {
        final var mu = Scenarios.EARTH_MU;

        assertThat(OrbitFormulas.visVivaSpeed(mu, 7.0e6, 7.0e6)).isCloseTo(OrbitFormulas.circularSpeed(mu, 7.0e6), within(1e-9));
        assertThat(OrbitFormulas.escapeSpeed(mu, 7.0e6))
                .isCloseTo(FastMath.sqrt(2.0) * OrbitFormulas.circularSpeed(mu, 7.0e6), within(1e-9));
    }

    @Test
    void trueAnomalyAtReturnsBothCrossings() {
        final var roots = OrbitFormulas.trueAnomalyAt(1.0e7, 1.0e7, 0.5).orElseThrow();

        assertThat(roots.first()).isCloseTo(FastMath.PI / 2.0, within(1e-12));
        assertThat(roots.second()).isCloseTo(3.0 * FastMath.PI / 2.0, within(1e-12));
        assertThat(roots.nearest(4.0)).isEqualTo(roots.second());
        assertThat(roots.nearest(1.0)).isEqualTo(roots.first());
    }

    @Test
    void trueAnomalyAtIsEmptyBeyondApoapsis() {
        assertThat(OrbitFormulas.trueAnomalyAt(3.0e7, 1.0e7, 0.5)).isEmpty();
    }

    @Test
    void eccentricAnomalyIsContinuousOverFullTurn() {
        final var e = 0.4;
        var previous = -1.0;
        for (var nu = 0.0; nu <= 2.0 * FastMath.PI; nu += 0.1) {
            final var anomaly = OrbitFormulas.eccentricAnomaly(e, nu);
            assertThat(anomaly).isGreaterThan(previous);
            assertThat(OrbitFormulas.trueAnomalyFromEccentricAnomaly(e, anomaly))
                    .isCloseTo(nu, within(1e-9));
            previous = anomaly;
        }
    }

    @Test
    void hyperbolicAnomalyIsNegativeOnIncomingBranch() {
        assertThat(OrbitFormulas.hyperbolicEccentricAnomaly(2.0, 1.0)).isPositive();
        assertThat(OrbitFormulas.hyperbolicEccentricAnomaly(2.0, 2.0 * FastMath.PI - 1.0)).isNegative();
        assertThat(OrbitFormulas.hyperbolicEccentricAnomaly(2.0, 2.0 * FastMath.PI - 1.0))
                .isCloseTo(-OrbitFormulas.hyperbolicEccentricAnomaly(2.0, 1.0), within(1e-12));
    }

    @Test
    void clampAngleWrapsIntoOneTurn() {
        assertThat(OrbitFormulas.clampAngle(-0.5)).isCloseTo(2.0 * FastMath.PI - 0.5, within(1e-12));
        assertThat(OrbitFormulas.clampAngle(7.0)).isCloseTo(7.0 - 2.0 * FastMath.PI, within(1e-12));
        assertThat(OrbitFormulas.clampAngle(1.0)).isEqualTo(1.0);
    }

    @Test
    void surfaceSpeedVanishesAtThePoles() {
        final var config = ObjectConfig.ofGravitationalParameter(Scenarios.EARTH_MU, 86_164.1);

        assertThat(OrbitFormulas.surfaceSpeedDueToRotation(config, Scenarios.EARTH_RADIUS, 0.0)).isCloseTo(464.6, within(0.5));
        assertThat(OrbitFormulas.surfaceSpeedDueToRotation(config, Scenarios.EARTH_RADIUS, FastMath.PI / 2.0)).isCloseTo(0.0, within(1e-9));
    }
}
