package io.github.jakubt4.astrolabe.maneuver;

import io.github.jakubt4.astrolabe.error.GeometricInfeasibilityException;
import io.github.jakubt4.astrolabe.maneuver.PlanetaryTransferOptions.HeliocentricStrategy;
import io.github.jakubt4.astrolabe.maneuver.PlanetaryTransferPlan.HeliocentricLeg;
import io.github.jakubt4.astrolabe.maneuver.PlanetaryTransferPlan.InjectionBurn;
import io.github.jakubt4.astrolabe.maneuver.PlanetaryTransferPlan.MidcourseCorrection;
import io.github.jakubt4.astrolabe.maneuver.PlanetaryTransferPlan.SoiExit;
import io.github.jakubt4.astrolabe.orbit.Orbit;
import io.github.jakubt4.astrolabe.orbit.OrbitCalculators;
import io.github.jakubt4.astrolabe.orbit.OrbitFormulas;
import io.github.jakubt4.astrolabe.orbit.OrbitHelpers;
import io.github.jakubt4.astrolabe.orbit.OrbitPosition;
import io.github.jakubt4.astrolabe.physics.Body;
import io.github.jakubt4.astrolabe.solver.SolverHelpers;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

import java.util.List;
import java.util.Optional;

import static io.github.jakubt4.astrolabe.physics.PhysicsConstants.TWO_PI;
import static io.github.jakubt4.astrolabe.physics.PhysicsConstants.roundToDays;

/**
 * Transfer of a craft in a parking orbit around one planet to another planet of the same star.
 *
 * <p>The plan is computed in strictly ordered stages, each consuming the previous one:
 * <ol>
 *   <li>heliocentric leg between the two planets,</li>
 *   <li>injection burn from the parking orbit onto the escape hyperbola,</li>
 *   <li>state at the sphere-of-influence exit,</li>
 *   <li>midcourse correction towards the target,</li>
 *   <li>assembly of the two burns.</li>
 * </ol>
 * Only the grid searches of stages 1 and 4 run in parallel.
 */
@Slf4j
public final class PlanetaryTransfer {

    private final ManeuverContext context;
    private final Body craft;
    private final Body target;
    private final Body currentPlanet;
    private final Body sun;
    private final PlanetaryTransferOptions options;
    private final ManeuverObserver observer;

    private final OrbitPosition currentPlanetOrbitPosition;
    private final OrbitPosition targetOrbitPosition;
    private final OrbitPosition craftOrbitPosition;

    /**
     * @throws GeometricInfeasibilityException if the craft does not orbit a planet of the star the
     *                                         target orbits, or the target is the craft's planet
     */
    public PlanetaryTransfer(final ManeuverContext context,
                             final Body craft,
                             final Body target,
                             final PlanetaryTransferOptions options,
                             final ManeuverObserver observer) {
        if (target.isObjectOfReference() || !target.getPrimaryBody().isObjectOfReference()) {
            throw new GeometricInfeasibilityException("The target [" + target.getName() + "] must be a planet");
        }
        if (craft.isObjectOfReference() || craft.getPrimaryBody().isObjectOfReference()) {
            throw new GeometricInfeasibilityException("[" + craft.getName() + "] must orbit a planet");
        }
        if (craft.getPrimaryBody() == target) {
            throw new GeometricInfeasibilityException("The target cannot be the planet [" + target.getName() + "] itself");
        }
        if (craft.getPrimaryBody().getPrimaryBody() != target.getPrimaryBody()) {
            throw new GeometricInfeasibilityException(
                    "[" + craft.getPrimaryBody().getName() + "] and [" + target.getName() + "] orbit different stars");
        }

        this.context = context;
        this.craft = craft;
        this.target = target;
        this.currentPlanet = craft.getPrimaryBody();
        this.sun = currentPlanet.getPrimaryBody();
        this.options = options;
        this.observer = observer == null ? ManeuverObserver.NONE : observer;

        this.currentPlanetOrbitPosition = OrbitPosition.of(currentPlanet);
        this.targetOrbitPosition = OrbitPosition.of(target);
        this.craftOrbitPosition = OrbitPosition.of(craft);
    }

    /**
     * Runs every stage.
     *
     * @return the plan, or empty if one of the searches finds no feasible transfer or the
     *         injection orbit never leaves the sphere of influence
     */
    public Optional<PlanetaryTransferPlan> compute() {
        final var start = System.nanoTime();

        final var leg = heliocentricLeg();
        if (leg.isEmpty()) {
            log.info("No heliocentric transfer from [{}] to [{}]", currentPlanet.getName(), target.getName());
            return Optional.empty();
        }
        log.info("Heliocentric leg: departure in {} s, coast {} s, excess speed {} m/s ({} ms)",
                leg.get().departureTime(), leg.get().coastTime(), leg.get().transferSpeed(), elapsedMillis(start));

        final var injection = injectionBurn(leg.get());
        final var soiExit = soiExit(injection);
        if (soiExit.isEmpty()) {
            log.info("Injection orbit of [{}] does not leave the sphere of influence of [{}]",
                    craft.getName(), currentPlanet.getName());
            return Optional.empty();
        }

        final var midcourseStart = System.nanoTime();
        final var midcourse = midcourseCorrection(leg.get(), soiExit.get());
        if (midcourse.isEmpty()) {
            log.info("No midcourse correction towards [{}]", target.getName());
            return Optional.empty();
        }
        log.info("Midcourse correction: {} m/s after {} s ({} ms)",
                midcourse.get().deltaVelocity().getNorm(), midcourse.get().burnTime(), elapsedMillis(midcourseStart));

        final var plan = assemble(leg.get(), injection, soiExit.get(), midcourse.get());
        log.info("Planetary transfer of [{}] to [{}]: total Δv {} m/s in {} ms",
                craft.getName(), target.getName(), plan.totalDeltaV(), elapsedMillis(start));
        return Optional.of(plan);
    }

    Optional<HeliocentricLeg> heliocentricLeg() {
        final var currentPlanetOrbit = currentPlanetOrbitPosition.orbit();
        final var targetOrbit = targetOrbitPosition.orbit();
        final var mu = sun.getStandardGravitationalParameter();

        if (options.strategy() == HeliocentricStrategy.HOHMANN) {
            final var transfer = HohmannTransferOrbit.calculateBurn(
                    mu, currentPlanetOrbit.semiMajorAxis(), targetOrbit.semiMajorAxis());
            return Optional.of(new HeliocentricLeg(
                    HohmannTransferOrbit.timeToAlignment(currentPlanetOrbitPosition, targetOrbitPosition),
                    transfer.coastTime(),
                    FastMath.abs(transfer.firstBurn()),
                    List.of()));
        }

        final var hohmannCoastTime = roundToDays(HohmannTransferOrbit.calculateBurn(
                mu, currentPlanetOrbit.semiMajorAxis(), targetOrbit.semiMajorAxis()).coastTime());
        final var synodicPeriod = OrbitFormulas.synodicPeriod(currentPlanetOrbit.period(), targetOrbit.period());

        final var searchSpace = new InterceptSearchSpace(
                0.0,
                roundToDays(synodicPeriod) * options.maxLaunchRatio(),
                hohmannCoastTime * options.minCoastRatio(),
                hohmannCoastTime * options.maxCoastRatio(),
                options.heliocentricStep(),
                null,
                true,
                InterceptSearchSpace.DEFAULT_IMPACT_CHECK_DELTA_TIME,
                InterceptSearchSpace.DEFAULT_MAX_IMPACT_CHECK_TIME);
        return InterceptManeuver.search(
                        context,
                        sun.getState(),
                        currentPlanet.getState(),
                        currentPlanetOrbit,
                        target.getState(),
                        targetOrbit,
                        searchSpace,
                        observer)
                .map(result -> new HeliocentricLeg(
                        result.best().launchTime(),
                        result.best().duration(),
                        result.best().deltaV(),
                        result.possibleLaunches()));
    }

    InjectionBurn injectionBurn(final HeliocentricLeg leg) {
        final var planetMu = currentPlanet.getStandardGravitationalParameter();
        final var state = craft.getState();
        final var planetState = currentPlanet.getState();

        final var r0 = state.distance(planetState);
        final var orbitalSpeed = state.velocity().distance(planetState.velocity());
        final var v0 = FastMath.sqrt(leg.transferSpeed() * leg.transferSpeed() + 2.0 * planetMu / r0);
        final var injectionDeltaV = v0 - orbitalSpeed;

        final var burnTime = injectionBurnTime(leg.departureTime(), r0, v0);
        final var burn = SolverHelpers.afterTime(
                context.keplerSolver(), craft, state, craftOrbitPosition.orbit(), burnTime);
        final var prograde = burn.state().makeRelative(burn.primaryBodyState()).prograde();
        return new InjectionBurn(
                burnTime, prograde.scalarMultiply(injectionDeltaV), burn.state(), burn.primaryBodyState());
    }

    /**
     * Shifts the departure time so that the escape asymptote points along (or against, when
     * moving inwards) the planet's heliocentric velocity.
     */
    private double injectionBurnTime(final double alignmentTime, final double r0, final double v0) {
        final var planetMu = currentPlanet.getStandardGravitationalParameter();
        final var energy = 0.5 * v0 * v0 - planetMu / r0;
        final var h = r0 * v0;
        final var e = FastMath.sqrt(1.0 + 2.0 * energy * h * h / (planetMu * planetMu));
        // the periapsis of the escape hyperbola trails the asymptote by its true anomaly
        final var requiredAngle = TWO_PI - FastMath.acos(-1.0 / e);

        final var transferDirection = targetOrbitPosition.orbit().semiMajorAxis() < currentPlanetOrbitPosition.orbit().semiMajorAxis()
                ? -1.0
                : 1.0;

        final var aligned = SolverHelpers.afterTime(
                context.keplerSolver(), craft, craft.getState(), craftOrbitPosition.orbit(), alignmentTime);
        final var relative = aligned.state().makeRelative(aligned.primaryBodyState());
        final var planetVelocity = aligned.primaryBodyState().velocity().subtract(sun.getState().velocity());
        final var currentAngle = OrbitHelpers.angleAbout(
                relative.normal(), planetVelocity.scalarMultiply(transferDirection), relative.position());

        final var w = FastMath.sqrt(planetMu / (r0 * r0 * r0));
        var time = alignmentTime + MathUtils.normalizeAngle(requiredAngle - currentAngle, 0.0) / w;
        if (time < 0.0) {
            time += TWO_PI / w;
        }
        return time;
    }

    Optional<SoiExit> soiExit(final InjectionBurn injection) {
        final var solver = context.keplerSolver();
        final var injectionState = injection.burnState().addVelocity(injection.deltaVelocity());
        final var injectionOrbitPosition = OrbitPosition
                .fromState(currentPlanet, injection.primaryBodyState(), injectionState)
                .withTrueAnomaly(0.0);

        final var timeToLeave = OrbitCalculators.timeToLeaveSphereOfInfluence(injectionOrbitPosition);
        if (timeToLeave.isEmpty()) {
            return Optional.empty();
        }
        final var t = timeToLeave.getAsDouble();

        final var planetAtExit = SolverHelpers.afterTime(
                solver, currentPlanet, injection.primaryBodyState(), currentPlanetOrbitPosition.orbit(), t).state();
        final var stateAtExit = solver.solve(
                injection.primaryBodyState(), injectionState, injectionOrbitPosition.orbit(), planetAtExit, t);
        final var sunState = sun.getState();

        final var targetAtExit = SolverHelpers.afterTime(solver, target, injection.burnTime() + t).state();
        return Optional.of(new SoiExit(
                t,
                stateAtExit,
                OrbitPosition.fromState(sun, sunState, stateAtExit),
                targetAtExit,
                OrbitPosition.fromState(sun, sunState, targetAtExit)));
    }

    Optional<MidcourseCorrection> midcourseCorrection(final HeliocentricLeg leg, final SoiExit soiExit) {
        final var coastTime = roundToDays(leg.coastTime());
        final var searchSpace = InterceptSearchSpace.of(
                        0.0,
                        coastTime * options.midcourseMaxLaunchRatio(),
                        coastTime * options.midcourseMinCoastRatio(),
                        coastTime * options.midcourseMaxCoastRatio(),
                        options.midcourseStep())
                .withAllowedDeltaV(options.allowedMidcourseDeltaV());

        return InterceptManeuver.search(
                        context,
                        sun.getState(),
                        soiExit.state(),
                        soiExit.orbitPosition().orbit(),
                        soiExit.targetState(),
                        soiExit.targetOrbitPosition().orbit(),
                        searchSpace,
                        ManeuverObserver.NONE)
                .map(result -> new MidcourseCorrection(
                        result.best().launchTime(), result.best().deltaVelocity(), result.best().duration()));
    }

    private PlanetaryTransferPlan assemble(final HeliocentricLeg leg,
                                           final InjectionBurn injection,
                                           final SoiExit soiExit,
                                           final MidcourseCorrection midcourse) {
        final var injectionBurnTime = context.currentTime() + injection.burnTime();
        final var maneuvers = OrbitalManeuvers.sequence(
                new OrbitalManeuver(injectionBurnTime, injection.deltaVelocity()),
                new OrbitalManeuver(injectionBurnTime + soiExit.timeToLeave() + midcourse.burnTime(), midcourse.deltaVelocity()));
        return new PlanetaryTransferPlan(maneuvers, leg, injection, soiExit, midcourse);
    }

    private static long elapsedMillis(final long start) {
        return (System.nanoTime() - start) / 1_000_000L;
    }
}
