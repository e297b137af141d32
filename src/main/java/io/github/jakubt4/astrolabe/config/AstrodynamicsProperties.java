package io.github.jakubt4.astrolabe.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Solver and search settings bound from {@code astrolabe.*}.
 *
 * @param kepler Kepler propagation solver
 * @param gauss  Lambert solver
 * @param search grid searches
 */
@ConfigurationProperties(prefix = "astrolabe")
public record AstrodynamicsProperties(@DefaultValue Solver kepler,
                                      @DefaultValue Solver gauss,
                                      @DefaultValue Search search) {

    /**
     * @param maxIterations iteration budget per solve
     * @param tolerance     convergence tolerance
     */
    public record Solver(@DefaultValue("1000") int maxIterations,
                         @DefaultValue("1e-6") double tolerance) {
    }

    /**
     * @param parallelism          worker threads; 0 uses one per available processor
     * @param impactCheckDeltaTime sampling step of the re-impact check for surface launches, seconds
     * @param maxImpactCheckTime   look-ahead window of the re-impact check, seconds
     */
    public record Search(@DefaultValue("0") int parallelism,
                         @DefaultValue("100") double impactCheckDeltaTime,
                         @DefaultValue("1000") double maxImpactCheckTime) {

        public int effectiveParallelism() {
            return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
        }
    }
}
