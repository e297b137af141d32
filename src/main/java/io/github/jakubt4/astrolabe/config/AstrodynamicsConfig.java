package io.github.jakubt4.astrolabe.config;

import io.github.jakubt4.astrolabe.solver.GaussProblemSolver;
import io.github.jakubt4.astrolabe.solver.KeplerProblemSolver;
import io.github.jakubt4.astrolabe.solver.UniversalVariableGaussSolver;
import io.github.jakubt4.astrolabe.solver.UniversalVariableKeplerSolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the solvers and the shared grid-search executor.
 *
 * <p>Solvers are stateless, so one instance of each serves every request.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(AstrodynamicsProperties.class)
public class AstrodynamicsConfig {

    @Bean
    public KeplerProblemSolver keplerProblemSolver(final AstrodynamicsProperties properties) {
        final var kepler = properties.kepler();
        log.info("Kepler solver: maxIterations={}, tolerance={}", kepler.maxIterations(), kepler.tolerance());
        return new UniversalVariableKeplerSolver(kepler.maxIterations(), kepler.tolerance());
    }

    @Bean
    public GaussProblemSolver gaussProblemSolver(final AstrodynamicsProperties properties) {
        final var gauss = properties.gauss();
        log.info("Gauss solver: maxIterations={}, tolerance={}", gauss.maxIterations(), gauss.tolerance());
        return new UniversalVariableGaussSolver(gauss.maxIterations(), gauss.tolerance());
    }

    /**
     * Executor for the launch rows of intercept searches; shut down with the context.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService maneuverSearchExecutor(final AstrodynamicsProperties properties) {
        final var threads = properties.search().effectiveParallelism();
        log.info("Maneuver search executor with {} threads", threads);
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("maneuver-search-"));
    }
}
