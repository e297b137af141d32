package io.github.jakubt4.astrolabe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Astrolabe: two-body astrodynamics engine and maneuver planner.
 *
 * <p>The engine ({@code physics}, {@code orbit}, {@code solver}, {@code maneuver}) is plain Java.
 * This application wires the solvers from configuration and exposes orbit conversion,
 * propagation and Hohmann planning over HTTP.
 *
 * @see io.github.jakubt4.astrolabe.service.ManeuverPlanningService
 */
@SpringBootApplication
public class AstrolabeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AstrolabeApplication.class, args);
    }
}
