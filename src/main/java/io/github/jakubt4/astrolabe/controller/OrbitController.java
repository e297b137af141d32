package io.github.jakubt4.astrolabe.controller;

import io.github.jakubt4.astrolabe.dto.OrbitElementsResponse;
import io.github.jakubt4.astrolabe.dto.StateVectorRequest;
import io.github.jakubt4.astrolabe.dto.StateVectorResponse;
import io.github.jakubt4.astrolabe.error.AstrodynamicsException;
import io.github.jakubt4.astrolabe.service.ManeuverPlanningService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for state-vector conversion and propagation.
 *
 * <p>States are relative to a point-mass primary given by its gravitational parameter.
 */
@Slf4j
@RestController
@RequestMapping("/api/orbit")
@RequiredArgsConstructor
public class OrbitController {

    static final String REJECTED = "REJECTED";
    static final String INFEASIBLE = "INFEASIBLE";

    private final ManeuverPlanningService maneuverPlanningService;

    /**
     * @return {@code 200 OK} with the elements, {@code 400 Bad Request} on invalid input,
     *         {@code 422 Unprocessable Entity} if the state has no orbit
     */
    @PostMapping("/elements")
    public ResponseEntity<OrbitElementsResponse> elements(@RequestBody final StateVectorRequest request) {
        final var error = validate(request);
        if (error != null) {
            return ResponseEntity.badRequest().body(OrbitElementsResponse.rejected(REJECTED, error));
        }

        try {
            final var orbitPosition = maneuverPlanningService.elements(
                    request.mu(), new Vector3D(request.position()), new Vector3D(request.velocity()));
            log.info("Elements computed: {}", orbitPosition);
            return ResponseEntity.ok(OrbitElementsResponse.of(orbitPosition));
        } catch (final AstrodynamicsException e) {
            log.warn("No elements for state: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(OrbitElementsResponse.rejected(INFEASIBLE, e.getMessage()));
        } catch (final IllegalArgumentException e) {
            log.error("Invalid state: {}", e.getMessage());
            return ResponseEntity.badRequest().body(OrbitElementsResponse.rejected(REJECTED, e.getMessage()));
        }
    }

    /**
     * @return {@code 200 OK} with the propagated state, {@code 400 Bad Request} on invalid input,
     *         {@code 422 Unprocessable Entity} if the solver does not converge
     */
    @PostMapping("/propagate")
    public ResponseEntity<StateVectorResponse> propagate(@RequestBody final StateVectorRequest request) {
        var error = validate(request);
        if (error == null && (request.time() == null || !Double.isFinite(request.time()))) {
            error = "Propagation time is required";
        }
        if (error != null) {
            return ResponseEntity.badRequest().body(StateVectorResponse.rejected(REJECTED, error));
        }

        try {
            final var state = maneuverPlanningService.propagate(
                    request.mu(), new Vector3D(request.position()), new Vector3D(request.velocity()), request.time());
            return ResponseEntity.ok(StateVectorResponse.of(state));
        } catch (final AstrodynamicsException e) {
            log.warn("Propagation by {} s failed: {}", request.time(), e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(StateVectorResponse.rejected(INFEASIBLE, e.getMessage()));
        } catch (final IllegalArgumentException e) {
            log.error("Invalid state: {}", e.getMessage());
            return ResponseEntity.badRequest().body(StateVectorResponse.rejected(REJECTED, e.getMessage()));
        }
    }

    private static String validate(final StateVectorRequest request) {
        if (request.mu() == null || !(request.mu() > 0.0)) {
            return "Gravitational parameter must be positive";
        }
        if (request.position() == null || request.position().length != 3
                || request.velocity() == null || request.velocity().length != 3) {
            return "Position and velocity must have three components";
        }
        if (new Vector3D(request.position()).getNorm() == 0.0) {
            return "Position must not coincide with the primary";
        }
        return null;
    }
}
