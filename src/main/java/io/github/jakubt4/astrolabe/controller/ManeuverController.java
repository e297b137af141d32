package io.github.jakubt4.astrolabe.controller;

import io.github.jakubt4.astrolabe.dto.HohmannRequest;
import io.github.jakubt4.astrolabe.dto.HohmannResponse;
import io.github.jakubt4.astrolabe.maneuver.HohmannTransferOrbit;
import io.github.jakubt4.astrolabe.service.ManeuverPlanningService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for closed-form maneuver planning.
 */
@Slf4j
@RestController
@RequestMapping("/api/maneuver")
@RequiredArgsConstructor
public class ManeuverController {

    private final ManeuverPlanningService maneuverPlanningService;

    /**
     * Burns and coast time of a Hohmann transfer between two circular radii.
     *
     * @return {@code 200 OK} with the transfer, {@code 400 Bad Request} on invalid input
     */
    @PostMapping("/hohmann")
    public ResponseEntity<HohmannResponse> hohmann(@RequestBody final HohmannRequest request) {
        if (request.mu() == null || request.currentRadius() == null || request.newRadius() == null) {
            return ResponseEntity.badRequest()
                    .body(HohmannResponse.rejected(OrbitController.REJECTED, "mu, currentRadius and newRadius are required"));
        }

        try {
            final var transfer = maneuverPlanningService.hohmann(request.mu(), request.currentRadius(), request.newRadius());
            log.info("Hohmann {} -> {} m: Δv1={} m/s, Δv2={} m/s, coast={} s",
                    request.currentRadius(), request.newRadius(),
                    transfer.firstBurn(), transfer.secondBurn(), transfer.coastTime());
            return ResponseEntity.ok(new HohmannResponse(
                    "OK",
                    "Transfer computed",
                    transfer.firstBurn(),
                    transfer.secondBurn(),
                    transfer.coastTime(),
                    HohmannTransferOrbit.alignmentAngle(request.currentRadius(), request.newRadius())));
        } catch (final IllegalArgumentException e) {
            log.error("Rejected Hohmann request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(HohmannResponse.rejected(OrbitController.REJECTED, e.getMessage()));
        }
    }
}
