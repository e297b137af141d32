package io.github.jakubt4.astrolabe.controller;

import io.github.jakubt4.astrolabe.error.GeometricInfeasibilityException;
import io.github.jakubt4.astrolabe.error.NumericNonConvergenceException;
import io.github.jakubt4.astrolabe.orbit.Orbit;
import io.github.jakubt4.astrolabe.orbit.OrbitPosition;
import io.github.jakubt4.astrolabe.physics.Body;
import io.github.jakubt4.astrolabe.physics.ObjectConfig;
import io.github.jakubt4.astrolabe.physics.ObjectState;
import io.github.jakubt4.astrolabe.service.ManeuverPlanningService;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(OrbitController.class)
class OrbitControllerTest {

    private static final double MU = 3.986e14;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ManeuverPlanningService maneuverPlanningService;

    @Test
    void elementsReturnsOrbitForValidState() throws Exception {
        final var primary = Body.reference("primary", ObjectConfig.ofGravitationalParameter(MU, 0.0), 0.0);
        final var position = new OrbitPosition(Orbit.fromSemiMajorAxis(primary, 1.0e7, 0.2, 0.3, 1.0, 2.0), 0.5);
        when(maneuverPlanningService.elements(eq(MU), any(Vector3D.class), any(Vector3D.class))).thenReturn(position);

        mockMvc.perform(post("/api/orbit/elements")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "mu": %s,
                                    "position": [7000000.0, 0.0, 0.0],
                                    "velocity": [0.0, 8000.0, 0.0]
                                }
                                """.formatted(MU)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"))
                .andExpect(jsonPath("$.type").value("ELLIPTICAL"))
                .andExpect(jsonPath("$.eccentricity").value(0.2))
                .andExpect(jsonPath("$.inclination").value(0.3))
                .andExpect(jsonPath("$.trueAnomaly").value(0.5));

        verify(maneuverPlanningService).elements(MU, new Vector3D(7.0e6, 0.0, 0.0), new Vector3D(0.0, 8000.0, 0.0));
    }

    @Test
    void elementsRejectsNonPositiveMu() throws Exception {
        mockMvc.perform(post("/api/orbit/elements")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "mu": 0.0,
                                    "position": [7000000.0, 0.0, 0.0],
                                    "velocity": [0.0, 8000.0, 0.0]
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.message").value(containsString("Gravitational parameter")));

        verifyNoInteractions(maneuverPlanningService);
    }

    @Test
    void elementsRejectsMalformedVectors() throws Exception {
        mockMvc.perform(post("/api/orbit/elements")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "mu": 3.986e14,
                                    "position": [7000000.0, 0.0],
                                    "velocity": [0.0, 8000.0, 0.0]
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.message").value(containsString("three components")));
    }

    @Test
    void elementsRejectsPositionAtPrimary() throws Exception {
        mockMvc.perform(post("/api/orbit/elements")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "mu": 3.986e14,
                                    "position": [0.0, 0.0, 0.0],
                                    "velocity": [0.0, 8000.0, 0.0]
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"));

        verifyNoInteractions(maneuverPlanningService);
    }

    @Test
    void elementsReportsDegenerateStateAsInfeasible() throws Exception {
        when(maneuverPlanningService.elements(anyDouble(), any(Vector3D.class), any(Vector3D.class)))
                .thenThrow(new GeometricInfeasibilityException("Rectilinear motion has no orbit plane"));

        mockMvc.perform(post("/api/orbit/elements")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "mu": 3.986e14,
                                    "position": [7000000.0, 0.0, 0.0],
                                    "velocity": [1000.0, 0.0, 0.0]
                                }
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value("INFEASIBLE"))
                .andExpect(jsonPath("$.message").value(containsString("Rectilinear")));
    }

    @Test
    void propagateReturnsState() throws Exception {
        when(maneuverPlanningService.propagate(eq(MU), any(Vector3D.class), any(Vector3D.class), eq(600.0)))
                .thenReturn(new ObjectState(600.0, new Vector3D(1.0, 2.0, 3.0), new Vector3D(4.0, 5.0, 6.0)));

        mockMvc.perform(post("/api/orbit/propagate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "mu": %s,
                                    "position": [7000000.0, 0.0, 0.0],
                                    "velocity": [0.0, 7546.0, 0.0],
                                    "time": 600.0
                                }
                                """.formatted(MU)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"))
                .andExpect(jsonPath("$.position[2]").value(3.0))
                .andExpect(jsonPath("$.velocity[0]").value(4.0));
    }

    @Test
    void propagateRequiresTime() throws Exception {
        mockMvc.perform(post("/api/orbit/propagate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "mu": 3.986e14,
                                    "position": [7000000.0, 0.0, 0.0],
                                    "velocity": [0.0, 7546.0, 0.0]
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.message").value(containsString("time")));

        verifyNoInteractions(maneuverPlanningService);
    }

    @Test
    void propagateReportsNonConvergenceAsInfeasible() throws Exception {
        when(maneuverPlanningService.propagate(anyDouble(), any(Vector3D.class), any(Vector3D.class), anyDouble()))
                .thenThrow(new NumericNonConvergenceException("Kepler solver did not converge", 1000));

        mockMvc.perform(post("/api/orbit/propagate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "mu": 3.986e14,
                                    "position": [7000000.0, 0.0, 0.0],
                                    "velocity": [0.0, 7546.0, 0.0],
                                    "time": 1.0e12
                                }
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.status").value("INFEASIBLE"));
    }

    @Test
    void propagateReportsInvalidInputAsRejected() throws Exception {
        when(maneuverPlanningService.propagate(anyDouble(), any(Vector3D.class), any(Vector3D.class), anyDouble()))
                .thenThrow(new IllegalArgumentException("Zero velocity"));

        mockMvc.perform(post("/api/orbit/propagate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "mu": 3.986e14,
                                    "position": [7000000.0, 0.0, 0.0],
                                    "velocity": [0.0, 0.0, 0.0],
                                    "time": 60.0
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.message").value("Zero velocity"));
    }
}
