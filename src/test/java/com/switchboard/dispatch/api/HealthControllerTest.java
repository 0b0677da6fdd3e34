package com.switchboard.dispatch.api;

import com.switchboard.core.health.HealthCheckService;
import com.switchboard.core.health.HealthStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class HealthControllerTest {

    private HealthCheckService healthCheckService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        healthCheckService = mock(HealthCheckService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new HealthController(healthCheckService)).build();
    }

    @Test
    @DisplayName("degraded components still answer 200")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("registry", HealthStatus.Status.UP, "8 models loaded", Map.of()),
                new HealthStatus("sandbox", HealthStatus.Status.DEGRADED, "not configured", Map.of())));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.sandbox.status").value("DEGRADED"));
    }

    @Test
    @DisplayName("a DOWN component answers 503")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("registry", HealthStatus.Status.DOWN, "empty", Map.of())));

        mockMvc.perform(get("/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"));
    }
}
