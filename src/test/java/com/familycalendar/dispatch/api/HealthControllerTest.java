package com.familycalendar.dispatch.api;

import com.familycalendar.core.health.HealthCheckService;
import com.familycalendar.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("GET /health returns 200 when nothing is down")
    void healthUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("supervisor", HealthStatus.Status.DEGRADED, "No supervision pass running", Map.of()),
                new HealthStatus("permissions", HealthStatus.Status.UP, "Permission backend available",
                        Map.of("backend", "memory"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.supervisor.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.permissions.metadata.backend").value("memory"));
    }

    @Test
    @DisplayName("GET /health returns 503 when a component is down")
    void healthDown() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("permissions", HealthStatus.Status.DOWN, "Permission store unreachable",
                        Map.of("backend", "jdbc"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.permissions.detail").value("Permission store unreachable"));
    }
}
