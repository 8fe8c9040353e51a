package com.familycalendar.dispatch.api;

import com.familycalendar.core.health.HealthCheckService;
import com.familycalendar.core.health.HealthStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for server health.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health. 200 unless a component is DOWN, then 503.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        boolean anyDown = false;
        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthStatus check : healthCheckService.checkAll()) {
            Map<String, Object> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                componentInfo.put("metadata", check.metadata());
            }
            components.put(check.component(), componentInfo);

            if (check.status() == HealthStatus.Status.DOWN) {
                anyDown = true;
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", anyDown ? "DOWN" : "UP");
        result.put("components", components);

        return anyDown ? ResponseEntity.status(503).body(result)
                       : ResponseEntity.ok(result);
    }
}
