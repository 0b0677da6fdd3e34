package com.switchboard.dispatch.api;

import com.switchboard.core.health.HealthCheckService;
import com.switchboard.core.health.HealthStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway health as JSON: the worst component status plus one entry per component.
 */
@RestController
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /health. Answers 503 only when a component is DOWN.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        List<HealthStatus> checks = healthCheckService.checkAll();
        HealthStatus.Status overall = HealthStatus.Status.UP;
        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthStatus check : checks) {
            if (check.status().compareTo(overall) > 0) {
                overall = check.status();
            }
            components.put(check.component(), describe(check));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", overall.name());
        body.put("components", components);
        boolean serving = checks.stream().allMatch(HealthStatus::serving);
        return ResponseEntity.status(serving ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private static Map<String, Object> describe(HealthStatus check) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("status", check.status().name());
        entry.put("detail", check.detail());
        if (!check.metadata().isEmpty()) {
            entry.put("metadata", check.metadata());
        }
        return entry;
    }
}
