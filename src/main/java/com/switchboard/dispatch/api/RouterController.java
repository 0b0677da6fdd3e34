package com.switchboard.dispatch.api;

import com.switchboard.core.metrics.RoutingMetrics;
import com.switchboard.core.model.ModelSpec;
import com.switchboard.core.model.TaskCategory;
import com.switchboard.core.registry.ModelRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Model catalogue and routing counters.
 */
@RestController
public class RouterController {

    private final ModelRegistry modelRegistry;
    private final RoutingMetrics metrics;

    public RouterController(ModelRegistry modelRegistry, RoutingMetrics metrics) {
        this.modelRegistry = modelRegistry;
        this.metrics = metrics;
    }

    /**
     * GET /v1/models: registry contents in OpenAI list format, priority order.
     */
    @GetMapping("/v1/models")
    public ResponseEntity<Map<String, Object>> models() {
        List<Map<String, Object>> data = new ArrayList<>();
        for (ModelSpec model : modelRegistry.models()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", model.id());
            entry.put("object", "model");
            entry.put("owned_by", "switchboard");
            entry.put("display_name", model.displayName());
            entry.put("task_categories", model.taskCategories().stream()
                    .map(TaskCategory::wireName).sorted().toList());
            entry.put("priority", model.priority());
            entry.put("supports_vision", model.supportsVision());
            entry.put("max_output_tokens", model.maxOutputTokens());
            data.add(entry);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("object", "list");
        body.put("data", data);
        return ResponseEntity.ok(body);
    }

    /**
     * GET /v1/router/metrics
     */
    @GetMapping("/v1/router/metrics")
    public ResponseEntity<Map<String, Object>> routerMetrics() {
        RoutingMetrics.Snapshot snapshot = metrics.snapshot();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("total_requests", snapshot.totalRequests());
        body.put("requests_by_path", snapshot.requestsByPath());
        body.put("requests_by_task_category", snapshot.requestsByCategory());
        body.put("requests_by_model", snapshot.requestsByModel());
        body.put("fallback_count", snapshot.fallbackCount());
        body.put("fallback_rate", snapshot.fallbackRate());
        body.put("errors_by_model", snapshot.errorsByModel());
        body.put("avg_classification_time_ms", snapshot.avgClassificationTimeMs());
        return ResponseEntity.ok(body);
    }
}
