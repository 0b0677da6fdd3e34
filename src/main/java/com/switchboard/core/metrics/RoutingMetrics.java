package com.switchboard.core.metrics;

import com.switchboard.core.model.TaskCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide Micrometer metrics for classification and routing.
 * <p>
 * Micrometer counters are atomic, so concurrent requests may record freely.
 * No per-request state is kept here.
 */
@Service
public class RoutingMetrics {

    static final String REQUESTS_TOTAL = "switchboard.router.requests.total";
    static final String REQUESTS_BY_PATH = "switchboard.router.requests.by_path";
    static final String REQUESTS_BY_CATEGORY = "switchboard.router.requests.by_category";
    static final String REQUESTS_BY_MODEL = "switchboard.router.requests.by_model";
    static final String FALLBACKS = "switchboard.router.fallbacks";
    static final String ERRORS = "switchboard.router.errors";
    static final String CLASSIFICATION_TIME = "switchboard.classification.duration";

    private final MeterRegistry registry;

    public RoutingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts one inbound request and the path it was classified onto.
     */
    public void recordRequest(boolean agentPath) {
        Counter.builder(REQUESTS_TOTAL)
                .description("Requests seen by the router")
                .register(registry)
                .increment();
        Counter.builder(REQUESTS_BY_PATH)
                .tag("path", agentPath ? "agent" : "fast")
                .register(registry)
                .increment();
    }

    public void recordTaskCategory(TaskCategory category) {
        Counter.builder(REQUESTS_BY_CATEGORY)
                .tag("category", category.wireName())
                .register(registry)
                .increment();
    }

    /**
     * Records the model that ended up serving a request.
     */
    public void recordModelUsed(String modelId) {
        Counter.builder(REQUESTS_BY_MODEL)
                .tag("model", modelId)
                .register(registry)
                .increment();
    }

    /**
     * Records one advance from a failed candidate to the next one.
     */
    public void recordFallback() {
        Counter.builder(FALLBACKS)
                .description("Advances along a fallback chain")
                .register(registry)
                .increment();
    }

    public void recordError(String modelId, String kind) {
        Counter.builder(ERRORS)
                .tag("model", modelId)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordClassificationTime(Duration elapsed) {
        Timer.builder(CLASSIFICATION_TIME)
                .description("Time spent deciding the path and task category")
                .register(registry)
                .record(elapsed);
    }

    public Snapshot snapshot() {
        long total = (long) sum(REQUESTS_TOTAL);
        long fallbacks = (long) sum(FALLBACKS);
        Timer timer = registry.find(CLASSIFICATION_TIME).timer();
        double meanMs = timer == null ? 0.0 : timer.mean(TimeUnit.MILLISECONDS);
        return new Snapshot(
                total,
                fallbacks,
                total == 0 ? 0.0 : (double) fallbacks / total,
                meanMs,
                countsByTag(REQUESTS_BY_PATH, "path"),
                countsByTag(REQUESTS_BY_CATEGORY, "category"),
                countsByTag(REQUESTS_BY_MODEL, "model"),
                countsByTag(ERRORS, "model"));
    }

    private double sum(String name) {
        return registry.find(name).counters().stream().mapToDouble(Counter::count).sum();
    }

    private Map<String, Long> countsByTag(String name, String tag) {
        var counts = new TreeMap<String, Long>();
        for (Counter counter : registry.find(name).counters()) {
            String key = counter.getId().getTag(tag);
            if (key != null) {
                counts.merge(key, (long) counter.count(), Long::sum);
            }
        }
        return counts;
    }

    /**
     * Point-in-time view of the routing counters.
     *
     * @param fallbackRate fallbacks per request, 0 when no requests were seen
     */
    public record Snapshot(
        long totalRequests,
        long fallbackCount,
        double fallbackRate,
        double avgClassificationTimeMs,
        Map<String, Long> requestsByPath,
        Map<String, Long> requestsByCategory,
        Map<String, Long> requestsByModel,
        Map<String, Long> errorsByModel
    ) {}
}
