package com.switchboard.core.engine;

import com.switchboard.core.classify.ComplexityClassifier;
import com.switchboard.core.classify.TaskClassifier;
import com.switchboard.core.logging.MdcContext;
import com.switchboard.core.metrics.RoutingMetrics;
import com.switchboard.core.model.ChatRequest;
import com.switchboard.core.model.ComplexityAnalysis;
import com.switchboard.core.model.RoutingDecision;
import com.switchboard.core.model.TaskCategory;
import com.switchboard.core.routing.RoutingEngine;
import com.switchboard.core.stream.StreamEvent;
import com.switchboard.core.stream.StreamNormalizer;
import com.switchboard.core.stream.UpstreamEvent;
import com.switchboard.sandbox.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Runs one request through the whole pipeline: complexity classification,
 * then either task classification and model routing (fast path) or the
 * sandbox agent (agent path), then stream normalization.
 * <p>
 * Nothing happens until the returned flux is subscribed. Classification runs
 * on a bounded-elastic worker; cancelling the subscription interrupts it and
 * tears down any backend call in flight.
 */
@Service
public class GatewayEngine {

    private static final Logger log = LoggerFactory.getLogger(GatewayEngine.class);

    private final ComplexityClassifier complexityClassifier;
    private final TaskClassifier taskClassifier;
    private final RoutingEngine routingEngine;
    private final StreamNormalizer normalizer;
    private final RoutingMetrics metrics;
    private final SandboxProperties sandboxProperties;

    public GatewayEngine(ComplexityClassifier complexityClassifier, TaskClassifier taskClassifier,
                         RoutingEngine routingEngine, StreamNormalizer normalizer,
                         RoutingMetrics metrics, SandboxProperties sandboxProperties) {
        this.complexityClassifier = complexityClassifier;
        this.taskClassifier = taskClassifier;
        this.routingEngine = routingEngine;
        this.normalizer = normalizer;
        this.metrics = metrics;
        this.sandboxProperties = sandboxProperties;
    }

    public static String newRequestId() {
        return "req-" + UUID.randomUUID().toString().substring(0, 12);
    }

    public Flux<StreamEvent> stream(ChatRequest request) {
        return stream(newRequestId(), request);
    }

    public Flux<StreamEvent> stream(String requestId, ChatRequest request) {
        Flux<UpstreamEvent> upstream = Mono
                .fromCallable(() -> plan(requestId, request))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(plan -> routingEngine.execute(plan.decision(), request));
        return normalize(requestId, upstream);
    }

    /**
     * Executes a plan produced earlier by {@link #plan}, without classifying
     * the request again.
     */
    public Flux<StreamEvent> execute(RequestPlan plan, ChatRequest request) {
        return normalize(plan.requestId(), Flux.defer(() -> routingEngine.execute(plan.decision(), request)));
    }

    private Flux<StreamEvent> normalize(String requestId, Flux<UpstreamEvent> upstream) {
        return normalizer.normalize(upstream)
                .doOnCancel(() -> log.info("[{}] Caller went away, pipeline cancelled", requestId));
    }

    /**
     * Streams the request and folds the events into one result.
     */
    public Mono<CompletionResult> complete(String requestId, ChatRequest request) {
        return stream(requestId, request)
                .collectList()
                .map(GatewayEngine::fold);
    }

    /**
     * Classifies the request and plans its candidate chain without calling any backend.
     */
    public RequestPlan plan(String requestId, ChatRequest request) {
        long start = System.nanoTime();
        MdcContext.setRequest(requestId);
        try {
            ComplexityAnalysis complexity = complexityClassifier.classify(request);
            MdcContext.setPath(requestId, complexity.needsAgent());
            metrics.recordRequest(complexity.needsAgent());

            TaskClassifier.Result task = null;
            RoutingDecision decision;
            if (complexity.needsAgent()) {
                decision = new RoutingDecision(TaskCategory.GENERAL_TEXT, 1.0, request.hasImages(),
                        sandboxProperties.toModelSpec(request.hasImages()), List.of());
            } else {
                task = taskClassifier.classifyTask(request);
                metrics.recordTaskCategory(task.category());
                boolean requiresVision = request.hasImages() || task.category() == TaskCategory.VISION;
                decision = routingEngine.plan(task.category(), task.confidence(), requiresVision);
            }
            MdcContext.setModel(requestId, decision.primary().id());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordClassificationTime(elapsed);
            log.info("Planned {} path -> {} in {}ms", complexity.needsAgent() ? "agent" : "fast",
                    decision.primary().id(), elapsed.toMillis());
            return new RequestPlan(requestId, complexity, task, decision);
        } finally {
            MdcContext.clear();
        }
    }

    static CompletionResult fold(List<StreamEvent> events) {
        var content = new StringBuilder();
        var reasoning = new StringBuilder();
        String finishReason = null;
        StreamEvent.Error error = null;
        for (StreamEvent event : events) {
            if (event instanceof StreamEvent.ContentDelta delta) {
                content.append(delta.text());
            } else if (event instanceof StreamEvent.ReasoningDelta delta) {
                reasoning.append(delta.text());
            } else if (event instanceof StreamEvent.Done done) {
                finishReason = done.finishReason();
            } else if (event instanceof StreamEvent.Error failure) {
                error = failure;
            }
        }
        return new CompletionResult(content.toString(), reasoning.toString(), finishReason, error);
    }
}
