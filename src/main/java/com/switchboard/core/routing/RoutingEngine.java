package com.switchboard.core.routing;

import com.switchboard.core.backend.BackendRegistry;
import com.switchboard.core.backend.ModelBackend;
import com.switchboard.core.metrics.RoutingMetrics;
import com.switchboard.core.model.AttemptOutcome;
import com.switchboard.core.model.ChatRequest;
import com.switchboard.core.model.ModelSpec;
import com.switchboard.core.model.RoutingAttempt;
import com.switchboard.core.model.RoutingDecision;
import com.switchboard.core.model.TaskCategory;
import com.switchboard.core.registry.ModelRegistry;
import com.switchboard.core.stream.UpstreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Plans a candidate chain for a classified request and walks it until one
 * candidate starts streaming.
 * <p>
 * A candidate that fails before its first event is recorded and the next one
 * is tried with a fresh timeout. Once a candidate has emitted anything the
 * decision is settled and later failures pass through unchanged; streamed
 * work is never restarted on another model.
 */
@Service
public class RoutingEngine {

    private static final Logger log = LoggerFactory.getLogger(RoutingEngine.class);

    private final ModelRegistry registry;
    private final BackendRegistry backends;
    private final RoutingMetrics metrics;

    public RoutingEngine(ModelRegistry registry, BackendRegistry backends, RoutingMetrics metrics) {
        this.registry = registry;
        this.backends = backends;
        this.metrics = metrics;
    }

    public RoutingDecision plan(TaskCategory category, double confidence, boolean requiresVision) {
        ModelSpec primary = registry.getModelForTask(category, requiresVision);
        List<ModelSpec> fallbacks = registry.getFallbackModels(primary.id(), requiresVision);
        var decision = new RoutingDecision(category, confidence, requiresVision, primary, fallbacks);
        log.info("Routing {} (confidence {}) -> {}", category.wireName(), confidence, decision);
        return decision;
    }

    /**
     * Runs the decision's candidates in order. The returned flux fails with
     * {@link ChainExhaustedException} when no candidate could start.
     */
    public Flux<UpstreamEvent> execute(RoutingDecision decision, ChatRequest request) {
        return attempt(decision, request, decision.candidates(), 0, null);
    }

    private Flux<UpstreamEvent> attempt(RoutingDecision decision, ChatRequest request,
                                        List<ModelSpec> candidates, int index, UpstreamException lastFailure) {
        if (index >= candidates.size()) {
            var exhausted = new ChainExhaustedException(lastFailure, decision.attempts());
            log.error("Fallback chain exhausted for {}: {}", decision, exhausted.getMessage());
            return Flux.error(exhausted);
        }
        ModelSpec candidate = candidates.get(index);
        return Flux.defer(() -> {
            long start = System.nanoTime();
            var started = new AtomicBoolean(false);
            return invoke(candidate, request)
                    .timeout(candidate.callTimeout())
                    .doOnNext(event -> {
                        if (started.compareAndSet(false, true)) {
                            decision.recordAttempt(new RoutingAttempt(
                                    candidate, AttemptOutcome.SUCCESS, null, elapsedSince(start)));
                            metrics.recordModelUsed(candidate.id());
                            log.debug("{} started streaming after {}ms", candidate.id(), elapsedSince(start).toMillis());
                        }
                    })
                    .doOnComplete(() -> {
                        if (started.compareAndSet(false, true)) {
                            // an empty but clean completion still counts as served
                            decision.recordAttempt(new RoutingAttempt(
                                    candidate, AttemptOutcome.SUCCESS, null, elapsedSince(start)));
                            metrics.recordModelUsed(candidate.id());
                        }
                    })
                    .onErrorResume(error -> {
                        if (started.get()) {
                            return Flux.error(error);
                        }
                        started.set(true);
                        UpstreamException failure = UpstreamException.classify(candidate.id(), error);
                        AttemptOutcome outcome = failure.isTransient()
                                ? AttemptOutcome.TRANSIENT_FAILURE
                                : AttemptOutcome.NON_TRANSIENT_FAILURE;
                        decision.recordAttempt(new RoutingAttempt(
                                candidate, outcome, failure.getMessage(), elapsedSince(start)));
                        metrics.recordError(candidate.id(), failure.kind().label());
                        boolean hasNext = index + 1 < candidates.size();
                        if (failure.isTransient()) {
                            log.warn("{} failed ({}): {}{}", candidate.id(), failure.kind().label(),
                                    failure.getMessage(), hasNext ? ", falling back" : "");
                        } else {
                            log.error("{} rejected the request ({}): {}{}", candidate.id(), failure.kind().label(),
                                    failure.getMessage(), hasNext ? ", trying next candidate" : "");
                        }
                        if (hasNext) {
                            metrics.recordFallback();
                        }
                        return attempt(decision, request, candidates, index + 1, failure);
                    });
        });
    }

    private Flux<UpstreamEvent> invoke(ModelSpec candidate, ChatRequest request) {
        ModelBackend backend = backends.forModel(candidate).orElse(null);
        if (backend == null) {
            return Flux.error(new UpstreamException(UpstreamException.Kind.REQUEST_REJECTED, candidate.id(), 0,
                    "No backend registered for kind '" + candidate.backend() + "'"));
        }
        if (request.hasImages() && !backend.supportsVision()) {
            return Flux.error(new UpstreamException(UpstreamException.Kind.REQUEST_REJECTED, candidate.id(), 0,
                    "Backend '" + backend.kind() + "' cannot accept image input"));
        }
        try {
            return backend.invoke(candidate, request);
        } catch (RuntimeException e) {
            return Flux.error(e);
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
