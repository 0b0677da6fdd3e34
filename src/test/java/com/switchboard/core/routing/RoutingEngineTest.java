package com.switchboard.core.routing;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.switchboard.core.backend.BackendRegistry;
import com.switchboard.core.backend.ScriptedBackend;
import com.switchboard.core.metrics.RoutingMetrics;
import com.switchboard.core.model.AttemptOutcome;
import com.switchboard.core.model.ChatMessage;
import com.switchboard.core.model.ChatRequest;
import com.switchboard.core.model.ModelSpec;
import com.switchboard.core.model.RoutingDecision;
import com.switchboard.core.model.TaskCategory;
import com.switchboard.core.registry.DefaultModels;
import com.switchboard.core.registry.ModelRegistry;
import com.switchboard.core.stream.UpstreamEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RoutingEngineTest {

    private static final String FLASH = "zai-org/GLM-4.7-Flash";
    private static final String GLM = "zai-org/GLM-4.7-TEE";
    private static final String SPECIALE = "deepseek-ai/DeepSeek-V3.2-Speciale-TEE";
    private static final String MINIMAX = "MiniMaxAI/MiniMax-M2.1-TEE";

    private ScriptedBackend backend;
    private RoutingMetrics metrics;
    private RoutingEngine engine;
    private final ChatRequest request = ChatRequest.ofText("hello");

    @BeforeEach
    void setUp() {
        backend = new ScriptedBackend();
        metrics = new RoutingMetrics(new SimpleMeterRegistry());
        engine = new RoutingEngine(new ModelRegistry(DefaultModels.CATALOGUE),
                new BackendRegistry(List.of(backend)), metrics);
    }

    private static Flux<UpstreamEvent> status(String modelId, int code) {
        return Flux.error(new UpstreamException(UpstreamException.kindForStatus(code), modelId, code,
                "HTTP " + code));
    }

    private static UpstreamEvent chunk(String text) {
        var node = JsonNodeFactory.instance.objectNode();
        node.putArray("choices").addObject().putObject("delta").put("content", text);
        return UpstreamEvent.json(node);
    }

    @Nested
    @DisplayName("plan")
    class Plan {

        @Test
        @DisplayName("simple_text is planned onto the flash model with text fallbacks")
        void simpleText() {
            RoutingDecision decision = engine.plan(TaskCategory.SIMPLE_TEXT, 0.8, false);

            assertEquals(FLASH, decision.primary().id());
            assertEquals(3, decision.fallbackChain().size());
            assertFalse(decision.fallbackChain().stream().anyMatch(m -> m.supportsVision()));
        }

        @Test
        @DisplayName("vision requests plan only vision candidates")
        void vision() {
            RoutingDecision decision = engine.plan(TaskCategory.VISION, 1.0, true);

            assertTrue(decision.candidates().stream().allMatch(m -> m.supportsVision()));
        }
    }

    @Nested
    @DisplayName("execute")
    class Execute {

        @Test
        @DisplayName("primary success streams without fallback")
        void primarySuccess() {
            backend.on(FLASH, () -> Flux.just(chunk("4")));
            RoutingDecision decision = engine.plan(TaskCategory.SIMPLE_TEXT, 0.8, false);

            List<UpstreamEvent> events = engine.execute(decision, request).collectList().block(Duration.ofSeconds(5));

            assertEquals(1, events.size());
            assertEquals(List.of(FLASH), backend.invocations());
            assertEquals(1, decision.attempts().size());
            assertEquals(AttemptOutcome.SUCCESS, decision.attempts().get(0).outcome());
            assertEquals(0, metrics.snapshot().fallbackCount());
            assertEquals(1L, metrics.snapshot().requestsByModel().get(FLASH));
        }

        @Test
        @DisplayName("503 on the primary falls back to the next candidate")
        void fallbackOnServerError() {
            backend.on(FLASH, () -> status(FLASH, 503));
            backend.on(GLM, () -> Flux.just(chunk("Hello"), chunk("!")));
            RoutingDecision decision = engine.plan(TaskCategory.SIMPLE_TEXT, 0.8, false);

            List<UpstreamEvent> events = engine.execute(decision, request).collectList().block(Duration.ofSeconds(5));

            assertEquals(2, events.size());
            assertEquals(List.of(FLASH, GLM), backend.invocations());
            var attempts = decision.attempts();
            assertEquals(2, attempts.size());
            assertEquals(AttemptOutcome.TRANSIENT_FAILURE, attempts.get(0).outcome());
            assertEquals(AttemptOutcome.SUCCESS, attempts.get(1).outcome());
            assertTrue(decision.usedFallback());

            var snapshot = metrics.snapshot();
            assertEquals(1, snapshot.fallbackCount());
            assertEquals(1L, snapshot.errorsByModel().get(FLASH));
            assertEquals(1L, snapshot.requestsByModel().get(GLM));
            assertNull(snapshot.requestsByModel().get(FLASH));
        }

        @Test
        @DisplayName("non-transient rejection still advances to the next candidate")
        void nonTransientAdvances() {
            backend.on(FLASH, () -> status(FLASH, 400));
            backend.on(GLM, () -> Flux.just(chunk("ok")));
            RoutingDecision decision = engine.plan(TaskCategory.SIMPLE_TEXT, 0.8, false);

            engine.execute(decision, request).collectList().block(Duration.ofSeconds(5));

            assertEquals(AttemptOutcome.NON_TRANSIENT_FAILURE, decision.attempts().get(0).outcome());
            assertEquals(AttemptOutcome.SUCCESS, decision.attempts().get(1).outcome());
        }

        @Test
        @DisplayName("a silent candidate times out and the next one is tried")
        void timeoutAdvances() {
            var slow = new ModelSpec("slow", "slow",
                    Set.of(TaskCategory.GENERAL_TEXT), 1, 100, false,
                    Duration.ofMillis(100), 0.7, null);
            var next = new ModelSpec("next", "next",
                    Set.of(TaskCategory.GENERAL_TEXT), 2, 100, false,
                    Duration.ofSeconds(5), 0.7, null);
            engine = new RoutingEngine(new ModelRegistry(List.of(slow, next)),
                    new BackendRegistry(List.of(backend)), metrics);
            backend.on("slow", Flux::never);
            backend.on("next", () -> Flux.just(chunk("done")));
            RoutingDecision decision = engine.plan(TaskCategory.GENERAL_TEXT, 0.9, false);

            List<UpstreamEvent> events = engine.execute(decision, request).collectList().block(Duration.ofSeconds(5));

            assertEquals(1, events.size());
            assertEquals(AttemptOutcome.TRANSIENT_FAILURE, decision.attempts().get(0).outcome());
            assertEquals(1L, metrics.snapshot().errorsByModel().get("slow"));
        }

        @Test
        @DisplayName("exhausting every candidate fails with ChainExhaustedException")
        void chainExhausted() {
            for (String id : List.of(FLASH, GLM, SPECIALE, MINIMAX)) {
                backend.on(id, () -> status(id, 502));
            }
            RoutingDecision decision = engine.plan(TaskCategory.SIMPLE_TEXT, 0.8, false);

            var error = assertThrows(ChainExhaustedException.class,
                    () -> engine.execute(decision, request).collectList().block(Duration.ofSeconds(5)));

            assertEquals(4, error.attempts().size());
            assertEquals(MINIMAX, error.lastFailure().modelId());
            assertTrue(decision.isSettled());
            assertEquals(3, metrics.snapshot().fallbackCount());
        }

        @Test
        @DisplayName("failure after the first event is not retried on another model")
        void noRetryAfterStart() {
            backend.on(FLASH, () -> Flux.concat(Flux.just(chunk("partial")),
                    Flux.error(new UpstreamException(UpstreamException.Kind.SERVER_ERROR, FLASH, 500, "died"))));
            backend.on(GLM, () -> Flux.just(chunk("should not run")));
            RoutingDecision decision = engine.plan(TaskCategory.SIMPLE_TEXT, 0.8, false);

            var error = assertThrows(UpstreamException.class,
                    () -> engine.execute(decision, request).collectList().block(Duration.ofSeconds(5)));

            assertEquals("died", error.getMessage());
            assertEquals(List.of(FLASH), backend.invocations());
            assertEquals(0, metrics.snapshot().fallbackCount());
        }

        @Test
        @DisplayName("image requests skip backends without vision support")
        void visionUnsupportedBackend() {
            var textOnly = new ScriptedBackend(ModelSpec.DEFAULT_BACKEND, false);
            engine = new RoutingEngine(new ModelRegistry(DefaultModels.CATALOGUE),
                    new BackendRegistry(List.of(textOnly)), metrics);
            var imageRequest = ChatRequest.of(new ChatMessage("user",
                    JsonNodeFactory.instance.arrayNode().add(
                            JsonNodeFactory.instance.objectNode().put("type", "image_url"))));
            RoutingDecision decision = engine.plan(TaskCategory.VISION, 1.0, true);

            assertThrows(ChainExhaustedException.class,
                    () -> engine.execute(decision, imageRequest).collectList().block(Duration.ofSeconds(5)));
            assertTrue(textOnly.invocations().isEmpty());
            assertTrue(decision.attempts().stream()
                    .allMatch(a -> a.outcome() == AttemptOutcome.NON_TRANSIENT_FAILURE));
        }
    }
}
