package com.switchboard.core.engine;

import com.switchboard.core.backend.BackendRegistry;
import com.switchboard.core.backend.ScriptedBackend;
import com.switchboard.core.classify.AgentVerdict;
import com.switchboard.core.classify.ClassifierProperties;
import com.switchboard.core.classify.ComplexityClassifier;
import com.switchboard.core.classify.TaskClassifier;
import com.switchboard.core.classify.TaskVerdict;
import com.switchboard.core.llm.ClassificationClient;
import com.switchboard.core.metrics.RoutingMetrics;
import com.switchboard.core.model.ChatRequest;
import com.switchboard.core.model.TaskCategory;
import com.switchboard.core.registry.DefaultModels;
import com.switchboard.core.registry.ModelRegistry;
import com.switchboard.core.routing.RoutingEngine;
import com.switchboard.core.routing.UpstreamException;
import com.switchboard.core.stream.StreamEvent;
import com.switchboard.core.stream.StreamNormalizer;
import com.switchboard.core.stream.StreamProperties;
import com.switchboard.core.stream.UpstreamEvent;
import com.switchboard.sandbox.SandboxAgentBackend;
import com.switchboard.sandbox.SandboxProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests of the request pipeline with scripted backends and a
 * mocked classification model.
 */
class GatewayEngineTest {

    private static final String FLASH = "zai-org/GLM-4.7-Flash";
    private static final String GLM = "zai-org/GLM-4.7-TEE";

    private ClassificationClient classificationClient;
    private ScriptedBackend models;
    private ScriptedBackend agent;
    private RoutingMetrics metrics;
    private GatewayEngine engine;

    @BeforeEach
    void setUp() {
        classificationClient = mock(ClassificationClient.class);
        models = new ScriptedBackend();
        agent = new ScriptedBackend(SandboxAgentBackend.KIND, true);
        metrics = new RoutingMetrics(new SimpleMeterRegistry());
        var classifierProperties = new ClassifierProperties();
        var routing = new RoutingEngine(new ModelRegistry(DefaultModels.CATALOGUE),
                new BackendRegistry(List.of(models, agent)), metrics);
        engine = new GatewayEngine(
                new ComplexityClassifier(classificationClient, classifierProperties),
                new TaskClassifier(classificationClient, classifierProperties),
                routing,
                new StreamNormalizer(new StreamProperties()),
                metrics,
                new SandboxProperties());
    }

    private static String chunk(String content, String finishReason) {
        String finish = finishReason == null ? "" : ",\"finish_reason\":\"" + finishReason + "\"";
        return "{\"choices\":[{\"delta\":{\"content\":\"" + content + "\"}" + finish + "}]}";
    }

    private List<StreamEvent> run(String text) {
        return engine.stream("req-test", ChatRequest.ofText(text)).collectList().block(Duration.ofSeconds(10));
    }

    @Nested
    @DisplayName("fast path")
    class FastPath {

        @Test
        @DisplayName("trivial question streams from the flash model")
        void trivialQuestion() {
            models.onLines(FLASH, chunk("4", null), chunk("", "stop"), "[DONE]");

            List<StreamEvent> events = run("What is 2+2?");

            assertEquals(List.of(new StreamEvent.ContentDelta("4"), new StreamEvent.Done("stop")), events);
            assertEquals(List.of(FLASH), models.invocations());
            verifyNoInteractions(classificationClient);

            var snapshot = metrics.snapshot();
            assertEquals(1, snapshot.totalRequests());
            assertEquals(1L, snapshot.requestsByPath().get("fast"));
            assertEquals(1L, snapshot.requestsByCategory().get("simple_text"));
            assertEquals(1L, snapshot.requestsByModel().get(FLASH));
        }

        @Test
        @DisplayName("a failing primary falls back transparently")
        void fallback() {
            models.on(FLASH, () -> Flux.error(new UpstreamException(
                    UpstreamException.Kind.SERVER_ERROR, FLASH, 503, "HTTP 503")));
            models.onLines(GLM, chunk("Hi", "stop"));

            List<StreamEvent> events = run("hello");

            assertEquals(List.of(new StreamEvent.ContentDelta("Hi"), new StreamEvent.Done("stop")), events);
            assertEquals(1, metrics.snapshot().fallbackCount());
        }

        @Test
        @DisplayName("all candidates failing ends with one chain_exhausted error")
        void exhausted() {
            var result = engine.complete("req-test", ChatRequest.ofText("hello")).block(Duration.ofSeconds(10));

            assertNotNull(result);
            assertTrue(result.failed());
            assertEquals("chain_exhausted", result.error().kind());
            assertNull(result.finishReason());
        }

        @Test
        @DisplayName("verified non-agent request is classified by task")
        void verifiedRequest() {
            when(classificationClient.decide(anyString(), anyString(), eq(AgentVerdict.class), any(Duration.class)))
                    .thenReturn(new AgentVerdict(false, "knowledge question"));
            when(classificationClient.decide(anyString(), anyString(),
                    eq(TaskVerdict.class), any(Duration.class)))
                    .thenReturn(new TaskVerdict("math_reasoning", 0.9, "math"));

            RequestPlan plan = engine.plan("req-plan", ChatRequest.ofText(
                    "Explain why the sum of the first n odd numbers is always a perfect square"));

            assertFalse(plan.agentPath());
            assertEquals(TaskCategory.MATH_REASONING, plan.task().category());
            assertEquals("deepseek-ai/DeepSeek-V3.2-Speciale-TEE", plan.decision().primary().id());
        }

        @Test
        @DisplayName("executing a printed plan does not classify the request again")
        void executePlannedRequest() {
            when(classificationClient.decide(anyString(), anyString(), eq(AgentVerdict.class), any(Duration.class)))
                    .thenReturn(new AgentVerdict(false, "knowledge question"));
            when(classificationClient.decide(anyString(), anyString(),
                    eq(TaskVerdict.class), any(Duration.class)))
                    .thenReturn(new TaskVerdict("math_reasoning", 0.9, "math"));
            models.onLines("deepseek-ai/DeepSeek-V3.2-Speciale-TEE", chunk("n squared", "stop"));
            var request = ChatRequest.ofText(
                    "Explain why the sum of the first n odd numbers is always a perfect square");

            RequestPlan plan = engine.plan("req-plan", request);
            List<StreamEvent> events = engine.execute(plan, request).collectList().block(Duration.ofSeconds(10));

            assertEquals(List.of(new StreamEvent.ContentDelta("n squared"), new StreamEvent.Done("stop")), events);
            verify(classificationClient, times(1))
                    .decide(anyString(), anyString(), eq(AgentVerdict.class), any(Duration.class));
            verify(classificationClient, times(1))
                    .decide(anyString(), anyString(), eq(TaskVerdict.class), any(Duration.class));
            assertEquals(1, metrics.snapshot().totalRequests());
        }
    }

    @Nested
    @DisplayName("agent path")
    class AgentPath {

        @Test
        @DisplayName("keyword match routes to the sandbox agent")
        void keywordRoutesToAgent() {
            agent.onLines("claude-code",
                    "{\"type\":\"system\",\"subtype\":\"init\",\"model\":\"sonnet\"}",
                    "{\"type\":\"result\",\"result\":\"Saved cat.png\"}");

            List<StreamEvent> events = run("Generate an image of a cat");

            assertEquals(List.of(
                    new StreamEvent.ReasoningDelta("Agent session started (sonnet)\n"),
                    new StreamEvent.ContentDelta("Saved cat.png"),
                    new StreamEvent.Done("stop")), events);
            assertTrue(models.invocations().isEmpty());
            assertEquals(1L, metrics.snapshot().requestsByPath().get("agent"));
            assertTrue(metrics.snapshot().requestsByCategory().isEmpty());
        }

        @Test
        @DisplayName("agent plan has no task category and no fallbacks")
        void agentPlan() {
            RequestPlan plan = engine.plan("req-agent", ChatRequest.ofText("search the web for flights to Rome"));

            assertTrue(plan.agentPath());
            assertNull(plan.task());
            assertEquals("claude-code", plan.decision().primary().id());
            assertTrue(plan.decision().fallbackChain().isEmpty());
            assertFalse(plan.decision().primary().supportsVision());
        }
    }

    @Test
    @DisplayName("MDC is cleared after planning")
    void mdcCleared() {
        engine.plan("req-mdc", ChatRequest.ofText("hi"));
        assertNull(MDC.get("requestId"));
        assertNull(MDC.get("path"));
        assertNull(MDC.get("model"));
    }

    @Test
    @DisplayName("fold concatenates content and reasoning")
    void fold() {
        CompletionResult result = GatewayEngine.fold(List.of(
                new StreamEvent.ReasoningDelta("a"), new StreamEvent.ContentDelta("b"),
                new StreamEvent.ContentDelta("c"), new StreamEvent.Done("length")));

        assertEquals("bc", result.content());
        assertEquals("a", result.reasoning());
        assertEquals("length", result.finishReason());
        assertFalse(result.failed());
    }

    @Test
    @DisplayName("request ids are prefixed and unique")
    void requestIds() {
        String id = GatewayEngine.newRequestId();
        assertTrue(id.startsWith("req-"));
        assertEquals(16, id.length());
        assertNotEquals(id, GatewayEngine.newRequestId());
    }
}
