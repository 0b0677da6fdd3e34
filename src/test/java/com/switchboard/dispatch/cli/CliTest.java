package com.switchboard.dispatch.cli;

import com.switchboard.core.classify.ComplexityReason;
import com.switchboard.core.classify.TaskClassifier;
import com.switchboard.core.engine.GatewayEngine;
import com.switchboard.core.engine.RequestPlan;
import com.switchboard.core.health.HealthCheckService;
import com.switchboard.core.health.HealthStatus;
import com.switchboard.core.model.ComplexityAnalysis;
import com.switchboard.core.model.RoutingDecision;
import com.switchboard.core.model.TaskCategory;
import com.switchboard.core.registry.DefaultModels;
import com.switchboard.core.registry.ModelRegistry;
import com.switchboard.core.stream.StreamEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import reactor.core.publisher.Flux;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for the Switchboard CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private final ModelRegistry registry = new ModelRegistry(DefaultModels.CATALOGUE);

    private GatewayEngine createMockEngine() {
        GatewayEngine engine = mock(GatewayEngine.class);
        var flash = registry.getModelForTask(TaskCategory.SIMPLE_TEXT, false);
        var decision = new RoutingDecision(TaskCategory.SIMPLE_TEXT, 0.9, false, flash,
                registry.getFallbackModels(flash.id(), false));
        var plan = new RequestPlan("req-test",
                new ComplexityAnalysis(false, ComplexityReason.TRIVIAL, List.of(), false, 0, "hi"),
                new TaskClassifier.Result(TaskCategory.SIMPLE_TEXT, 0.9),
                decision);
        when(engine.plan(anyString(), any())).thenReturn(plan);
        when(engine.execute(any(), any())).thenReturn(
                Flux.just(new StreamEvent.ContentDelta("Hello!"), new StreamEvent.Done("stop")));
        return engine;
    }

    private CommandLine.IFactory createFactory(GatewayEngine engine) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ClassifyCommand.class) {
                    return (K) new ClassifyCommand(engine);
                }
                if (cls == ModelsCommand.class) {
                    return (K) new ModelsCommand(registry);
                }
                if (cls == HealthCommand.class) {
                    HealthCheckService mockHealth = mock(HealthCheckService.class);
                    when(mockHealth.checkAll()).thenReturn(List.of(
                            new HealthStatus("registry", HealthStatus.Status.UP, "8 models registered",
                                    Map.of("maxFallbacks", "3")),
                            new HealthStatus("sandbox", HealthStatus.Status.DEGRADED,
                                    "Sandbox runner not configured", Map.of())));
                    return (K) new HealthCommand(mockHealth);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(GatewayEngine engine, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new SwitchboardCommand(), createFactory(engine));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private CliResult execute(String... args) {
        return execute(mock(GatewayEngine.class), args);
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("serve"));
            assertTrue(result.output().contains("classify"));
            assertTrue(result.output().contains("models"));
            assertTrue(result.output().contains("health"));
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Switchboard 0.1.0"));
        }

        @Test
        @DisplayName("classify without a message is a usage error")
        void classifyNeedsMessage() {
            CliResult result = execute("classify");
            assertEquals(2, result.exitCode());
        }
    }

    @Nested
    @DisplayName("classify")
    class ClassifyTests {

        @Test
        @DisplayName("prints path, task and candidate chain")
        void printsPlan() {
            GatewayEngine engine = createMockEngine();

            CliResult result = execute(engine, "classify", "hi", "there");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("FAST (trivial)"), result.output());
            assertTrue(result.output().contains("simple_text (confidence 0.90)"), result.output());
            assertTrue(result.output().contains("zai-org/GLM-4.7-Flash"), result.output());
            verify(engine).plan(anyString(), argThat(r -> r.lastUserText().equals("hi there")));
            verify(engine, never()).execute(any(), any());
        }

        @Test
        @DisplayName("--run streams the response")
        void runStreams() {
            GatewayEngine engine = createMockEngine();

            CliResult result = execute(engine, "classify", "--run", "hi");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Hello!"), result.output());
            assertTrue(result.output().contains("finish_reason=stop"), result.output());
        }

        @Test
        @DisplayName("--run executes the printed plan without planning twice")
        void runExecutesPrintedPlan() {
            GatewayEngine engine = createMockEngine();

            execute(engine, "classify", "--run", "hi");

            verify(engine, times(1)).plan(anyString(), any());
            verify(engine).execute(argThat(plan -> plan.requestId().equals("req-test")), any());
            verify(engine, never()).stream(anyString(), any());
        }
    }

    @Test
    @DisplayName("models lists the registry in priority order")
    void models() {
        CliResult result = execute("models");

        assertEquals(0, result.exitCode());
        String output = result.output();
        assertTrue(output.indexOf("zai-org/GLM-4.7-Flash") < output.indexOf("XiaomiMiMo/MiMo-V2-Flash"));
        assertTrue(output.contains("8 models, up to 3 fallbacks per request"));
    }

    @Test
    @DisplayName("health reports degraded components")
    void health() {
        CliResult result = execute("health");

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("registry: 8 models registered"));
        assertTrue(result.output().contains("sandbox: Sandbox runner not configured"));
        assertTrue(result.output().contains("Serving with 1 degraded component(s)"));
    }

    @Test
    @DisplayName("health --verbose prints component metadata")
    void healthVerbose() {
        CliResult result = execute("health", "--verbose");

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("maxFallbacks = 3"), result.output());
    }
}
