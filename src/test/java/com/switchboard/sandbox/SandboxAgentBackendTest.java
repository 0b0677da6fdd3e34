package com.switchboard.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.model.ChatRequest;
import com.switchboard.core.routing.UpstreamException;
import com.switchboard.core.stream.UpstreamEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SandboxAgentBackendTest {

    private SandboxProperties properties;
    private AtomicReference<ClientRequest> lastRequest;

    @BeforeEach
    void setUp() {
        properties = new SandboxProperties();
        properties.setBaseUrl("http://sandbox.local");
        properties.setApiKey("runner-key");
        lastRequest = new AtomicReference<>();
    }

    private SandboxAgentBackend backendReturning(ClientResponse response) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            lastRequest.set(request);
            return Mono.just(response);
        });
        return new SandboxAgentBackend(builder, properties, new ObjectMapper());
    }

    private static ServerSentEvent<String> frame(String event, String data) {
        return ServerSentEvent.<String>builder().event(event).data(data).build();
    }

    @Nested
    @DisplayName("toEvents")
    class ToEvents {

        private SandboxAgentBackend backend;

        @BeforeEach
        void createBackend() {
            backend = backendReturning(ClientResponse.create(HttpStatus.OK).build());
        }

        @Test
        @DisplayName("copies the SSE event name into a missing type field")
        void copiesEventName() {
            List<UpstreamEvent> events = backend.toEvents(frame("status", "{\"message\":\"Installing\"}"));

            assertEquals(1, events.size());
            assertEquals("status", events.get(0).json().path("type").asText());
            assertEquals("Installing", events.get(0).json().path("message").asText());
        }

        @Test
        @DisplayName("an explicit type wins over the event name")
        void keepsExplicitType() {
            List<UpstreamEvent> events = backend.toEvents(frame("message", "{\"type\":\"complete\"}"));

            assertEquals("complete", events.get(0).json().path("type").asText());
        }

        @Test
        @DisplayName("non-JSON data passes through as a raw line")
        void rawData() {
            List<UpstreamEvent> events = backend.toEvents(frame("output", "npm install done"));

            assertTrue(events.get(0).isRaw());
            assertEquals("npm install done", events.get(0).raw());
        }

        @Test
        @DisplayName("blank frames produce nothing")
        void blankFrames() {
            assertTrue(backend.toEvents(frame("heartbeat", " ")).isEmpty());
            assertTrue(backend.toEvents(ServerSentEvent.<String>builder().comment("keepalive").build()).isEmpty());
        }
    }

    @Test
    @DisplayName("streams runner events with bearer auth")
    void streamsRun() {
        var response = ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, "text/event-stream")
                .body("event:status\ndata:{\"message\":\"Starting\"}\n\n"
                        + "event:complete\ndata:{\"result\":\"Done\"}\n\n")
                .build();

        List<UpstreamEvent> events = backendReturning(response)
                .invoke(properties.toModelSpec(), ChatRequest.ofText("Build a todo app"))
                .collectList().block(Duration.ofSeconds(5));

        assertEquals(2, events.size());
        assertEquals("status", events.get(0).json().path("type").asText());
        assertEquals("complete", events.get(1).json().path("type").asText());
        assertEquals("Bearer runner-key", lastRequest.get().headers().getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals("/api/agent/run", lastRequest.get().url().getPath());
    }

    @Test
    @DisplayName("runner 5xx is a transient failure")
    void runnerDown() {
        var response = ClientResponse.create(HttpStatus.BAD_GATEWAY).body("no sandbox").build();

        var error = assertThrows(UpstreamException.class, () -> backendReturning(response)
                .invoke(properties.toModelSpec(), ChatRequest.ofText("Build a todo app"))
                .collectList().block(Duration.ofSeconds(5)));

        assertTrue(error.isTransient());
        assertEquals(502, error.status());
    }

    @Test
    @DisplayName("unconfigured runner rejects without a call")
    void notConfigured() {
        properties.setBaseUrl("");
        var backend = backendReturning(ClientResponse.create(HttpStatus.OK).build());

        var error = assertThrows(UpstreamException.class, () -> backend
                .invoke(properties.toModelSpec(), ChatRequest.ofText("Build a todo app"))
                .blockFirst(Duration.ofSeconds(5)));

        assertEquals(UpstreamException.Kind.REQUEST_REJECTED, error.kind());
        assertNull(lastRequest.get());
    }
}
