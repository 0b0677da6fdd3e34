package com.switchboard.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.switchboard.core.backend.ModelBackend;
import com.switchboard.core.model.ChatRequest;
import com.switchboard.core.model.ModelSpec;
import com.switchboard.core.routing.UpstreamException;
import com.switchboard.core.stream.UpstreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Runs a request on the external sandbox agent runner and streams its events.
 * <p>
 * The runner answers with SSE frames whose {@code event:} name is the event
 * type ({@code status}, {@code output}, {@code agent-output}, {@code heartbeat},
 * {@code complete}, ...) and whose data is JSON. The name is copied into a
 * {@code type} field when the payload has none, so the normalizer sees one shape.
 */
@Component
public class SandboxAgentBackend implements ModelBackend {

    public static final String KIND = "sandbox-agent";

    private static final Logger log = LoggerFactory.getLogger(SandboxAgentBackend.class);
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final SandboxProperties properties;
    private final ObjectMapper objectMapper;

    public SandboxAgentBackend(WebClient.Builder builder, SandboxProperties properties, ObjectMapper objectMapper) {
        this.webClient = builder.baseUrl(properties.getBaseUrl()).build();
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public boolean supportsVision() {
        return true;
    }

    @Override
    public boolean emitsReasoning() {
        return true;
    }

    @Override
    public Flux<UpstreamEvent> invoke(ModelSpec model, ChatRequest request) {
        if (!properties.isConfigured()) {
            return Flux.error(new UpstreamException(UpstreamException.Kind.REQUEST_REJECTED, model.id(), 0,
                    "Sandbox agent runner not configured (switchboard.sandbox.base-url)"));
        }
        var body = new AgentRunRequest(
                properties.getAgent(),
                properties.getModel(),
                AgentPromptBuilder.build(request),
                properties.getMaxDurationSeconds(),
                true,
                true);
        return Flux.defer(() -> {
            log.info("Starting agent run: agent={} maxDuration={}s", body.agent(), body.maxDuration());
            return webClient.post()
                    .uri(properties.getRunPath())
                    .headers(headers -> {
                        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
                            headers.setBearerAuth(properties.getApiKey());
                        }
                    })
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> response.createException()
                            .map(e -> UpstreamException.classify(model.id(), e)))
                    .bodyToFlux(SSE_TYPE)
                    .concatMapIterable(this::toEvents);
        });
    }

    /**
     * One SSE frame to zero or one upstream events. Non-JSON data is passed
     * through as a raw line.
     */
    List<UpstreamEvent> toEvents(ServerSentEvent<String> frame) {
        String data = frame.data();
        if (data == null || data.isBlank()) {
            return List.of();
        }
        try {
            JsonNode node = objectMapper.readTree(data);
            if (node instanceof ObjectNode object && !object.has("type") && frame.event() != null) {
                object.put("type", frame.event());
            }
            return List.of(UpstreamEvent.json(node));
        } catch (JsonProcessingException e) {
            return List.of(UpstreamEvent.raw(data));
        }
    }
}
