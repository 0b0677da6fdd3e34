package com.switchboard.core.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.switchboard.core.llm.LlmProperties;
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
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Streams a chat completion from an OpenAI-compatible {@code /v1/chat/completions}
 * endpoint. Each SSE {@code data:} payload becomes one raw upstream event,
 * including the closing {@code [DONE]} sentinel.
 */
@Component
public class OpenAiCompatibleBackend implements ModelBackend {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleBackend.class);
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {};
    private static final int ERROR_DETAIL_LIMIT = 300;

    private final WebClient webClient;
    private final LlmProperties properties;
    private final ObjectMapper objectMapper;

    public OpenAiCompatibleBackend(WebClient.Builder builder, LlmProperties properties, ObjectMapper objectMapper) {
        this.webClient = builder.baseUrl(properties.getBaseUrl()).build();
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String kind() {
        return ModelSpec.DEFAULT_BACKEND;
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
        if (!properties.hasApiKey()) {
            return Flux.error(new UpstreamException(UpstreamException.Kind.REQUEST_REJECTED, model.id(), 401,
                    "No API key configured for " + model.id() + " (switchboard.llm.api-key)"));
        }
        ObjectNode body = requestBody(model, request);
        return Flux.defer(() -> {
            log.debug("Calling {} (timeout {}s)", model.id(), model.callTimeout().toSeconds());
            return webClient.post()
                    .uri("/v1/chat/completions")
                    .headers(headers -> headers.setBearerAuth(properties.getApiKey()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> toUpstreamException(model, response))
                    .bodyToFlux(SSE_TYPE)
                    .filter(sse -> sse.data() != null)
                    .map(sse -> UpstreamEvent.raw(sse.data()));
        });
    }

    ObjectNode requestBody(ModelSpec model, ChatRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model.id());
        body.set("messages", objectMapper.valueToTree(request.messages()));
        body.put("stream", true);
        body.put("temperature", request.temperature() != null
                ? request.temperature()
                : model.samplingTemperature());
        body.put("max_tokens", request.maxTokens() != null
                ? Math.min(request.maxTokens(), model.maxOutputTokens())
                : model.maxOutputTokens());
        return body;
    }

    private static Mono<UpstreamException> toUpstreamException(ModelSpec model, ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(detail -> new UpstreamException(UpstreamException.kindForStatus(status), model.id(), status,
                        "HTTP " + status + " from " + model.id() + abbreviate(detail)));
    }

    private static String abbreviate(String detail) {
        if (detail.isBlank()) {
            return "";
        }
        String trimmed = detail.strip();
        return ": " + (trimmed.length() <= ERROR_DETAIL_LIMIT ? trimmed : trimmed.substring(0, ERROR_DETAIL_LIMIT) + "...");
    }
}
