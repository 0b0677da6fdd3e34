package com.switchboard.dispatch.api;

import com.switchboard.core.engine.CompletionResult;
import com.switchboard.core.engine.GatewayEngine;
import com.switchboard.core.model.ChatRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * OpenAI-compatible chat completions endpoint.
 * <p>
 * Streaming requests get an SSE emitter; others get the folded completion.
 * The handler returns {@code Object} so Spring MVC picks the return value
 * handler from the runtime type.
 */
@RestController
public class ChatCompletionsController {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionsController.class);

    static final String DEFAULT_MODEL_NAME = "switchboard";
    private static final Duration NON_STREAMING_LIMIT = Duration.ofMinutes(30);

    private final GatewayEngine engine;
    private final SseStreamingService sseStreamingService;
    private final ChunkEncoder encoder;

    public ChatCompletionsController(GatewayEngine engine, SseStreamingService sseStreamingService,
                                     ChunkEncoder encoder) {
        this.engine = engine;
        this.sseStreamingService = sseStreamingService;
        this.encoder = encoder;
    }

    /**
     * POST /v1/chat/completions
     */
    @PostMapping(value = "/v1/chat/completions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Object chatCompletions(@RequestBody ChatRequest request) {
        if (request.messages().isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(encoder.error("invalid_request", "messages must contain at least one message"));
        }
        String requestId = GatewayEngine.newRequestId();
        String model = request.model() == null || request.model().isBlank() ? DEFAULT_MODEL_NAME : request.model();
        log.info("[{}] Chat completion: {} messages, stream={}", requestId,
                request.messages().size(), request.isStreaming());

        if (request.isStreaming()) {
            return sseStreamingService.stream(requestId, model, engine.stream(requestId, request));
        }

        CompletionResult result = engine.complete(requestId, request).block(NON_STREAMING_LIMIT);
        if (result == null) {
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                    .body(encoder.error("timeout", "No result within " + NON_STREAMING_LIMIT.toMinutes() + " minutes"));
        }
        if (result.failed()) {
            HttpStatus status = "chain_exhausted".equals(result.error().kind())
                    ? HttpStatus.SERVICE_UNAVAILABLE
                    : HttpStatus.BAD_GATEWAY;
            return ResponseEntity.status(status)
                    .body(encoder.error(result.error().kind(), result.error().message()));
        }
        return ResponseEntity.ok(encoder.completion(requestId, model, result));
    }
}
