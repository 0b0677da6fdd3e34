package com.switchboard.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.switchboard.core.engine.CompletionResult;
import com.switchboard.core.stream.StreamEvent;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Encodes normalized events as OpenAI-compatible {@code chat.completion.chunk}
 * objects, and folded results as {@code chat.completion} objects.
 */
@Component
public class ChunkEncoder {

    static final String CHUNK_OBJECT = "chat.completion.chunk";
    static final String COMPLETION_OBJECT = "chat.completion";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ChunkEncoder(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    ChunkEncoder(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * The opening chunk announcing the assistant role.
     */
    public ObjectNode roleChunk(String requestId, String model) {
        ObjectNode chunk = envelope(requestId, model, CHUNK_OBJECT);
        ObjectNode choice = chunk.putArray("choices").addObject();
        choice.put("index", 0);
        choice.putObject("delta").put("role", "assistant");
        choice.putNull("finish_reason");
        return chunk;
    }

    public ObjectNode encode(String requestId, String model, StreamEvent event) {
        ObjectNode chunk = envelope(requestId, model, CHUNK_OBJECT);
        ObjectNode choice = chunk.putArray("choices").addObject();
        choice.put("index", 0);
        ObjectNode delta = choice.putObject("delta");
        if (event instanceof StreamEvent.ContentDelta content) {
            delta.put("content", content.text());
            choice.putNull("finish_reason");
        } else if (event instanceof StreamEvent.ReasoningDelta reasoning) {
            delta.put("reasoning_content", reasoning.text());
            choice.putNull("finish_reason");
        } else if (event instanceof StreamEvent.Done done) {
            choice.put("finish_reason", done.finishReason());
        } else if (event instanceof StreamEvent.Error error) {
            choice.put("finish_reason", "error");
            ObjectNode detail = chunk.putObject("error");
            detail.put("type", error.kind());
            detail.put("message", error.message());
        } else {
            throw new IllegalArgumentException("Unknown stream event " + event);
        }
        return chunk;
    }

    public ObjectNode completion(String requestId, String model, CompletionResult result) {
        ObjectNode completion = envelope(requestId, model, COMPLETION_OBJECT);
        ObjectNode choice = completion.putArray("choices").addObject();
        choice.put("index", 0);
        ObjectNode message = choice.putObject("message");
        message.put("role", "assistant");
        message.put("content", result.content());
        if (!result.reasoning().isEmpty()) {
            message.put("reasoning_content", result.reasoning());
        }
        choice.put("finish_reason", result.failed() ? "error" : result.finishReason());
        return completion;
    }

    /**
     * OpenAI-style error body.
     */
    public ObjectNode error(String type, String message) {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode error = body.putObject("error");
        error.put("type", type);
        error.put("message", message);
        return body;
    }

    private ObjectNode envelope(String requestId, String model, String object) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", "chatcmpl-" + requestId);
        node.put("object", object);
        node.put("created", clock.instant().getEpochSecond());
        node.put("model", model);
        return node;
    }
}
