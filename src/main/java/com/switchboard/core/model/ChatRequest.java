package com.switchboard.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Inbound OpenAI-compatible chat-completion request, reduced to the fields the
 * router reads or forwards.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatRequest(
    String model,
    List<ChatMessage> messages,
    Boolean stream,
    Double temperature,
    @JsonProperty("max_tokens") Integer maxTokens,
    @JsonProperty("generation_flags") GenerationFlags generationFlags
) {

    public ChatRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        generationFlags = generationFlags == null ? GenerationFlags.NONE : generationFlags;
    }

    public static ChatRequest of(ChatMessage... messages) {
        return new ChatRequest(null, List.of(messages), Boolean.TRUE, null, null, null);
    }

    public static ChatRequest ofText(String userText) {
        return of(ChatMessage.user(userText));
    }

    @JsonIgnore
    public boolean isStreaming() {
        return stream == null || stream;
    }

    @JsonIgnore
    public Optional<ChatMessage> lastUserMessage() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).isUser()) {
                return Optional.of(messages.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * Text of the most recent user message, or an empty string.
     */
    @JsonIgnore
    public String lastUserText() {
        return lastUserMessage().map(ChatMessage::text).orElse("");
    }

    @JsonIgnore
    public int imageCount() {
        return messages.stream().mapToInt(ChatMessage::imageCount).sum();
    }

    @JsonIgnore
    public boolean hasImages() {
        return imageCount() > 0;
    }
}
