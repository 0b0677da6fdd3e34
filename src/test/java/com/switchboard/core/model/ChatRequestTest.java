package com.switchboard.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChatRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("deserializes string and multi-part content")
    void deserializes() throws Exception {
        String json = """
                {
                  "model": "switchboard",
                  "stream": false,
                  "max_tokens": 256,
                  "messages": [
                    {"role": "system", "content": "Be brief"},
                    {"role": "user", "content": [
                      {"type": "text", "text": "What is in"},
                      {"type": "text", "text": "this picture?"},
                      {"type": "image_url", "image_url": {"url": "https://example.com/cat.png"}}
                    ]}
                  ],
                  "generation_flags": {"generate_image": true},
                  "unknown_field": 1
                }
                """;

        ChatRequest request = mapper.readValue(json, ChatRequest.class);

        assertFalse(request.isStreaming());
        assertEquals(256, request.maxTokens());
        assertEquals("What is in this picture?", request.lastUserText());
        assertEquals(1, request.imageCount());
        assertTrue(request.hasImages());
        assertEquals(1, request.generationFlags().reasons().size());
    }

    @Test
    @DisplayName("stream defaults to true and flags default to none")
    void defaults() {
        ChatRequest request = new ChatRequest(null, null, null, null, null, null);

        assertTrue(request.isStreaming());
        assertTrue(request.messages().isEmpty());
        assertSame(GenerationFlags.NONE, request.generationFlags());
        assertEquals("", request.lastUserText());
    }

    @Test
    @DisplayName("lastUserMessage picks the most recent user turn")
    void lastUserMessage() {
        ChatRequest request = ChatRequest.of(
                ChatMessage.user("first"), ChatMessage.assistant("reply"), ChatMessage.user("second"),
                ChatMessage.assistant("again"));

        assertEquals("second", request.lastUserText());
    }
}
