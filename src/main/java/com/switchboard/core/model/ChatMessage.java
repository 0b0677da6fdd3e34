package com.switchboard.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.List;

/**
 * One OpenAI-style chat message. {@code content} is either a plain string or
 * an array of typed parts ({@code text}, {@code image_url}, {@code image}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessage(String role, JsonNode content) {

    public static ChatMessage user(String text) {
        return new ChatMessage("user", TextNode.valueOf(text));
    }

    public static ChatMessage assistant(String text) {
        return new ChatMessage("assistant", TextNode.valueOf(text));
    }

    public static ChatMessage system(String text) {
        return new ChatMessage("system", TextNode.valueOf(text));
    }

    @JsonIgnore
    public boolean isUser() {
        return "user".equalsIgnoreCase(role);
    }

    /**
     * Text of this message: the string content, or the text parts joined by a space.
     */
    @JsonIgnore
    public String text() {
        if (content == null || content.isNull()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (!content.isArray()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode part : content) {
            if (part.isTextual()) {
                parts.add(part.asText());
            } else if ("text".equals(part.path("type").asText()) || (!part.has("type") && part.has("text"))) {
                parts.add(part.path("text").asText(""));
            }
        }
        return String.join(" ", parts);
    }

    @JsonIgnore
    public int imageCount() {
        if (content == null || !content.isArray()) {
            return 0;
        }
        int count = 0;
        for (JsonNode part : content) {
            String type = part.path("type").asText("");
            if ("image_url".equals(type) || "image".equals(type)) {
                count++;
            }
        }
        return count;
    }
}
