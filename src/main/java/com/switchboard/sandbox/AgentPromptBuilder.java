package com.switchboard.sandbox;

import com.switchboard.core.model.ChatMessage;
import com.switchboard.core.model.ChatRequest;

import java.util.List;

/**
 * Converts a chat request into the single prompt an agent run takes.
 * Pure function, no Spring dependencies.
 */
public final class AgentPromptBuilder {

    static final int MAX_CONTEXT_CHARS = 10_000;

    private AgentPromptBuilder() {}

    public static String build(ChatRequest request) {
        String task = request.lastUserText();
        List<ChatMessage> messages = request.messages();
        int lastUser = lastUserIndex(messages);
        var sb = new StringBuilder();

        var history = new StringBuilder();
        for (int i = 0; i < lastUser; i++) {
            ChatMessage message = messages.get(i);
            String text = message.text();
            if (!text.isBlank()) {
                history.append("[").append(message.role()).append("] ").append(text).append("\n");
            }
        }
        if (!history.isEmpty()) {
            sb.append("## Conversation So Far\n\n");
            sb.append(truncate(history.toString().strip())).append("\n\n");
        }

        int images = request.imageCount();
        if (images > 0) {
            sb.append("## Attachments\n\n");
            sb.append("The user attached ").append(images).append(images == 1 ? " image" : " images")
                    .append(" to this conversation.\n\n");
        }

        sb.append("## Task\n\n");
        sb.append(task.isBlank() ? "(no text)" : task).append("\n");
        return sb.toString();
    }

    /**
     * Truncates to about {@link #MAX_CONTEXT_CHARS}, keeping head and tail.
     */
    static String truncate(String text) {
        if (text.length() <= MAX_CONTEXT_CHARS) return text;
        int half = MAX_CONTEXT_CHARS / 2;
        return text.substring(0, half)
                + "\n\n... [truncated " + (text.length() - MAX_CONTEXT_CHARS) + " chars] ...\n\n"
                + text.substring(text.length() - half);
    }

    private static int lastUserIndex(List<ChatMessage> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).isUser()) {
                return i;
            }
        }
        return messages.size();
    }
}
