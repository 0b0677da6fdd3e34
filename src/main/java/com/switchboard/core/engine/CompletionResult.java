package com.switchboard.core.engine;

import com.switchboard.core.stream.StreamEvent;

/**
 * A whole normalized stream folded into one response.
 *
 * @param error the terminal error, null when the stream ended with {@code Done}
 */
public record CompletionResult(
    String content,
    String reasoning,
    String finishReason,
    StreamEvent.Error error
) {
    public boolean failed() {
        return error != null;
    }
}
