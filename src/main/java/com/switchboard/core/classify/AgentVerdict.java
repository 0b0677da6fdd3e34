package com.switchboard.core.classify;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Structured answer of the agent-need verification call.
 *
 * @param needsAgent null when the model omitted the field; treated as malformed
 */
public record AgentVerdict(
    @JsonPropertyDescription("True if the request needs the agent sandbox (image/audio/video generation, "
            + "code execution, web search, browsing, file operations). False if a model can answer directly.")
    Boolean needsAgent,
    @JsonPropertyDescription("Brief explanation of the decision")
    String reason
) {}
