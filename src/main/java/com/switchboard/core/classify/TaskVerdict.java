package com.switchboard.core.classify;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Structured answer of the task-category call.
 */
public record TaskVerdict(
    @JsonPropertyDescription("One of: simple_text, general_text, math_reasoning, programming, creative, vision")
    String taskType,
    @JsonPropertyDescription("Confidence between 0.0 and 1.0")
    Double confidence,
    @JsonPropertyDescription("One short sentence explaining the choice")
    String reasoning
) {}
