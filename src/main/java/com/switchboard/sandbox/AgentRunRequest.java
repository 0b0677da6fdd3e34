package com.switchboard.sandbox;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of one agent run against the sandbox runner.
 *
 * @param agent       CLI agent to run, e.g. "claude-code"
 * @param model       model the agent should use; omitted to let the runner decide
 * @param prompt      the full task text, conversation context included
 * @param maxDuration hard limit for the whole run, in seconds
 * @param rawPrompt   always true; the runner must not wrap the prompt in its own context
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record AgentRunRequest(
    String agent,
    String model,
    String prompt,
    int maxDuration,
    boolean rawPrompt,
    boolean stream
) {}
