package com.switchboard.core.engine;

import com.switchboard.core.classify.TaskClassifier;
import com.switchboard.core.model.ComplexityAnalysis;
import com.switchboard.core.model.RoutingDecision;

/**
 * Everything decided about a request before any backend is called.
 *
 * @param task null on the agent path, where no task category is computed
 */
public record RequestPlan(
    String requestId,
    ComplexityAnalysis complexity,
    TaskClassifier.Result task,
    RoutingDecision decision
) {
    public boolean agentPath() {
        return complexity.needsAgent();
    }
}
