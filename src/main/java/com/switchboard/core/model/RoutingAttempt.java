package com.switchboard.core.model;

import java.time.Duration;

/**
 * One entry of a routing decision's attempt log.
 *
 * @param model   the candidate that was tried
 * @param outcome how the attempt ended
 * @param error   failure summary, null on success
 * @param elapsed time from dispatch to first event or failure
 */
public record RoutingAttempt(
    ModelSpec model,
    AttemptOutcome outcome,
    String error,
    Duration elapsed
) {
    public boolean succeeded() {
        return outcome == AttemptOutcome.SUCCESS;
    }
}
