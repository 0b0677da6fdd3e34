package com.switchboard.core.routing;

import com.switchboard.core.model.RoutingAttempt;

import java.util.List;

/**
 * Every candidate in a routing decision failed before streaming began.
 */
public class ChainExhaustedException extends RuntimeException {

    private final UpstreamException lastFailure;
    private final List<RoutingAttempt> attempts;

    public ChainExhaustedException(UpstreamException lastFailure, List<RoutingAttempt> attempts) {
        super("All " + attempts.size() + " candidate model(s) failed; last: "
                + (lastFailure != null ? lastFailure.getMessage() : "none"), lastFailure);
        this.lastFailure = lastFailure;
        this.attempts = List.copyOf(attempts);
    }

    public UpstreamException lastFailure() {
        return lastFailure;
    }

    public List<RoutingAttempt> attempts() {
        return attempts;
    }
}
