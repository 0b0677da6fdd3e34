package com.switchboard.core.model;

/**
 * Outcome of one candidate attempt inside a routing decision.
 */
public enum AttemptOutcome {
    SUCCESS,
    TRANSIENT_FAILURE,
    NON_TRANSIENT_FAILURE
}
