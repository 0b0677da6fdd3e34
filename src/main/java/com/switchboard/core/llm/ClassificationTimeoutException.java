package com.switchboard.core.llm;

import java.time.Duration;

/**
 * The classification call did not answer within its time budget.
 */
public class ClassificationTimeoutException extends ClassificationException {

    public ClassificationTimeoutException(String model, Duration timeout) {
        super("timeout", "Classification call to " + model + " exceeded " + timeout.toMillis() + "ms");
    }
}
