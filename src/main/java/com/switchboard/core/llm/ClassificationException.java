package com.switchboard.core.llm;

/**
 * A classification call failed in transport or produced no usable structured
 * decision. Callers recover from this locally and never surface it to users.
 */
public class ClassificationException extends RuntimeException {

    private final String cause;

    public ClassificationException(String cause, String message) {
        super(message);
        this.cause = cause;
    }

    public ClassificationException(String cause, String message, Throwable throwable) {
        super(message, throwable);
        this.cause = cause;
    }

    /**
     * Short label of what went wrong, e.g. {@code "timeout"} or {@code "parse_error"}.
     */
    public String cause() {
        return cause;
    }
}
