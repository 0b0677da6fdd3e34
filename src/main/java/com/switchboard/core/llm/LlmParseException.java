package com.switchboard.core.llm;

/**
 * The classifier answered, but not with a value of the requested type.
 * Keeps a short excerpt of the answer for the log line.
 */
public class LlmParseException extends RuntimeException {

    private static final int EXCERPT_LENGTH = 80;

    private final Class<?> outputType;
    private final String excerpt;

    public LlmParseException(Class<?> outputType, String response, Throwable cause) {
        super("Classifier answer is not a valid " + outputType.getSimpleName()
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.outputType = outputType;
        this.excerpt = response == null || response.length() <= EXCERPT_LENGTH
                ? response
                : response.substring(0, EXCERPT_LENGTH);
    }

    public Class<?> outputType() {
        return outputType;
    }

    public String excerpt() {
        return excerpt;
    }
}
