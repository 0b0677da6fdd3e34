package com.switchboard.core.llm;

/**
 * The classifier call succeeded at the transport level but carried no text.
 */
public class LlmEmptyResponseException extends RuntimeException {

    private final String model;

    public LlmEmptyResponseException(String model, Class<?> outputType) {
        super(model + " returned no content for " + outputType.getSimpleName());
        this.model = model;
    }

    public String model() {
        return model;
    }
}
