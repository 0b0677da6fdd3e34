package com.switchboard.core.llm;

/**
 * No API key is configured for the classification model.
 */
public class ClassificationNoCredentialsException extends ClassificationException {

    public ClassificationNoCredentialsException() {
        super("no_api_key", "No API key configured for classification calls (switchboard.llm.api-key)");
    }
}
