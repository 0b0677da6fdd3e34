package com.switchboard.core.llm;

import java.time.Duration;

/**
 * Bounded structured-decision call to a fast auxiliary model.
 * <p>
 * Implementations constrain the model to the JSON shape of {@code decisionType}
 * and never return free text.
 */
public interface ClassificationClient {

    /**
     * @param systemPrompt  instructions describing the decision to make
     * @param userPrompt    the text being classified
     * @param decisionType  record type the model must fill in
     * @param timeout       hard upper bound on the call
     * @return the parsed decision, never null
     * @throws ClassificationTimeoutException       when {@code timeout} elapses
     * @throws ClassificationNoCredentialsException when no API key is configured
     * @throws ClassificationException              on transport or parse failure
     */
    <T> T decide(String systemPrompt, String userPrompt, Class<T> decisionType, Duration timeout);
}
