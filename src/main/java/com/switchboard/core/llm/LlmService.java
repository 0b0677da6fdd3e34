package com.switchboard.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Service;

/**
 * Wraps Spring AI's {@link ChatClient} to produce structured (typed) output
 * from the fast classifier model.
 * <p>
 * Uses {@link BeanOutputConverter} to generate a JSON schema from the target
 * record, append format instructions to the user prompt, and deserialize the
 * model's JSON answer. Calls are deterministic (temperature 0) and short.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final ObjectMapper lenientMapper;

    public LlmService(ChatClient.Builder builder, LlmProperties properties) {
        this.chatClient = builder.build();
        this.properties = properties;
        this.lenientMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .registerModule(new ParameterNamesModule());
        log.info("LlmService initialized, classifier model: {}, base-url: {}",
                properties.getClassifierModel(), properties.getBaseUrl());
    }

    public String classifierModel() {
        return properties.getClassifierModel();
    }

    public boolean hasCredentials() {
        return properties.hasApiKey();
    }

    /**
     * Sends a system + user prompt to the classifier model and returns the
     * response deserialized into {@code outputType}.
     *
     * @throws LlmEmptyResponseException when the model returns no content
     * @throws LlmParseException         when the content does not match {@code outputType}
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = chatClient.prompt()
                .options(ChatOptions.builder()
                        .model(properties.getClassifierModel())
                        .temperature(0.0)
                        .maxTokens(properties.getClassifierMaxTokens())
                        .build())
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.debug("Classifier call complete -> {} ({}ms)", outputType.getSimpleName(), elapsed);
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException(properties.getClassifierModel(), outputType);
        }
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.debug("BeanOutputConverter rejected {} response ({}), retrying leniently",
                    outputType.getSimpleName(), e.getMessage());
            return parseWithJackson(response, outputType);
        }
    }

    /**
     * Fallback JSON parsing with lenient settings; strips markdown code fences.
     */
    <T> T parseWithJackson(String json, Class<T> outputType) {
        String cleaned = json.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();
        try {
            return lenientMapper.readValue(cleaned, outputType);
        } catch (Exception e) {
            throw new LlmParseException(outputType, cleaned, e);
        }
    }
}
