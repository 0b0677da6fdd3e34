package com.switchboard.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "switchboard.llm")
public class LlmProperties {

    private String apiKey = "";
    private String baseUrl = "https://llm.chutes.ai";
    private String classifierModel = "zai-org/GLM-4.7-Flash";
    private int classifierMaxTokens = 100;

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getClassifierModel() {
        return classifierModel;
    }

    public void setClassifierModel(String classifierModel) {
        this.classifierModel = classifierModel;
    }

    public int getClassifierMaxTokens() {
        return classifierMaxTokens;
    }

    public void setClassifierMaxTokens(int classifierMaxTokens) {
        this.classifierMaxTokens = classifierMaxTokens;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
