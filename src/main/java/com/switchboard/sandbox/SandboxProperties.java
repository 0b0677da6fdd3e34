package com.switchboard.sandbox;

import com.switchboard.core.model.ModelSpec;
import com.switchboard.core.model.TaskCategory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumSet;

/**
 * Connection settings for the external sandbox agent runner.
 */
@Component
@ConfigurationProperties(prefix = "switchboard.sandbox")
public class SandboxProperties {

    private String baseUrl = "";
    private String runPath = "/api/agent/run";
    private String apiKey = "";
    private String agent = "claude-code";
    private String model = "";
    private int maxDurationSeconds = 600;
    private int timeoutSeconds = 120;

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    public String getRunPath() { return runPath; }
    public void setRunPath(String runPath) { this.runPath = runPath; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public String getAgent() { return agent; }
    public void setAgent(String agent) { this.agent = agent; }
    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public int getMaxDurationSeconds() { return maxDurationSeconds; }
    public void setMaxDurationSeconds(int maxDurationSeconds) { this.maxDurationSeconds = maxDurationSeconds; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isBlank();
    }

    /**
     * The agent as a routable model. {@code timeoutSeconds} bounds the wait
     * for each agent event, not the whole run.
     */
    public ModelSpec toModelSpec() {
        return toModelSpec(false);
    }

    /**
     * Same as {@link #toModelSpec()}, but the spec claims vision only when the
     * request carries images for the agent to look at.
     */
    public ModelSpec toModelSpec(boolean vision) {
        return new ModelSpec(
                agent,
                "Sandbox agent (" + agent + ")",
                vision ? EnumSet.allOf(TaskCategory.class) : EnumSet.complementOf(EnumSet.of(TaskCategory.VISION)),
                0,
                0,
                vision,
                Duration.ofSeconds(timeoutSeconds),
                0.0,
                SandboxAgentBackend.KIND);
    }
}
