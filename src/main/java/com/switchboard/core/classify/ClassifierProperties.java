package com.switchboard.core.classify;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tuning for the complexity and task classifiers. Verification by the
 * auxiliary model is always on; only its time budget is configurable.
 */
@Component
@ConfigurationProperties(prefix = "switchboard.classifier")
public class ClassifierProperties {

    private Duration verificationTimeout = Duration.ofSeconds(3);
    private Duration taskTimeout = Duration.ofSeconds(5);
    private int trivialMaxChars = 40;
    private int simpleMaxChars = 50;
    private int tokenThreshold = 2000;
    private boolean alwaysUseAgent = false;

    public Duration getVerificationTimeout() { return verificationTimeout; }
    public void setVerificationTimeout(Duration verificationTimeout) { this.verificationTimeout = verificationTimeout; }

    public Duration getTaskTimeout() { return taskTimeout; }
    public void setTaskTimeout(Duration taskTimeout) { this.taskTimeout = taskTimeout; }

    public int getTrivialMaxChars() { return trivialMaxChars; }
    public void setTrivialMaxChars(int trivialMaxChars) { this.trivialMaxChars = trivialMaxChars; }

    public int getSimpleMaxChars() { return simpleMaxChars; }
    public void setSimpleMaxChars(int simpleMaxChars) { this.simpleMaxChars = simpleMaxChars; }

    public int getTokenThreshold() { return tokenThreshold; }
    public void setTokenThreshold(int tokenThreshold) { this.tokenThreshold = tokenThreshold; }

    public boolean isAlwaysUseAgent() { return alwaysUseAgent; }
    public void setAlwaysUseAgent(boolean alwaysUseAgent) { this.alwaysUseAgent = alwaysUseAgent; }
}
