package com.switchboard.sandbox;

import com.switchboard.core.model.ModelSpec;
import com.switchboard.core.model.TaskCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SandboxPropertiesTest {

    @Test
    @DisplayName("unconfigured until a base URL is set")
    void configured() {
        var properties = new SandboxProperties();
        assertFalse(properties.isConfigured());

        properties.setBaseUrl("  ");
        assertFalse(properties.isConfigured());

        properties.setBaseUrl("http://sandbox:8080");
        assertTrue(properties.isConfigured());
    }

    @Test
    @DisplayName("agent is routable as a sandbox-agent model")
    void modelSpec() {
        var properties = new SandboxProperties();
        properties.setTimeoutSeconds(45);

        ModelSpec spec = properties.toModelSpec();

        assertEquals("claude-code", spec.id());
        assertEquals(SandboxAgentBackend.KIND, spec.backend());
        assertEquals(Duration.ofSeconds(45), spec.callTimeout());
        assertFalse(spec.supportsVision());
        assertFalse(spec.servesCategory(TaskCategory.VISION));
        assertTrue(spec.servesCategory(TaskCategory.PROGRAMMING));
    }

    @Test
    @DisplayName("agent claims vision only for requests with images")
    void visionFollowsRequest() {
        var properties = new SandboxProperties();

        ModelSpec spec = properties.toModelSpec(true);

        assertTrue(spec.supportsVision());
        assertTrue(spec.servesCategory(TaskCategory.VISION));
    }
}
