package com.switchboard.core.health;

import com.switchboard.core.backend.BackendRegistry;
import com.switchboard.core.llm.LlmProperties;
import com.switchboard.core.model.ModelSpec;
import com.switchboard.core.registry.ModelRegistry;
import com.switchboard.sandbox.SandboxProperties;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Reports whether each collaborator the gateway depends on is usable.
 * A missing classifier key only degrades service: requests still flow, but
 * every undecided request goes to the agent.
 */
@Service
public class HealthCheckService {

    private final ModelRegistry modelRegistry;
    private final BackendRegistry backendRegistry;
    private final LlmProperties llmProperties;
    private final SandboxProperties sandboxProperties;

    public HealthCheckService(ModelRegistry modelRegistry, BackendRegistry backendRegistry,
                              LlmProperties llmProperties, SandboxProperties sandboxProperties) {
        this.modelRegistry = modelRegistry;
        this.backendRegistry = backendRegistry;
        this.llmProperties = llmProperties;
        this.sandboxProperties = sandboxProperties;
    }

    public List<HealthStatus> checkAll() {
        return List.of(checkRegistry(), checkClassifier(), checkSandbox());
    }

    private HealthStatus checkRegistry() {
        var unserved = modelRegistry.models().stream()
                .filter(m -> !backendRegistry.kinds().contains(m.backend()))
                .map(ModelSpec::id)
                .toList();
        if (!unserved.isEmpty()) {
            return HealthStatus.degraded("registry", "Models without a backend: " + unserved);
        }
        return HealthStatus.up("registry", modelRegistry.models().size() + " models loaded",
                Map.of("maxFallbacks", String.valueOf(modelRegistry.maxFallbacks())));
    }

    private HealthStatus checkClassifier() {
        if (!llmProperties.hasApiKey()) {
            return HealthStatus.degraded("classifier", "No API key; undecided requests default to the agent path");
        }
        return HealthStatus.up("classifier", "Classifier model " + llmProperties.getClassifierModel(),
                Map.of("baseUrl", llmProperties.getBaseUrl()));
    }

    private HealthStatus checkSandbox() {
        if (!sandboxProperties.isConfigured()) {
            return HealthStatus.degraded("sandbox", "Agent runner not configured; agent-path requests will fail");
        }
        return HealthStatus.up("sandbox", "Agent runner at " + sandboxProperties.getBaseUrl(),
                Map.of("agent", sandboxProperties.getAgent()));
    }
}
