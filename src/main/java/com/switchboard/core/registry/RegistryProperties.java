package com.switchboard.core.registry;

import com.switchboard.core.model.ModelSpec;
import com.switchboard.core.model.TaskCategory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "switchboard.registry")
public class RegistryProperties {

    private List<Model> models = new ArrayList<>();

    public List<Model> getModels() { return models; }
    public void setModels(List<Model> models) { this.models = models; }

    /**
     * Converts the bound entries into immutable specs. Returns an empty list
     * when nothing is configured.
     */
    public List<ModelSpec> toSpecs() {
        return models.stream().map(Model::toSpec).toList();
    }

    public static class Model {
        private String id;
        private String displayName;
        private List<String> taskCategories = new ArrayList<>();
        private int priority = 100;
        private int maxOutputTokens = 8192;
        private boolean supportsVision;
        private Duration callTimeout = Duration.ofSeconds(60);
        private double samplingTemperature = 0.7;
        private String backend = ModelSpec.DEFAULT_BACKEND;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }
        public List<String> getTaskCategories() { return taskCategories; }
        public void setTaskCategories(List<String> taskCategories) { this.taskCategories = taskCategories; }
        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }
        public int getMaxOutputTokens() { return maxOutputTokens; }
        public void setMaxOutputTokens(int maxOutputTokens) { this.maxOutputTokens = maxOutputTokens; }
        public boolean isSupportsVision() { return supportsVision; }
        public void setSupportsVision(boolean supportsVision) { this.supportsVision = supportsVision; }
        public Duration getCallTimeout() { return callTimeout; }
        public void setCallTimeout(Duration callTimeout) { this.callTimeout = callTimeout; }
        public double getSamplingTemperature() { return samplingTemperature; }
        public void setSamplingTemperature(double samplingTemperature) { this.samplingTemperature = samplingTemperature; }
        public String getBackend() { return backend; }
        public void setBackend(String backend) { this.backend = backend; }

        ModelSpec toSpec() {
            Set<TaskCategory> categories = new LinkedHashSet<>();
            for (String raw : taskCategories) {
                TaskCategory category = TaskCategory.fromWireName(raw);
                if (category == TaskCategory.UNKNOWN && !"unknown".equalsIgnoreCase(raw.trim())) {
                    throw new IllegalArgumentException("Unknown task category '" + raw + "' for model " + id);
                }
                categories.add(category);
            }
            return new ModelSpec(id, displayName, categories, priority, maxOutputTokens,
                    supportsVision, callTimeout, samplingTemperature, backend);
        }
    }
}
