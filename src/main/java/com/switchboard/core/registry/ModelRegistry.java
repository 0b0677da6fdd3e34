package com.switchboard.core.registry;

import com.switchboard.core.model.ModelSpec;
import com.switchboard.core.model.TaskCategory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, priority-ordered catalogue of backend models.
 * <p>
 * Built once at startup and shared read-only across requests; no method
 * mutates state, so concurrent reads need no synchronization.
 */
public final class ModelRegistry {

    public static final int DEFAULT_MAX_FALLBACKS = 3;

    private final List<ModelSpec> models;
    private final int maxFallbacks;

    public ModelRegistry(List<ModelSpec> models) {
        this(models, DEFAULT_MAX_FALLBACKS);
    }

    public ModelRegistry(List<ModelSpec> models, int maxFallbacks) {
        if (models == null || models.isEmpty()) {
            throw new IllegalArgumentException("Model registry needs at least one model");
        }
        if (maxFallbacks < 0) {
            throw new IllegalArgumentException("maxFallbacks must be >= 0");
        }
        Set<String> ids = new HashSet<>();
        for (ModelSpec spec : models) {
            if (!ids.add(spec.id())) {
                throw new IllegalArgumentException("Duplicate model id in registry: " + spec.id());
            }
        }
        var sorted = new ArrayList<>(models);
        sorted.sort(Comparator.comparingInt(ModelSpec::priority));
        this.models = List.copyOf(sorted);
        this.maxFallbacks = maxFallbacks;
        if (models().stream().noneMatch(m -> m.servesCategory(TaskCategory.GENERAL_TEXT))) {
            throw new IllegalArgumentException("Model registry needs a general_text model");
        }
    }

    /**
     * All models, lowest priority value first.
     */
    public List<ModelSpec> models() {
        return models;
    }

    public int maxFallbacks() {
        return maxFallbacks;
    }

    public Optional<ModelSpec> findById(String id) {
        return models.stream().filter(m -> m.id().equals(id)).findFirst();
    }

    /**
     * Lowest-priority model eligible for {@code category}, or the preferred
     * general_text model when none is.
     */
    public ModelSpec getModelForTask(TaskCategory category) {
        return models.stream()
                .filter(m -> m.servesCategory(category))
                .findFirst()
                .orElseGet(this::generalModel);
    }

    /**
     * Like {@link #getModelForTask(TaskCategory)} but never returns a model whose
     * vision support differs from {@code requiresVision}. Falls back to any
     * matching-modality model when the category has none.
     *
     * @throws IllegalStateException when the registry has no model of the required modality
     */
    public ModelSpec getModelForTask(TaskCategory category, boolean requiresVision) {
        return models.stream()
                .filter(m -> m.supportsVision() == requiresVision)
                .filter(m -> m.servesCategory(category))
                .findFirst()
                .or(() -> models.stream()
                        .filter(m -> m.supportsVision() == requiresVision)
                        .filter(m -> m.servesCategory(TaskCategory.GENERAL_TEXT))
                        .findFirst())
                .or(() -> models.stream()
                        .filter(m -> m.supportsVision() == requiresVision)
                        .findFirst())
                .orElseThrow(() -> new IllegalStateException(
                        "No " + (requiresVision ? "vision" : "text-only") + " model registered"));
    }

    /**
     * Up to {@link #maxFallbacks()} models other than {@code primaryId}, with
     * the same vision support as {@code requiresVision}, in priority order.
     */
    public List<ModelSpec> getFallbackModels(String primaryId, boolean requiresVision) {
        return models.stream()
                .filter(m -> !m.id().equals(primaryId))
                .filter(m -> m.supportsVision() == requiresVision)
                .limit(maxFallbacks)
                .toList();
    }

    private ModelSpec generalModel() {
        return models.stream()
                .filter(m -> m.servesCategory(TaskCategory.GENERAL_TEXT))
                .findFirst()
                .orElseThrow();
    }
}
