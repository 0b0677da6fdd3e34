package com.switchboard.core.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable descriptor of one backend model.
 *
 * @param id                  opaque backend identifier sent upstream
 * @param displayName         human readable name
 * @param taskCategories      categories this model is eligible for
 * @param priority            lower is preferred
 * @param maxOutputTokens     default max_tokens when the request sets none
 * @param supportsVision      whether the model accepts image input
 * @param callTimeout         per-attempt inactivity timeout
 * @param samplingTemperature default temperature when the request sets none
 * @param backend             backend kind that serves this model (see {@code ModelBackend#kind()})
 */
public record ModelSpec(
    String id,
    String displayName,
    Set<TaskCategory> taskCategories,
    int priority,
    int maxOutputTokens,
    boolean supportsVision,
    Duration callTimeout,
    double samplingTemperature,
    String backend
) {

    public static final String DEFAULT_BACKEND = "openai-compatible";

    public ModelSpec {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Model id must not be blank");
        }
        displayName = displayName == null || displayName.isBlank() ? id : displayName;
        taskCategories = taskCategories == null ? Set.of() : Set.copyOf(taskCategories);
        callTimeout = callTimeout == null ? Duration.ofSeconds(60) : callTimeout;
        backend = backend == null || backend.isBlank() ? DEFAULT_BACKEND : backend;
    }

    public boolean servesCategory(TaskCategory category) {
        return taskCategories.contains(category);
    }
}
