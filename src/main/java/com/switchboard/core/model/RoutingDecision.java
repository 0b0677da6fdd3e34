package com.switchboard.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered candidate chain for one request plus the log of attempts made
 * against it.
 * <p>
 * The candidate list is fixed at construction; a model id never appears twice.
 * The attempt log is append-only and is sealed once a candidate succeeds or
 * every candidate has been attempted.
 */
public final class RoutingDecision {

    private final TaskCategory category;
    private final double confidence;
    private final boolean requiresVision;
    private final ModelSpec primary;
    private final List<ModelSpec> fallbackChain;
    private final List<RoutingAttempt> attempts = new ArrayList<>();
    private boolean sealed;

    public RoutingDecision(TaskCategory category, double confidence, boolean requiresVision,
                           ModelSpec primary, List<ModelSpec> fallbackChain) {
        this.category = Objects.requireNonNull(category, "category");
        this.confidence = confidence;
        this.requiresVision = requiresVision;
        this.primary = Objects.requireNonNull(primary, "primary");
        Set<String> seen = new LinkedHashSet<>();
        seen.add(primary.id());
        List<ModelSpec> chain = new ArrayList<>();
        for (ModelSpec candidate : fallbackChain == null ? List.<ModelSpec>of() : fallbackChain) {
            if (seen.add(candidate.id())) {
                chain.add(candidate);
            }
        }
        this.fallbackChain = List.copyOf(chain);
    }

    public TaskCategory category() {
        return category;
    }

    public double confidence() {
        return confidence;
    }

    public boolean requiresVision() {
        return requiresVision;
    }

    public ModelSpec primary() {
        return primary;
    }

    public List<ModelSpec> fallbackChain() {
        return fallbackChain;
    }

    /**
     * Primary followed by the fallback chain.
     */
    public List<ModelSpec> candidates() {
        var all = new ArrayList<ModelSpec>(fallbackChain.size() + 1);
        all.add(primary);
        all.addAll(fallbackChain);
        return Collections.unmodifiableList(all);
    }

    public synchronized void recordAttempt(RoutingAttempt attempt) {
        if (sealed) {
            throw new IllegalStateException("Routing decision for " + primary.id() + " is already settled");
        }
        attempts.add(attempt);
        if (attempt.succeeded() || attempts.size() >= fallbackChain.size() + 1) {
            sealed = true;
        }
    }

    public synchronized List<RoutingAttempt> attempts() {
        return List.copyOf(attempts);
    }

    public synchronized boolean isSettled() {
        return sealed;
    }

    public synchronized boolean usedFallback() {
        return attempts.size() > 1;
    }

    @Override
    public String toString() {
        return "RoutingDecision[category=" + category + ", primary=" + primary.id()
                + ", fallbacks=" + fallbackChain.stream().map(ModelSpec::id).toList() + "]";
    }
}
