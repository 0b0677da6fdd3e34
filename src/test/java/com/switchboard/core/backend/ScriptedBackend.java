package com.switchboard.core.backend;

import com.switchboard.core.model.ChatRequest;
import com.switchboard.core.model.ModelSpec;
import com.switchboard.core.stream.UpstreamEvent;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Test backend that replays a scripted flux per model id.
 */
public class ScriptedBackend implements ModelBackend {

    private final String kind;
    private final boolean vision;
    private final Map<String, Supplier<Flux<UpstreamEvent>>> scripts = new ConcurrentHashMap<>();
    private final List<String> invocations = new CopyOnWriteArrayList<>();

    public ScriptedBackend() {
        this(ModelSpec.DEFAULT_BACKEND, true);
    }

    public ScriptedBackend(String kind, boolean vision) {
        this.kind = kind;
        this.vision = vision;
    }

    public ScriptedBackend on(String modelId, Supplier<Flux<UpstreamEvent>> script) {
        scripts.put(modelId, script);
        return this;
    }

    public ScriptedBackend onLines(String modelId, String... lines) {
        return on(modelId, () -> Flux.fromArray(lines).map(UpstreamEvent::raw));
    }

    public List<String> invocations() {
        return invocations;
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public boolean supportsVision() {
        return vision;
    }

    @Override
    public boolean emitsReasoning() {
        return true;
    }

    @Override
    public Flux<UpstreamEvent> invoke(ModelSpec model, ChatRequest request) {
        invocations.add(model.id());
        Supplier<Flux<UpstreamEvent>> script = scripts.get(model.id());
        if (script == null) {
            return Flux.error(new IllegalStateException("No script for " + model.id()));
        }
        return script.get();
    }
}
