package com.switchboard.core.backend;

import com.switchboard.core.model.ModelSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the {@link ModelBackend} for a model by its backend kind.
 */
@Component
public class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    private final Map<String, ModelBackend> backends = new LinkedHashMap<>();

    public BackendRegistry(List<ModelBackend> backends) {
        for (ModelBackend backend : backends) {
            ModelBackend previous = this.backends.putIfAbsent(backend.kind(), backend);
            if (previous != null) {
                throw new IllegalStateException("Two backends registered for kind '" + backend.kind() + "': "
                        + previous.getClass().getSimpleName() + " and " + backend.getClass().getSimpleName());
            }
        }
        log.info("Registered backends: {}", this.backends.keySet());
    }

    public Optional<ModelBackend> forModel(ModelSpec model) {
        return Optional.ofNullable(backends.get(model.backend()));
    }

    public List<String> kinds() {
        return List.copyOf(backends.keySet());
    }
}
