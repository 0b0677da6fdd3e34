package com.switchboard.core.backend;

import com.switchboard.core.model.ChatRequest;
import com.switchboard.core.model.ModelSpec;
import com.switchboard.core.stream.UpstreamEvent;
import reactor.core.publisher.Flux;

/**
 * One kind of backend that can serve a {@link ModelSpec}: a direct model API,
 * a sandboxed agent runner, and so on.
 * <p>
 * Implementations never translate events themselves; the stream normalizer
 * handles every shape they emit. Failures before the first event surface as
 * {@link com.switchboard.core.routing.UpstreamException} so the routing
 * engine can decide whether to fall back.
 */
public interface ModelBackend {

    /**
     * Matches {@link ModelSpec#backend()} of the models this backend serves.
     */
    String kind();

    boolean supportsVision();

    boolean emitsReasoning();

    /**
     * Starts one call. Nothing is sent until the returned flux is subscribed;
     * cancelling the subscription tears the call down.
     */
    Flux<UpstreamEvent> invoke(ModelSpec model, ChatRequest request);
}
