package com.switchboard.core.stream;

import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;

/**
 * Turns a backend's raw event feed into one canonical, ordered
 * {@link StreamEvent} sequence ending in exactly one terminal event.
 * <p>
 * Each subscription gets its own {@link StreamEventTranslator}. Upstream is
 * pulled one event at a time and cancelled as soon as the terminal event is
 * emitted or the subscriber goes away.
 */
@Component
public class StreamNormalizer {

    private final Duration idleTimeout;
    private final Duration heartbeatProgressAfter;
    private final Clock clock;

    public StreamNormalizer(StreamProperties properties) {
        this(properties, Clock.systemUTC());
    }

    StreamNormalizer(StreamProperties properties, Clock clock) {
        this.idleTimeout = properties.getIdleTimeout();
        this.heartbeatProgressAfter = properties.getHeartbeatProgressAfter();
        this.clock = clock;
    }

    public Flux<StreamEvent> normalize(Flux<UpstreamEvent> source) {
        return Flux.defer(() -> {
            var translator = new StreamEventTranslator(heartbeatProgressAfter, clock);
            return source
                    .timeout(idleTimeout)
                    .concatMapIterable(translator::translate, 1)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(translator.close())))
                    .onErrorResume(error -> Flux.fromIterable(translator.fail(error)))
                    .takeUntil(StreamEvent::isTerminal);
        });
    }
}
