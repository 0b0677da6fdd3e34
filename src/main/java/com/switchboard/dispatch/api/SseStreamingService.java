package com.switchboard.dispatch.api;

import com.switchboard.core.stream.StreamEvent;
import com.switchboard.core.stream.StreamSink;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges a normalized event stream to an {@link SseEmitter} as
 * OpenAI-compatible chunk frames ending in {@code data: [DONE]}.
 * <p>
 * The stream subscription lives exactly as long as the emitter: completion,
 * timeout or a failed write (client disconnected) disposes it, which cancels
 * the pipeline upstream.
 * <p>
 * Streams that have been quiet for a heartbeat interval get an SSE comment
 * so that proxies do not drop them while an agent is working.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Long enough for a full agent run. */
    private static final long DEFAULT_TIMEOUT_MS = TimeUnit.MINUTES.toMillis(30);

    private static final long HEARTBEAT_INTERVAL_SECONDS = 15;

    static final String DONE_FRAME = "[DONE]";

    private final ChunkEncoder encoder;
    private final long timeoutMs;

    private final Map<String, StreamRegistration> streams = new ConcurrentHashMap<>();

    private final ScheduledExecutorService heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "sse-heartbeat");
        thread.setDaemon(true);
        return thread;
    });

    @Autowired
    public SseStreamingService(ChunkEncoder encoder) {
        this(encoder, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(ChunkEncoder encoder, long timeoutMs) {
        this.encoder = encoder;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeats.scheduleWithFixedDelay(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeats.shutdownNow();
        streams.values().forEach(registration -> registration.subscription().dispose());
        log.info("SSE streaming stopped, {} open stream(s) cancelled", streams.size());
        streams.clear();
    }

    /**
     * Sends a keepalive comment to every stream that has not written anything
     * for a full interval.
     */
    void sendHeartbeats() {
        long idleBefore = System.nanoTime() - TimeUnit.SECONDS.toNanos(HEARTBEAT_INTERVAL_SECONDS);
        for (StreamRegistration registration : streams.values()) {
            if (registration.lastWriteNanos() > idleBefore) {
                continue;
            }
            try {
                registration.emitter().send(SseEmitter.event().comment("keepalive"));
                registration.touch();
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat to {} failed: {}", registration.requestId(), e.getMessage());
            }
        }
    }

    /**
     * Subscribes to {@code events} and forwards each one to a new emitter.
     *
     * @param model value reported in every chunk's {@code model} field
     */
    public SseEmitter stream(String requestId, String model, Flux<StreamEvent> events) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        var registration = new StreamRegistration(requestId, emitter, Disposables.swap());
        streams.put(requestId, registration);

        emitter.onCompletion(() -> release(registration, "completed"));
        emitter.onTimeout(() -> release(registration, "timed out"));
        emitter.onError(e -> release(registration, "failed: " + e.getMessage()));

        registration.send(encoder.roleChunk(requestId, model));
        StreamSink sink = event -> registration.send(encoder.encode(requestId, model, event));
        registration.subscription().update(events.subscribe(
                sink::accept,
                error -> {
                    log.debug("Stream {} ended with {}", requestId, error.toString());
                    emitter.completeWithError(error);
                },
                () -> {
                    try {
                        registration.send(DONE_FRAME);
                        emitter.complete();
                    } catch (UncheckedIOException e) {
                        emitter.completeWithError(e.getCause());
                    }
                }));
        return emitter;
    }

    /**
     * Number of streams whose emitter has not completed yet.
     */
    public int activeEmitterCount() {
        return streams.size();
    }

    private void release(StreamRegistration registration, String how) {
        registration.subscription().dispose();
        streams.remove(registration.requestId(), registration);
        log.debug("SSE stream {} {}", registration.requestId(), how);
    }

    private static final class StreamRegistration {

        private final String requestId;
        private final SseEmitter emitter;
        private final Disposable.Swap subscription;
        private volatile long lastWriteNanos = System.nanoTime();

        StreamRegistration(String requestId, SseEmitter emitter, Disposable.Swap subscription) {
            this.requestId = requestId;
            this.emitter = emitter;
            this.subscription = subscription;
        }

        String requestId() {
            return requestId;
        }

        SseEmitter emitter() {
            return emitter;
        }

        Disposable.Swap subscription() {
            return subscription;
        }

        long lastWriteNanos() {
            return lastWriteNanos;
        }

        void touch() {
            lastWriteNanos = System.nanoTime();
        }

        void send(Object data) {
            try {
                emitter.send(SseEmitter.event().data(data));
                touch();
            } catch (IOException e) {
                throw new UncheckedIOException("Client connection closed", e);
            }
        }
    }
}
