package com.switchboard.core.llm;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ClassificationClient} backed by {@link LlmService}.
 * <p>
 * Each call runs on a bounded daemon pool so the caller can stop waiting
 * after the timeout. A call that times out, or whose caller is interrupted,
 * is cancelled with an interrupt. When the pool and its queue are full the
 * call is refused at once, which the classifiers treat as a failed call.
 */
@Component
public class LlmClassificationClient implements ClassificationClient {

    private static final Logger log = LoggerFactory.getLogger(LlmClassificationClient.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    static final int DEFAULT_MAX_CONCURRENT_CALLS = 16;
    static final int DEFAULT_QUEUE_CAPACITY = 64;

    private final LlmService llmService;
    private final ThreadPoolExecutor executor;

    public LlmClassificationClient(LlmService llmService) {
        this(llmService, DEFAULT_MAX_CONCURRENT_CALLS, DEFAULT_QUEUE_CAPACITY);
    }

    LlmClassificationClient(LlmService llmService, int maxConcurrentCalls, int queueCapacity) {
        this.llmService = llmService;
        this.executor = new ThreadPoolExecutor(maxConcurrentCalls, maxConcurrentCalls,
                30, TimeUnit.SECONDS, new ArrayBlockingQueue<>(queueCapacity), r -> {
                    Thread t = new Thread(r, "classifier-call-" + THREAD_COUNTER.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }, new ThreadPoolExecutor.AbortPolicy());
        this.executor.allowCoreThreadTimeOut(true);
    }

    @Override
    public <T> T decide(String systemPrompt, String userPrompt, Class<T> decisionType, Duration timeout) {
        if (!llmService.hasCredentials()) {
            throw new ClassificationNoCredentialsException();
        }
        Future<T> call;
        try {
            call = executor.submit(() -> llmService.structuredCall(systemPrompt, userPrompt, decisionType));
        } catch (RejectedExecutionException e) {
            throw new ClassificationException("overloaded",
                    "Classification pool saturated (" + executor.getActiveCount() + " calls in flight)", e);
        }
        try {
            T decision = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (decision == null) {
                throw new ClassificationException("empty_decision",
                        "Classifier produced no " + decisionType.getSimpleName());
            }
            return decision;
        } catch (TimeoutException e) {
            call.cancel(true);
            log.debug("Cancelled {} call after {}ms", decisionType.getSimpleName(), timeout.toMillis());
            throw new ClassificationTimeoutException(llmService.classifierModel(), timeout);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new ClassificationException("interrupted", "Classification call interrupted", e);
        } catch (CancellationException e) {
            throw new ClassificationException("cancelled", "Classification call cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof LlmParseException parse) {
                log.debug("Unparseable {} answer: '{}'", parse.outputType().getSimpleName(), parse.excerpt());
                throw new ClassificationException("parse_error", cause.getMessage(), cause);
            }
            if (cause instanceof LlmEmptyResponseException) {
                throw new ClassificationException("empty_response", cause.getMessage(), cause);
            }
            throw new ClassificationException("transport_error",
                    cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
        log.debug("Classification executor stopped");
    }
}
