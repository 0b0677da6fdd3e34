package com.switchboard.core.stream;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-request state of one {@link StreamEventTranslator}. Never shared between requests.
 */
public final class NormalizerState {

    public enum Lifecycle { STARTED, STREAMING, COMPLETED, FAILED }

    private final Instant startedAt;
    private Lifecycle lifecycle = Lifecycle.STARTED;
    private boolean emittedContent;
    private boolean sawIncrementalDelta;
    private final List<String> consoleOutput = new ArrayList<>();

    NormalizerState(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Lifecycle lifecycle() {
        return lifecycle;
    }

    /**
     * True once any visible content has been emitted to the caller.
     */
    public boolean emittedContent() {
        return emittedContent;
    }

    /**
     * True once a token-level content delta has been seen, as opposed to a
     * whole assistant message block.
     */
    public boolean sawIncrementalDelta() {
        return sawIncrementalDelta;
    }

    /**
     * Console lines the agent printed, in arrival order. Shown as the answer
     * when the agent never produced content of its own.
     */
    public String consoleOutput() {
        return String.join("\n", consoleOutput);
    }

    public boolean isFinished() {
        return lifecycle == Lifecycle.COMPLETED || lifecycle == Lifecycle.FAILED;
    }

    void markParsed() {
        if (lifecycle == Lifecycle.STARTED) {
            lifecycle = Lifecycle.STREAMING;
        }
    }

    void markContentEmitted() {
        emittedContent = true;
    }

    void appendConsoleOutput(String line) {
        consoleOutput.add(line);
    }

    void markIncrementalDelta() {
        sawIncrementalDelta = true;
    }

    void finish(StreamEvent terminal) {
        if (isFinished()) {
            throw new IllegalStateException("Stream already " + lifecycle);
        }
        lifecycle = terminal instanceof StreamEvent.Error ? Lifecycle.FAILED : Lifecycle.COMPLETED;
    }
}
