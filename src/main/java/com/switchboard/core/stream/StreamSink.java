package com.switchboard.core.stream;

/**
 * Downstream consumer of normalized events, in emission order. The SSE
 * writer and the terminal printer are the two sinks.
 */
@FunctionalInterface
public interface StreamSink {

    void accept(StreamEvent event);
}
