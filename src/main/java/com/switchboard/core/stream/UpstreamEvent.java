package com.switchboard.core.stream;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One opaque event from a backend: either an already-parsed JSON record or a
 * raw line (SSE data payload, {@code [DONE]} sentinel, console output).
 */
public record UpstreamEvent(JsonNode json, String raw) {

    public static UpstreamEvent json(JsonNode node) {
        return new UpstreamEvent(Objects.requireNonNull(node, "node"), null);
    }

    public static UpstreamEvent raw(String line) {
        return new UpstreamEvent(null, line == null ? "" : line);
    }

    public boolean isRaw() {
        return json == null;
    }
}
