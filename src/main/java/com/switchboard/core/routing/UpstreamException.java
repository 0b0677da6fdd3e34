package com.switchboard.core.routing;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * A backend call failed. The {@link Kind} decides whether the routing engine
 * may move on to the next candidate.
 */
public class UpstreamException extends RuntimeException {

    public enum Kind {
        RATE_LIMITED("rate_limited", true),
        SERVER_ERROR("server_error", true),
        TIMEOUT("timeout", true),
        TRANSPORT("transport_error", true),
        PROTOCOL("protocol_error", true),
        REQUEST_REJECTED("request_rejected", false);

        private final String label;
        private final boolean transientFailure;

        Kind(String label, boolean transientFailure) {
            this.label = label;
            this.transientFailure = transientFailure;
        }

        public String label() {
            return label;
        }
    }

    private final Kind kind;
    private final String modelId;
    private final int status;

    public UpstreamException(Kind kind, String modelId, int status, String message) {
        super(message);
        this.kind = kind;
        this.modelId = modelId;
        this.status = status;
    }

    public UpstreamException(Kind kind, String modelId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.modelId = modelId;
        this.status = 0;
    }

    public Kind kind() {
        return kind;
    }

    public String modelId() {
        return modelId;
    }

    /**
     * HTTP status of the failed call, or 0 when no response was received.
     */
    public int status() {
        return status;
    }

    public boolean isTransient() {
        return kind.transientFailure;
    }

    /**
     * Maps an HTTP status to a failure kind: 429 is rate limiting, 5xx is a
     * server error, anything else is a rejected request.
     */
    public static Kind kindForStatus(int status) {
        if (status == 429) {
            return Kind.RATE_LIMITED;
        }
        if (status >= 500) {
            return Kind.SERVER_ERROR;
        }
        return Kind.REQUEST_REJECTED;
    }

    /**
     * Normalizes any failure raised while calling {@code modelId}.
     */
    public static UpstreamException classify(String modelId, Throwable error) {
        if (error instanceof UpstreamException upstream) {
            return upstream;
        }
        if (error instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            return new UpstreamException(kindForStatus(status), modelId, status,
                    "HTTP " + status + " from " + modelId);
        }
        if (error instanceof TimeoutException) {
            return new UpstreamException(Kind.TIMEOUT, modelId,
                    "No response from " + modelId + " within its call timeout", error);
        }
        if (error instanceof WebClientRequestException || error instanceof IOException) {
            return new UpstreamException(Kind.TRANSPORT, modelId,
                    "Transport failure calling " + modelId + ": " + error.getMessage(), error);
        }
        return new UpstreamException(Kind.TRANSPORT, modelId,
                error.getClass().getSimpleName() + " calling " + modelId + ": " + error.getMessage(), error);
    }
}
