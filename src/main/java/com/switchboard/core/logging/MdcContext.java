package com.switchboard.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Switchboard-specific MDC keys for structured logging.
 */
public final class MdcContext {

    static final String REQUEST_ID = "requestId";
    static final String PATH = "path";
    static final String MODEL = "model";

    private MdcContext() {}

    public static void setRequest(String requestId) {
        MDC.put(REQUEST_ID, requestId);
    }

    public static void setPath(String requestId, boolean agentPath) {
        MDC.put(REQUEST_ID, requestId);
        MDC.put(PATH, agentPath ? "agent" : "fast");
    }

    public static void setModel(String requestId, String modelId) {
        MDC.put(REQUEST_ID, requestId);
        MDC.put(MODEL, modelId);
    }

    public static void clear() {
        MDC.remove(REQUEST_ID);
        MDC.remove(PATH);
        MDC.remove(MODEL);
    }
}
