package com.switchboard.core.stream;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "switchboard.stream")
public class StreamProperties {

    /** Upstream silence after which the stream is closed with {@code Done("incomplete")}. */
    private Duration idleTimeout = Duration.ofSeconds(120);

    /** Agent heartbeats become progress notes only after this much time without content. */
    private Duration heartbeatProgressAfter = Duration.ofSeconds(10);

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public void setIdleTimeout(Duration idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    public Duration getHeartbeatProgressAfter() {
        return heartbeatProgressAfter;
    }

    public void setHeartbeatProgressAfter(Duration heartbeatProgressAfter) {
        this.heartbeatProgressAfter = heartbeatProgressAfter;
    }
}
