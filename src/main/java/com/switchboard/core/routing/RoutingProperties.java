package com.switchboard.core.routing;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "switchboard.routing")
public class RoutingProperties {

    /** Maximum number of fallback candidates after the primary model. */
    private int maxFallbacks = 3;

    public int getMaxFallbacks() {
        return maxFallbacks;
    }

    public void setMaxFallbacks(int maxFallbacks) {
        this.maxFallbacks = maxFallbacks;
    }
}
