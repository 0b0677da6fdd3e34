package com.switchboard.core.registry;

import com.switchboard.core.routing.RoutingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RegistryConfig {

    private static final Logger log = LoggerFactory.getLogger(RegistryConfig.class);

    @Bean
    public ModelRegistry modelRegistry(RegistryProperties properties, RoutingProperties routingProperties) {
        var configured = properties.toSpecs();
        var specs = configured.isEmpty() ? DefaultModels.CATALOGUE : configured;
        var registry = new ModelRegistry(specs, routingProperties.getMaxFallbacks());
        log.info("Model registry loaded: {} models ({}), maxFallbacks={}",
                registry.models().size(), configured.isEmpty() ? "built-in catalogue" : "configured",
                registry.maxFallbacks());
        return registry;
    }
}
