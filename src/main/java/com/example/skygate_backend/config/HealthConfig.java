package com.example.skygate_backend.config;

import com.example.skygate_backend.engine.Interfaces.ModelRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator modelRegistryHealthIndicator(ModelRegistry registry) {
        return () -> {
            Map<String, Boolean> availability = registry.availability();
            Health.Builder builder = availability.values().stream().allMatch(Boolean::booleanValue)
                    ? Health.up() : Health.down();
            availability.forEach((id, loaded) -> builder.withDetail(id, loaded ? "loaded" : "unavailable"));
            return builder.withDetail("version", registry.version()).build();
        };
    }
}
