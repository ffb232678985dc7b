package com.example.time.resolver.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Static identity of this tier, reported by {@code GET /} and {@code GET /health}.
 */
@Value
@Validated
@ConfigurationProperties(prefix = "service.info")
public class ServiceInfoProperties {
    @NotBlank
    String name;
    @NotBlank
    String version;
    @NotBlank
    String description;
}
