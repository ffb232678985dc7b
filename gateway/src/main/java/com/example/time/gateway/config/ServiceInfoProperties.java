package com.example.time.gateway.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

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
