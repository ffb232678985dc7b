package com.example.time.resolver.config;

import lombok.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * Extra timezone aliases layered over the built-in table, e.g.
 * {@code resolver.timezone.aliases.JST=Asia/Tokyo}.
 */
@Value
@ConfigurationProperties(prefix = "resolver.timezone")
public class TimezoneProperties {
    Map<String, String> aliases;

    public TimezoneProperties(Map<String, String> aliases) {
        this.aliases = aliases == null ? Map.of() : Map.copyOf(aliases);
    }
}
