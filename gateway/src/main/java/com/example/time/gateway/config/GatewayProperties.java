package com.example.time.gateway.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import lombok.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.time.Duration;

/**
 * Downstream resolver settings, bound once at startup and never changed.
 */
@Value
@Validated
@ConfigurationProperties(prefix = "gateway.resolver")
public class GatewayProperties {

    /** Base URL of the resolver, e.g. {@code http://api2:4000}. */
    @NotNull
    URI url;

    /** Upper bound for one resolver call, connect included. */
    @NotNull
    Duration timeout;

    @NotNull
    Duration connectTimeout;

    @AssertTrue(message = "timeouts must be positive")
    public boolean isTimeoutPositive() {
        return timeout == null || connectTimeout == null
                || (!timeout.isNegative() && !timeout.isZero() && !connectTimeout.isNegative() && !connectTimeout.isZero());
    }
}
