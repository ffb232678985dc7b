package com.example.time.gateway.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.net.URI;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    ConfigurationPropertiesAutoConfiguration.class, ValidationAutoConfiguration.class))
            .withUserConfiguration(Config.class);

    @Test
    void bindsResolverSettings() {
        contextRunner
                .withPropertyValues(
                        "gateway.resolver.url=http://api2:4000",
                        "gateway.resolver.timeout=5s",
                        "gateway.resolver.connect-timeout=250ms")
                .run(context -> {
                    GatewayProperties properties = context.getBean(GatewayProperties.class);
                    assertThat(properties.getUrl()).isEqualTo(URI.create("http://api2:4000"));
                    assertThat(properties.getTimeout()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(properties.getConnectTimeout()).isEqualTo(Duration.ofMillis(250));
                });
    }

    @Test
    void missingUrlFailsStartup() {
        contextRunner
                .withPropertyValues("gateway.resolver.timeout=5s", "gateway.resolver.connect-timeout=1s")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void zeroTimeoutFailsStartup() {
        contextRunner
                .withPropertyValues(
                        "gateway.resolver.url=http://api2:4000",
                        "gateway.resolver.timeout=0s",
                        "gateway.resolver.connect-timeout=1s")
                .run(context -> assertThat(context).hasFailed());
    }

    @EnableConfigurationProperties(GatewayProperties.class)
    private static class Config {}
}
