package com.example.time.resolver.config;

import com.example.time.resolver.model.TimezoneAliases;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class ResolverConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TimezoneAliases timezoneAliases(TimezoneProperties properties) {
        TimezoneAliases aliases = TimezoneAliases.defaults().withAdditional(properties.getAliases());
        log.info("Loaded {} timezone aliases: {}", aliases.size(), aliases.keys());
        return aliases;
    }
}
