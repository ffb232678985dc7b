package com.example.time.gateway.config;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;

@Slf4j
@Configuration
public class GatewayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Client for the resolver. No retry filter is installed: a failed call fails the
     * inbound request.
     */
    @Bean
    public WebClient resolverWebClient(WebClient.Builder builder, GatewayProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.getConnectTimeout().toMillis())
                .responseTimeout(properties.getTimeout());

        log.info("Resolver client configured url={} timeout={} connectTimeout={}",
                properties.getUrl(), properties.getTimeout(), properties.getConnectTimeout());

        return builder
                .baseUrl(StringUtils.trimTrailingCharacter(properties.getUrl().toString(), '/'))
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
