package com.example.time.resolver.controller;

import com.example.time.resolver.config.ServiceInfoProperties;
import com.example.time.resolver.dto.HealthStatus;
import com.example.time.resolver.dto.ServiceInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Root and health endpoints. Health has no dependencies to check: the resolver
 * calls nothing downstream, so it is healthy whenever it can answer.
 */
@RestController
@RequiredArgsConstructor
public class ServiceInfoController {

    private final ServiceInfoProperties serviceInfo;
    private final Clock clock;

    @GetMapping("/")
    public Mono<ServiceInfo> info() {
        return Mono.just(new ServiceInfo(serviceInfo.getName(), serviceInfo.getVersion(), serviceInfo.getDescription()));
    }

    @GetMapping("/health")
    public Mono<HealthStatus> health() {
        return Mono.fromSupplier(() -> HealthStatus.healthy(serviceInfo.getName(), clock.instant()));
    }
}
