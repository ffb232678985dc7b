package com.example.time.gateway.controller;

import com.example.time.gateway.config.ServiceInfoProperties;
import com.example.time.gateway.dto.HealthStatus;
import com.example.time.gateway.dto.ServiceInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Root and health endpoints. Health reports this process only and never calls the
 * resolver; startup ordering against the resolver is the orchestrator's job.
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
