package com.example.time.gateway.controller;

import com.example.time.gateway.dto.TimeResponse;
import com.example.time.gateway.filter.RequestIdFilter;
import com.example.time.gateway.service.TimeRelayService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

@RestController
@RequiredArgsConstructor
public class TimeController {

    private final TimeRelayService timeRelayService;

    @GetMapping("/time")
    public Mono<TimeResponse> getTime(@RequestParam(required = false) String timezone, ServerWebExchange exchange) {
        return timeRelayService.relay(timezone, RequestIdFilter.requestIdOf(exchange));
    }
}
