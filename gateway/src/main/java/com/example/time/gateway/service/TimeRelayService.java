package com.example.time.gateway.service;

import com.example.time.gateway.client.ResolverClient;
import com.example.time.gateway.dto.TimeResponse;
import com.example.time.gateway.exception.ResolverException;
import com.example.time.gateway.util.RequestValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Relays a time request to the resolver and re-attributes the answer as relayed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimeRelayService {

    public static final String SOURCE = "api1->api2";

    private final ResolverClient resolverClient;

    public Mono<TimeResponse> relay(String timezone, String requestId) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            log.info("Received time request requestId={} timezone={}", requestId, RequestValues.forLog(timezone));

            return resolverClient.fetchTime(timezone, requestId)
                    .map(body -> body.attributedTo(SOURCE))
                    .doOnNext(body -> log.info("Relayed resolver response requestId={} timestamp={} durationMs={}",
                            requestId, body.getTimestamp(), elapsedMs(start)))
                    .doOnError(ResolverException.class, e -> log.error(
                            "Resolver call failed requestId={} kind={} durationMs={}: {}",
                            requestId, e.getKind(), elapsedMs(start), e.getMessage()));
        });
    }

    private static long elapsedMs(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }
}
