package com.example.time.resolver.filter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Logs one access line per request together with its correlation id.
 * <p>
 * The resolver only echoes ids it receives; when the caller sends none, the
 * time endpoint mints one and writes the response header itself.
 */
@Component
@Slf4j
public class RequestIdFilter implements WebFilter, Ordered {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        long start = System.nanoTime();
        String method = exchange.getRequest().getMethod().name();
        String path = exchange.getRequest().getPath().value();

        return chain.filter(exchange)
                .doFinally(signal -> {
                    HttpStatusCode status = exchange.getResponse().getStatusCode();
                    String requestId = exchange.getResponse().getHeaders().getFirst(REQUEST_ID_HEADER);
                    log.info("{} {} status={} durationMs={} requestId={}",
                            method, path, status != null ? status.value() : 200,
                            (System.nanoTime() - start) / 1_000_000, requestId);
                });
    }

    @Override
    public int getOrder() {
        return HIGHEST_PRECEDENCE;
    }
}
