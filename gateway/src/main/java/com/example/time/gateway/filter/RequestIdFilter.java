package com.example.time.gateway.filter;

import com.example.time.gateway.util.RequestValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Assigns the correlation id for every inbound request before any handler runs.
 * <p>
 * An {@code X-Request-Id} from the client is kept when it is visible ASCII, otherwise a
 * UUID-v4 is minted.
 * The id is stored as an exchange attribute, returned as a response header and
 * included in the access log line.
 */
@Component
@Slf4j
public class RequestIdFilter implements WebFilter, Ordered {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String REQUEST_ID_ATTRIBUTE = RequestIdFilter.class.getName() + ".requestId";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        long start = System.nanoTime();
        String inbound = exchange.getRequest().getHeaders().getFirst(REQUEST_ID_HEADER);
        String candidate = inbound != null ? inbound.trim() : null;
        String requestId = RequestValues.isHeaderSafe(candidate) ? candidate : UUID.randomUUID().toString();

        exchange.getAttributes().put(REQUEST_ID_ATTRIBUTE, requestId);
        exchange.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);

        String method = exchange.getRequest().getMethod().name();
        String path = exchange.getRequest().getPath().value();

        return chain.filter(exchange)
                .doFinally(signal -> {
                    HttpStatusCode status = exchange.getResponse().getStatusCode();
                    log.info("{} {} status={} durationMs={} requestId={}",
                            method, path, status != null ? status.value() : 200,
                            (System.nanoTime() - start) / 1_000_000, requestId);
                });
    }

    /**
     * Correlation id assigned to this exchange, or a fresh one if the filter did not run.
     */
    public static String requestIdOf(ServerWebExchange exchange) {
        String requestId = exchange.getAttribute(REQUEST_ID_ATTRIBUTE);
        return requestId != null ? requestId : UUID.randomUUID().toString();
    }

    @Override
    public int getOrder() {
        return HIGHEST_PRECEDENCE;
    }
}
