package com.example.time.gateway.client;

import com.example.time.gateway.config.GatewayProperties;
import com.example.time.gateway.dto.TimeResponse;
import com.example.time.gateway.exception.ResolverException;
import com.example.time.gateway.exception.ResolverException.FailureKind;
import com.example.time.gateway.filter.RequestIdFilter;
import com.example.time.gateway.util.RequestValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.CodecException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.UnsupportedMediaTypeException;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Single-shot HTTP call to the resolver's {@code /time} endpoint.
 * <p>
 * Every failure surfaces as a {@link ResolverException}; the client never retries,
 * caches, or substitutes a locally computed time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResolverClient {

    private final WebClient resolverWebClient;
    private final GatewayProperties properties;

    /**
     * @param timezone  timezone as the client sent it, omitted downstream when {@code null}
     * @param requestId correlation id sent as {@code X-Request-Id} and {@code request_id}
     */
    public Mono<TimeResponse> fetchTime(String timezone, String requestId) {
        Map<String, Object> uriVariables = new HashMap<>();
        uriVariables.put("requestId", requestId);
        if (timezone != null) {
            uriVariables.put("timezone", timezone);
        }

        log.debug("Forwarding request to resolver requestId={} url={} timezone={}",
                requestId, properties.getUrl(), RequestValues.forLog(timezone));

        return resolverWebClient.get()
                .uri(builder -> {
                    builder.path("/time");
                    if (timezone != null) {
                        builder.queryParam("timezone", "{timezone}");
                    }
                    return builder.queryParam("request_id", "{requestId}").build(uriVariables);
                })
                .header(RequestIdFilter.REQUEST_ID_HEADER, requestId)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(TimeResponse.class)
                .timeout(properties.getTimeout())
                .onErrorMap(error -> translate(error, requestId))
                .switchIfEmpty(Mono.error(() ->
                        new ResolverException(FailureKind.BAD_RESPONSE, requestId, "Resolver returned an empty body")))
                .flatMap(body -> validate(body, requestId));
    }

    private Mono<TimeResponse> validate(TimeResponse body, String requestId) {
        if (body.getTimestamp() == null || body.getTimezone() == null || body.getRequestId() == null) {
            return Mono.error(new ResolverException(FailureKind.BAD_RESPONSE, requestId,
                    "Resolver response is missing required fields"));
        }
        if (!requestId.equals(body.getRequestId())) {
            log.warn("Resolver answered with a different request id requestId={} resolverRequestId={}",
                    requestId, body.getRequestId());
        }
        return Mono.just(body);
    }

    static ResolverException translate(Throwable error, String requestId) {
        if (error instanceof ResolverException) {
            return (ResolverException) error;
        }
        if (isTimeout(error)) {
            return new ResolverException(FailureKind.TIMEOUT, requestId, "Resolver did not answer in time", error);
        }
        if (hasCause(error, CodecException.class) || hasCause(error, UnsupportedMediaTypeException.class)) {
            return new ResolverException(FailureKind.BAD_RESPONSE, requestId,
                    "Failed to parse response from resolver", error);
        }
        if (error instanceof WebClientResponseException) {
            // body extraction failures on a 2xx are wrapped with the original status
            WebClientResponseException response = (WebClientResponseException) error;
            if (response.getStatusCode().is2xxSuccessful()) {
                return new ResolverException(FailureKind.BAD_RESPONSE, requestId,
                        "Failed to parse response from resolver", error);
            }
            return new ResolverException(FailureKind.BAD_STATUS, requestId,
                    "Resolver returned status: " + response.getStatusCode().value(), error);
        }
        if (error instanceof WebClientRequestException) {
            return new ResolverException(FailureKind.UNAVAILABLE, requestId, "Failed to connect to resolver", error);
        }
        return new ResolverException(FailureKind.UNAVAILABLE, requestId,
                "Resolver call failed: " + error.getMessage(), error);
    }

    private static boolean isTimeout(Throwable error) {
        return hasCause(error, TimeoutException.class) || hasCause(error, io.netty.handler.timeout.TimeoutException.class);
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (type.isInstance(cause)) {
                return true;
            }
        }
        return false;
    }
}
