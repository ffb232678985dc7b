package com.example.time.resolver.controller;

import com.example.time.resolver.dto.TimeResponse;
import com.example.time.resolver.filter.RequestIdFilter;
import com.example.time.resolver.service.TimeResolverService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequiredArgsConstructor
public class TimeController {

    private final TimeResolverService timeResolverService;

    /**
     * The correlation id is taken from the {@code X-Request-Id} header, then from the
     * {@code request_id} parameter.
     */
    @GetMapping("/time")
    public Mono<ResponseEntity<TimeResponse>> getTime(
            @RequestParam(required = false) String timezone,
            @RequestParam(name = "request_id", required = false) String requestIdParam,
            @RequestHeader(name = RequestIdFilter.REQUEST_ID_HEADER, required = false) String requestIdHeader) {
        return Mono.fromSupplier(() -> {
            String requestId = StringUtils.hasText(requestIdHeader) ? requestIdHeader : requestIdParam;
            TimeResponse response = timeResolverService.resolve(timezone, requestId);
            return ResponseEntity.ok()
                    .header(RequestIdFilter.REQUEST_ID_HEADER, response.getRequestId())
                    .body(response);
        });
    }
}
