package com.example.time.gateway.exception;

import com.example.time.gateway.dto.ErrorResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;

/**
 * Maps resolver failures to an {@link ErrorResponse}; never to a partial time response.
 */
@RestControllerAdvice
@RequiredArgsConstructor
public class GatewayExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(ResolverException.class)
    public ResponseEntity<ErrorResponse> handleResolverFailure(ResolverException e) {
        ResolverException.FailureKind kind = e.getKind();
        ErrorResponse body = new ErrorResponse(kind.code(), e.getMessage(), e.getRequestId(), clock.instant());
        return ResponseEntity.status(kind.status()).body(body);
    }
}
