package com.example.time.gateway.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A resolver call that did not produce a usable {@code TimeResponse}.
 */
@Getter
public class ResolverException extends RuntimeException {

    private final FailureKind kind;
    private final String requestId;

    public ResolverException(FailureKind kind, String requestId, String message) {
        super(message);
        this.kind = kind;
        this.requestId = requestId;
    }

    public ResolverException(FailureKind kind, String requestId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.requestId = requestId;
    }

    public enum FailureKind {
        UNAVAILABLE("resolver_unavailable", HttpStatus.SERVICE_UNAVAILABLE),
        TIMEOUT("resolver_timeout", HttpStatus.GATEWAY_TIMEOUT),
        BAD_STATUS("resolver_bad_status", HttpStatus.BAD_GATEWAY),
        BAD_RESPONSE("resolver_bad_response", HttpStatus.BAD_GATEWAY);

        private final String code;
        private final HttpStatus status;

        FailureKind(String code, HttpStatus status) {
            this.code = code;
            this.status = status;
        }

        public String code() {
            return code;
        }

        public HttpStatus status() {
            return status;
        }
    }
}
