package com.example.time.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Body returned instead of a {@link TimeResponse} when the resolver call fails.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    /** Stable error code, e.g. {@code resolver_timeout}. */
    private String error;
    private String message;
    @JsonProperty("request_id")
    private String requestId;
    private Instant timestamp;
}
