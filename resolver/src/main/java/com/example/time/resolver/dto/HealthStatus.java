package com.example.time.resolver.dto;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthStatus {
    private Status status;
    private String service;
    private Instant timestamp;

    public static HealthStatus healthy(String service, Instant now) {
        return new HealthStatus(Status.HEALTHY, service, now);
    }

    public enum Status {
        HEALTHY;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
