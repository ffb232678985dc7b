package com.example.time.resolver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimeResponse {
    private String timestamp;
    private String timezone; // as requested, not the resolved zone
    @JsonProperty("request_id")
    private String requestId;
    private String source;
}
