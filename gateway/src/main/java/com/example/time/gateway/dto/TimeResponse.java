package com.example.time.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimeResponse {
    private String timestamp;
    private String timezone;
    @JsonProperty("request_id")
    private String requestId;
    private String source;

    /**
     * Copy of this response attributed to {@code source}; other fields are kept verbatim.
     */
    public TimeResponse attributedTo(String source) {
        return new TimeResponse(timestamp, timezone, requestId, source);
    }
}
