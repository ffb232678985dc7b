package com.example.time.resolver.service;

import com.example.time.resolver.dto.TimeResponse;
import com.example.time.resolver.model.TimezoneAliases;
import com.example.time.resolver.util.RequestValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Resolves a symbolic timezone name to the current time in that zone.
 * Unknown or missing names fall back to UTC; resolution never fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimeResolverService {

    public static final String SOURCE = "api2";

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSXXX");

    private final TimezoneAliases aliases;
    private final Clock clock;

    /**
     * @param timezone  requested timezone name, echoed verbatim; {@code null} means {@code UTC}
     * @param requestId caller-supplied correlation id; minted when absent or not usable as a header value
     */
    public TimeResponse resolve(String timezone, String requestId) {
        String requested = timezone != null ? timezone : TimezoneAliases.UTC;
        String id = RequestValues.isHeaderSafe(requestId) ? requestId : UUID.randomUUID().toString();

        if (requestId != null && !requestId.equals(id)) {
            log.info("Ignoring unusable request id requestId={} supplied={}", id, RequestValues.forLog(requestId));
        }
        log.info("Processing time request requestId={} timezone={}", id, RequestValues.forLog(requested));

        if (!aliases.isKnown(requested)) {
            log.info("Unsupported timezone, defaulting to UTC requestId={} timezone={}",
                    id, RequestValues.forLog(requested));
        }
        ZoneId zone = aliases.resolve(requested);
        String timestamp = format(clock.instant(), zone);

        log.info("Time request processed requestId={} timezone={} zone={} timestamp={}",
                id, RequestValues.forLog(requested), zone, timestamp);
        return new TimeResponse(timestamp, requested, id, SOURCE);
    }

    static String format(Instant instant, ZoneId zone) {
        return TIMESTAMP_FORMAT.format(instant.atZone(zone));
    }
}
