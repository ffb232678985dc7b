package com.example.time.resolver.model;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read-only lookup from a symbolic timezone name to a zone.
 * <p>
 * Keys are matched case-sensitively. Any key that is not in the table resolves to UTC,
 * so a lookup never fails.
 */
public final class TimezoneAliases {

    public static final String UTC = "UTC";

    private static final Map<String, String> DEFAULT_ALIASES = defaultAliases();

    private final Map<String, ZoneId> zones;

    private TimezoneAliases(Map<String, ZoneId> zones) {
        this.zones = Collections.unmodifiableMap(zones);
    }

    public static TimezoneAliases defaults() {
        return of(DEFAULT_ALIASES);
    }

    /**
     * @throws IllegalArgumentException if a zone id cannot be parsed
     */
    public static TimezoneAliases of(Map<String, String> aliases) {
        Map<String, ZoneId> zones = new LinkedHashMap<>();
        zones.put(UTC, ZoneOffset.UTC);
        aliases.forEach((key, zone) -> zones.put(key, parseZone(key, zone)));
        return new TimezoneAliases(zones);
    }

    /**
     * Returns a new table with {@code additional} layered over this one.
     */
    public TimezoneAliases withAdditional(Map<String, String> additional) {
        if (additional == null || additional.isEmpty()) {
            return this;
        }
        Map<String, ZoneId> merged = new LinkedHashMap<>(zones);
        additional.forEach((key, zone) -> merged.put(key, parseZone(key, zone)));
        return new TimezoneAliases(merged);
    }

    public boolean isKnown(String alias) {
        return alias != null && zones.containsKey(alias);
    }

    /**
     * Resolves an alias, falling back to UTC for {@code null} or unknown names.
     */
    public ZoneId resolve(String alias) {
        if (alias == null) {
            return ZoneOffset.UTC;
        }
        return zones.getOrDefault(alias, ZoneOffset.UTC);
    }

    public Set<String> keys() {
        return zones.keySet();
    }

    public int size() {
        return zones.size();
    }

    private static ZoneId parseZone(String key, String zone) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Timezone alias key must not be blank");
        }
        if (zone == null || zone.isBlank()) {
            throw new IllegalArgumentException("Missing zone for timezone alias '" + key + "'");
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid zone '" + zone + "' for timezone alias '" + key + "'", e);
        }
    }

    private static Map<String, String> defaultAliases() {
        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put("EST", "US/Eastern");
        aliases.put("US/Eastern", "US/Eastern");
        aliases.put("PST", "US/Pacific");
        aliases.put("US/Pacific", "US/Pacific");
        aliases.put("CET", "Europe/Berlin");
        aliases.put("Europe/Berlin", "Europe/Berlin");
        return Collections.unmodifiableMap(aliases);
    }
}
