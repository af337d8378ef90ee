package com.streamfirst.scenesearch.domain;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Conversions between the timestamp notations used by scene names, catalogs and configuration.
 * All values are UTC; {@link LocalDateTime} carries them without an offset.
 */
public final class SceneTimes {

    /** Compact notation used in Sentinel-1 product names, e.g. {@code 20210101T050000}. */
    public static final DateTimeFormatter COMPACT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    private SceneTimes() {}

    /**
     * Parses a timestamp in compact notation, ISO-8601 local notation or as an ISO-8601 instant
     * ({@code 2021-01-01T05:00:00.000Z}).
     *
     * @throws ConfigurationException if the text matches none of the supported notations
     */
    public static LocalDateTime parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ConfigurationException("timestamp must not be empty");
        }
        String value = text.trim();
        try {
            if (value.length() == 15 && value.charAt(8) == 'T') {
                return LocalDateTime.parse(value, COMPACT);
            }
            if (value.endsWith("Z")) {
                return fromInstant(Instant.parse(value));
            }
            return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("unsupported timestamp notation: " + text, e);
        }
    }

    /** Converts an instant to UTC local time, truncated to whole seconds. */
    public static LocalDateTime fromInstant(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS);
    }

    public static String compact(LocalDateTime time) {
        return COMPACT.format(time);
    }

    /** ISO-8601 instant notation as expected by STAC and ASF, e.g. {@code 2021-01-01T05:00:00Z}. */
    public static String iso(LocalDateTime time) {
        return DateTimeFormatter.ISO_INSTANT.format(time.toInstant(ZoneOffset.UTC));
    }
}
