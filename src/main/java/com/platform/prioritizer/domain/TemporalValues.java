package com.platform.prioritizer.domain;

import com.platform.prioritizer.error.ConfigException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;

/**
 * Conversions from configuration text and database values to {@link LocalDateTime}.
 * Zoned values are normalized to UTC.
 */
public final class TemporalValues {

    private TemporalValues() {}

    /**
     * Parse a configured instant: {@code 2014-01-01} or {@code 2014-01-01T06:30:00}.
     */
    public static LocalDateTime parseConfigInstant(String field, String text) {
        if (text == null || text.isBlank()) {
            throw new ConfigException("Missing " + field);
        }
        String trimmed = text.trim();
        try {
            if (trimmed.length() <= 10) {
                return LocalDate.parse(trimmed).atStartOfDay();
            }
            return LocalDateTime.parse(trimmed.replace(' ', 'T'));
        } catch (DateTimeParseException e) {
            throw new ConfigException("Unparsable " + field + " '" + text + "'", e);
        }
    }

    /**
     * Convert a value returned by the query collaborator. Returns {@code null} for null.
     */
    public static LocalDateTime toLocalDateTime(Object obj) {
        if (obj == null) return null;
        if (obj instanceof LocalDateTime ldt) return ldt;
        if (obj instanceof java.sql.Timestamp ts) return ts.toLocalDateTime();
        if (obj instanceof java.sql.Date d) return d.toLocalDate().atStartOfDay();
        if (obj instanceof LocalDate ld) return ld.atStartOfDay();
        if (obj instanceof OffsetDateTime odt) return odt.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        if (obj instanceof ZonedDateTime zdt) return zdt.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        if (obj instanceof Instant i) return LocalDateTime.ofInstant(i, ZoneOffset.UTC);
        if (obj instanceof java.util.Date d) return LocalDateTime.ofInstant(d.toInstant(), ZoneOffset.UTC);
        if (obj instanceof CharSequence cs) return parseConfigInstant("timestamp", cs.toString());
        throw new IllegalArgumentException("Unexpected time type: " + obj.getClass());
    }
}
