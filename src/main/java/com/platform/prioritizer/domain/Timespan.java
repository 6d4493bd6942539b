package com.platform.prioritizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.platform.prioritizer.error.ConfigException;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.Period;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A positive calendar-aware span such as {@code 1y}, {@code 3month} or {@code 6 hours}.
 * <p>
 * Years, months, weeks and days use calendar arithmetic ({@link Period});
 * hours, minutes and seconds use exact arithmetic ({@link Duration}).
 */
public record Timespan(String text, Period period, Duration duration) {

    private static final Pattern FORMAT = Pattern.compile("^\\s*(\\d+)\\s*([a-zA-Z]+)\\s*$");

    private static final Map<String, String> UNITS = Map.ofEntries(
            Map.entry("y", "year"), Map.entry("year", "year"), Map.entry("years", "year"),
            Map.entry("month", "month"), Map.entry("months", "month"),
            Map.entry("w", "week"), Map.entry("week", "week"), Map.entry("weeks", "week"),
            Map.entry("d", "day"), Map.entry("day", "day"), Map.entry("days", "day"),
            Map.entry("h", "hour"), Map.entry("hour", "hour"), Map.entry("hours", "hour"),
            Map.entry("minute", "minute"), Map.entry("minutes", "minute"),
            Map.entry("second", "second"), Map.entry("seconds", "second")
    );

    @JsonCreator
    public static Timespan parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ConfigException("Empty timespan");
        }
        Matcher m = FORMAT.matcher(text);
        if (!m.matches()) {
            throw new ConfigException("Unparsable timespan '" + text + "'");
        }
        int amount;
        try {
            amount = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            throw new ConfigException("Timespan amount out of range in '" + text + "'", e);
        }
        if (amount <= 0) {
            throw new ConfigException("Timespan must be positive: '" + text + "'");
        }
        String rawUnit = m.group(2).toLowerCase(Locale.ROOT);
        if (rawUnit.equals("m")) {
            throw new ConfigException("Ambiguous unit 'm' in '" + text + "', use 'month' or 'minute'");
        }
        String unit = UNITS.get(rawUnit);
        if (unit == null) {
            throw new ConfigException("Unknown unit '" + rawUnit + "' in timespan '" + text + "'");
        }
        return switch (unit) {
            case "year" -> new Timespan(text.trim(), Period.ofYears(amount), Duration.ZERO);
            case "month" -> new Timespan(text.trim(), Period.ofMonths(amount), Duration.ZERO);
            case "week" -> new Timespan(text.trim(), Period.ofWeeks(amount), Duration.ZERO);
            case "day" -> new Timespan(text.trim(), Period.ofDays(amount), Duration.ZERO);
            case "hour" -> new Timespan(text.trim(), Period.ZERO, Duration.ofHours(amount));
            case "minute" -> new Timespan(text.trim(), Period.ZERO, Duration.ofMinutes(amount));
            default -> new Timespan(text.trim(), Period.ZERO, Duration.ofSeconds(amount));
        };
    }

    public LocalDateTime addTo(LocalDateTime instant) {
        return instant.plus(period).plus(duration);
    }

    public LocalDateTime subtractFrom(LocalDateTime instant) {
        return instant.minus(period).minus(duration);
    }

    /**
     * PostgreSQL interval literal, e.g. {@code 1 month} or {@code 6 hour}.
     */
    public String toSqlInterval() {
        if (!period.isZero()) {
            if (period.getYears() > 0) return period.getYears() + " year";
            if (period.getMonths() > 0) return period.getMonths() + " month";
            return period.getDays() + " day";
        }
        return duration.getSeconds() + " second";
    }

    @JsonValue
    @Override
    public String toString() {
        return text;
    }
}
