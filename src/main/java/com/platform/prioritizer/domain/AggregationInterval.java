package com.platform.prioritizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDateTime;

/**
 * A look-back window for an aggregation: a {@link Timespan}, or {@code all} for no lower bound.
 */
public record AggregationInterval(String name, Timespan span) {

    public static final String ALL = "all";

    @JsonCreator
    public static AggregationInterval parse(String text) {
        if (text != null && text.trim().equalsIgnoreCase(ALL)) {
            return new AggregationInterval(ALL, null);
        }
        Timespan span = Timespan.parse(text);
        return new AggregationInterval(span.text().replace(" ", ""), span);
    }

    public boolean isUnbounded() {
        return span == null;
    }

    /**
     * Inclusive lower bound on knowledge dates for this window, or {@code null} when unbounded.
     */
    public LocalDateTime lowerBound(LocalDateTime asOfDate) {
        return span == null ? null : span.subtractFrom(asOfDate);
    }

    @JsonValue
    @Override
    public String toString() {
        return name;
    }
}
