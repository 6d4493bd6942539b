package com.platform.prioritizer.domain;

import java.math.BigDecimal;

/**
 * Cut-off for thresholded metrics: the top {@code n} rows or the top {@code p} percent.
 *
 * @param specified false for the implicit "everything selected" threshold used by
 *                  metric groups that declare none
 */
public record Threshold(Unit unit, double value, boolean specified) {

    public enum Unit {
        TOP_N("abs"), PERCENTILE("pct");

        private final String suffix;

        Unit(String suffix) {
            this.suffix = suffix;
        }

        public String suffix() {
            return suffix;
        }
    }

    public static final Threshold ALL_SELECTED = new Threshold(Unit.PERCENTILE, 100.0, false);

    public Threshold {
        if (unit == null) {
            throw new IllegalArgumentException("Threshold unit is required");
        }
        if (Double.isNaN(value) || value < 0) {
            throw new IllegalArgumentException("Threshold must be non-negative, got " + value);
        }
        if (unit == Unit.PERCENTILE && value > 100.0) {
            throw new IllegalArgumentException("Percentile threshold above 100: " + value);
        }
        if (unit == Unit.TOP_N && value != Math.rint(value)) {
            throw new IllegalArgumentException("top_n threshold must be whole, got " + value);
        }
    }

    public static Threshold topN(int n) {
        return new Threshold(Unit.TOP_N, n, true);
    }

    public static Threshold percentile(double p) {
        return new Threshold(Unit.PERCENTILE, p, true);
    }

    /**
     * Number of rows selected out of {@code n} scored rows.
     */
    public int count(int n) {
        if (unit == Unit.TOP_N) {
            return (int) Math.min((long) value, n);
        }
        return (int) Math.floor(n * value / 100.0);
    }

    /**
     * {@code 10_abs} or {@code 5.0_pct}.
     */
    public String parameter() {
        if (unit == Unit.TOP_N) {
            return ((long) value) + "_" + unit.suffix();
        }
        return BigDecimal.valueOf(value).toPlainString() + "_" + unit.suffix();
    }
}
