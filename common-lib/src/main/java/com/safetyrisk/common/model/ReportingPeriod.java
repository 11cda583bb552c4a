package com.safetyrisk.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;

/**
 * Ordering key of an {@link IndicatorRecord}: a reporting period within a year.
 *
 * <p>{@code index} is 1-based. With {@code periodsPerYear = 12} a period is a month,
 * with 52 a week. The forecaster works on the flat {@link #ordinal(int)} of a period,
 * so gaps between reporting periods are preserved on the regression axis.
 */
public record ReportingPeriod(
    @JsonProperty("year")  int year,
    @JsonProperty("index") int index
) implements Comparable<ReportingPeriod> {

    private static final Comparator<ReportingPeriod> ORDER =
        Comparator.comparingInt(ReportingPeriod::year).thenComparingInt(ReportingPeriod::index);

    public static ReportingPeriod of(int year, int index) {
        return new ReportingPeriod(year, index);
    }

    /** Flat period index: {@code year * periodsPerYear + (index - 1)}. */
    public long ordinal(int periodsPerYear) {
        return (long) year * periodsPerYear + (index - 1);
    }

    public static ReportingPeriod fromOrdinal(long ordinal, int periodsPerYear) {
        int year = (int) Math.floorDiv(ordinal, (long) periodsPerYear);
        int index = (int) Math.floorMod(ordinal, (long) periodsPerYear) + 1;
        return new ReportingPeriod(year, index);
    }

    @Override
    public int compareTo(ReportingPeriod other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return String.format("%d-P%02d", year, index);
    }
}
