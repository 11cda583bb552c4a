package com.safetyrisk.common.aggregation;

import com.safetyrisk.common.exception.InvalidIndicatorException;
import com.safetyrisk.common.model.IndicatorRecord;

import java.util.List;

/**
 * Sums the most recent periods of a neighborhood into one record for scoring.
 *
 * <p>The aggregate carries the latest period. Its operation type is the one of the most
 * recent record with an active operation, or {@value IndicatorRecord#NO_OPERATION}.
 */
public final class IndicatorAggregator {

    private final int window;

    /**
     * @param window number of most recent periods to sum; 0 sums every period
     */
    public IndicatorAggregator(int window) {
        if (window < 0) {
            throw new IllegalArgumentException("Aggregation window must be non-negative: " + window);
        }
        this.window = window;
    }

    /** Records of {@code orderedRecords} that fall inside the window. */
    public List<IndicatorRecord> windowOf(List<IndicatorRecord> orderedRecords) {
        int size = orderedRecords.size();
        if (window == 0 || window >= size) {
            return orderedRecords;
        }
        return orderedRecords.subList(size - window, size);
    }

    /**
     * @param orderedRecords valid records of one neighborhood, ascending by period, not empty
     * @throws InvalidIndicatorException when a summed count does not fit in an {@code int}
     */
    public IndicatorRecord aggregate(List<IndicatorRecord> orderedRecords) {
        if (orderedRecords == null || orderedRecords.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty record list");
        }
        List<IndicatorRecord> slice = windowOf(orderedRecords);
        if (slice.size() == 1) {
            return slice.get(0);
        }

        IndicatorRecord latest = slice.get(slice.size() - 1);
        int crimes = 0, deaths = 0, arrests = 0, weapons = 0, officers = 0;
        double drugs = 0.0;
        String operation = IndicatorRecord.NO_OPERATION;
        for (IndicatorRecord r : slice) {
            crimes   = add(crimes, r.crimeCount(), "crimeCount", latest);
            deaths   = add(deaths, r.deathsInIntervention(), "deathsInIntervention", latest);
            arrests  = add(arrests, r.arrests(), "arrests", latest);
            weapons  = add(weapons, r.weaponsSeized(), "weaponsSeized", latest);
            officers = add(officers, r.officersInvolved(), "officersInvolved", latest);
            drugs   += r.drugsSeizedKg();
            if (r.hasActiveOperation()) {
                operation = r.operationType();
            }
        }

        return new IndicatorRecord(latest.neighborhoodId(), latest.period(),
            crimes, deaths, arrests, weapons, drugs, officers, operation);
    }

    private static int add(int total, int value, String field, IndicatorRecord latest) {
        try {
            return Math.addExact(total, value);
        } catch (ArithmeticException e) {
            throw new InvalidIndicatorException(latest.neighborhoodId(), latest.period(),
                "aggregated " + field + " overflows");
        }
    }
}
