package com.safetyrisk.common.validation;

import com.safetyrisk.common.exception.InvalidIndicatorException;
import com.safetyrisk.common.model.IndicatorRecord;
import com.safetyrisk.common.model.ReportingPeriod;

/**
 * Rejects records the engine cannot score: a missing neighborhood id, a malformed
 * period, or any negative or non-finite count. Values are never clamped here.
 */
public final class IndicatorValidator {

    private final int periodsPerYear;

    public IndicatorValidator(int periodsPerYear) {
        if (periodsPerYear < 1) {
            throw new IllegalArgumentException("periodsPerYear must be at least 1: " + periodsPerYear);
        }
        this.periodsPerYear = periodsPerYear;
    }

    /**
     * @throws InvalidIndicatorException naming the neighborhood, period and offending field
     */
    public void validate(IndicatorRecord record) {
        if (record == null) {
            throw new InvalidIndicatorException(null, null, "record is null");
        }
        String id = record.neighborhoodId();
        ReportingPeriod period = record.period();

        if (id == null || id.isBlank()) {
            throw new InvalidIndicatorException(id, period, "neighborhoodId is missing");
        }
        if (period == null) {
            throw new InvalidIndicatorException(id, null, "period is missing");
        }
        if (period.year() < 1) {
            throw new InvalidIndicatorException(id, period, "period year must be positive");
        }
        if (period.index() < 1 || period.index() > periodsPerYear) {
            throw new InvalidIndicatorException(id, period,
                "period index must be within 1.." + periodsPerYear);
        }

        requireNonNegative(record, "crimeCount", record.crimeCount());
        requireNonNegative(record, "deathsInIntervention", record.deathsInIntervention());
        requireNonNegative(record, "arrests", record.arrests());
        requireNonNegative(record, "weaponsSeized", record.weaponsSeized());
        requireNonNegative(record, "officersInvolved", record.officersInvolved());

        double drugs = record.drugsSeizedKg();
        if (!Double.isFinite(drugs) || drugs < 0.0) {
            throw new InvalidIndicatorException(id, period, "drugsSeizedKg must be a non-negative number, got " + drugs);
        }
    }

    private static void requireNonNegative(IndicatorRecord record, String field, int value) {
        if (value < 0) {
            throw new InvalidIndicatorException(record.neighborhoodId(), record.period(),
                field + " must be non-negative, got " + value);
        }
    }
}
