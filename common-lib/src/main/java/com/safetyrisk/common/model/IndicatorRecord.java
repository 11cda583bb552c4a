package com.safetyrisk.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public-safety indicators of one neighborhood for one reporting period.
 *
 * <p>Instances are supplied by the data-loading side and are never mutated by the engine.
 * {@code operationType} uses {@value #NO_OPERATION} (case-insensitive), blank or null
 * to mean "no active operation".
 */
public record IndicatorRecord(
    @JsonProperty("neighborhoodId")       String neighborhoodId,
    @JsonProperty("period")               ReportingPeriod period,
    @JsonProperty("crimeCount")           int crimeCount,
    @JsonProperty("deathsInIntervention") int deathsInIntervention,
    @JsonProperty("arrests")              int arrests,
    @JsonProperty("weaponsSeized")        int weaponsSeized,
    @JsonProperty("drugsSeizedKg")        double drugsSeizedKg,
    @JsonProperty("officersInvolved")     int officersInvolved,
    @JsonProperty("operationType")        String operationType
) {

    public static final String NO_OPERATION = "none";

    @JsonIgnore
    public boolean hasActiveOperation() {
        return operationType != null
            && !operationType.isBlank()
            && !NO_OPERATION.equalsIgnoreCase(operationType.trim());
    }

    /** True when no arrest, weapon seizure or drug seizure was recorded. */
    @JsonIgnore
    public boolean hasNoEnforcementOutcome() {
        return arrests == 0 && weaponsSeized == 0 && drugsSeizedKg == 0.0;
    }
}
