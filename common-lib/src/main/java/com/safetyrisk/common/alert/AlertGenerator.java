package com.safetyrisk.common.alert;

import com.safetyrisk.common.config.AlertSettings;
import com.safetyrisk.common.model.IndicatorRecord;
import com.safetyrisk.common.model.RiskAlert;
import com.safetyrisk.common.model.RiskAlert.AlertPriority;
import com.safetyrisk.common.model.RiskAlert.AlertType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Raises alerts from the two most recent reporting periods of a neighborhood.
 *
 * <ul>
 *   <li>HIGH_VOLUME: latest crime count ≥ volumeThreshold; HIGH at twice the threshold, else MEDIUM.</li>
 *   <li>SIGNIFICANT_INCREASE: previous count &gt; 0 and relative increase ≥ increaseThreshold;
 *       HIGH at +50%, else MEDIUM.</li>
 *   <li>INTERVENTION_DEATHS: any death in the latest period; always CRITICAL.</li>
 * </ul>
 */
public final class AlertGenerator {

    static final double HIGH_PRIORITY_INCREASE = 0.50;

    /** Most urgent first, then neighborhood id. */
    public static final Comparator<RiskAlert> BY_PRIORITY =
        Comparator.comparing(RiskAlert::priority)
            .thenComparing(RiskAlert::neighborhoodId, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(RiskAlert::type);

    private final AlertSettings settings;

    public AlertGenerator() {
        this(AlertSettings.DEFAULTS);
    }

    public AlertGenerator(AlertSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Alert settings are required");
        }
        this.settings = settings;
    }

    /**
     * @param orderedRecords valid records of one neighborhood, ascending by period
     */
    public List<RiskAlert> generate(String neighborhoodId, List<IndicatorRecord> orderedRecords) {
        List<RiskAlert> alerts = new ArrayList<>();
        if (orderedRecords == null || orderedRecords.isEmpty()) {
            return alerts;
        }

        IndicatorRecord latest = orderedRecords.get(orderedRecords.size() - 1);
        int recent = latest.crimeCount();

        int volumeThreshold = settings.volumeThreshold();
        if (recent >= volumeThreshold) {
            alerts.add(new RiskAlert(
                AlertType.HIGH_VOLUME,
                recent >= volumeThreshold * 2 ? AlertPriority.HIGH : AlertPriority.MEDIUM,
                neighborhoodId,
                String.format("High crime volume: %d crimes in period %s", recent, latest.period()),
                recent));
        }

        if (orderedRecords.size() >= 2) {
            int previous = orderedRecords.get(orderedRecords.size() - 2).crimeCount();
            if (previous > 0) {
                double increase = (double) (recent - previous) / previous;
                if (increase >= settings.increaseThreshold()) {
                    alerts.add(new RiskAlert(
                        AlertType.SIGNIFICANT_INCREASE,
                        increase >= HIGH_PRIORITY_INCREASE ? AlertPriority.HIGH : AlertPriority.MEDIUM,
                        neighborhoodId,
                        String.format("Crimes up %.1f%% (from %d to %d)", increase * 100.0, previous, recent),
                        increase));
                }
            }
        }

        if (latest.deathsInIntervention() > 0) {
            alerts.add(new RiskAlert(
                AlertType.INTERVENTION_DEATHS,
                AlertPriority.CRITICAL,
                neighborhoodId,
                String.format("%d death(s) in police interventions in period %s",
                    latest.deathsInIntervention(), latest.period()),
                latest.deathsInIntervention()));
        }

        alerts.sort(BY_PRIORITY);
        return alerts;
    }
}
