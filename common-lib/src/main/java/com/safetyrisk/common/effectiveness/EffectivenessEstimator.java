package com.safetyrisk.common.effectiveness;

import com.safetyrisk.common.config.EffectivenessSettings;
import com.safetyrisk.common.model.Effectiveness;
import com.safetyrisk.common.model.EffectivenessBand;
import com.safetyrisk.common.model.IndicatorRecord;

/**
 * Derives an operational-effectiveness ratio from arrests and seizures.
 *
 * <pre>
 *   outcome = arrestWeight × arrests + weaponWeight × weaponsSeized + drugKgWeight × drugsSeizedKg
 *   ratio   = clamp(outcome / denominator, 0, 1)
 * </pre>
 *
 * <p>The denominator is the crime count or the number of officers involved, as configured.
 * A zero denominator gives 1.0 when any outcome was recorded and 0.0 otherwise.
 *
 * <p>Returns {@link Effectiveness#UNDEFINED} when no operation was active and no
 * arrest or seizure was recorded, so "no operation" stays distinguishable from
 * "operation with no measured effect".
 */
public final class EffectivenessEstimator {

    private final EffectivenessSettings settings;

    public EffectivenessEstimator() {
        this(EffectivenessSettings.DEFAULTS);
    }

    public EffectivenessEstimator(EffectivenessSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Effectiveness settings are required");
        }
        this.settings = settings;
    }

    public Effectiveness estimate(IndicatorRecord indicators) {
        if (!indicators.hasActiveOperation() && indicators.hasNoEnforcementOutcome()) {
            return Effectiveness.UNDEFINED;
        }

        double outcome = settings.arrestWeight() * indicators.arrests()
            + settings.weaponWeight() * indicators.weaponsSeized()
            + settings.drugKgWeight() * indicators.drugsSeizedKg();

        double denominator = switch (settings.denominator()) {
            case CRIME_COUNT       -> indicators.crimeCount();
            case OFFICERS_INVOLVED -> indicators.officersInvolved();
        };

        double ratio;
        if (denominator <= 0.0) {
            ratio = outcome > 0.0 ? 1.0 : 0.0;
        } else {
            ratio = Math.min(Math.max(outcome / denominator, 0.0), 1.0);
        }
        return Effectiveness.of(ratio, bandOf(ratio));
    }

    EffectivenessBand bandOf(double ratio) {
        if (ratio >= settings.highThreshold()) return EffectivenessBand.HIGH;
        if (ratio >= settings.lowThreshold())  return EffectivenessBand.MEDIUM;
        return EffectivenessBand.LOW;
    }
}
