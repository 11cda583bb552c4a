package com.safetyrisk.riskservice.config;

import com.safetyrisk.common.config.AlertSettings;
import com.safetyrisk.common.config.EffectivenessDenominator;
import com.safetyrisk.common.config.EffectivenessSettings;
import com.safetyrisk.common.config.EngineSettings;
import com.safetyrisk.common.config.ForecastSettings;
import com.safetyrisk.common.config.ScoringWeights;
import com.safetyrisk.common.config.TierBreakpoints;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds {@code risk-engine.*} from {@code application.yml}. Defaults mirror
 * {@link EngineSettings#DEFAULTS}, so an empty section yields the reference engine.
 */
@Component
@ConfigurationProperties(prefix = "risk-engine")
@Data
public class RiskEngineProperties {

    private Weights weights = new Weights();
    private List<Double> tierBounds = new ArrayList<>(TierBreakpoints.DEFAULTS.lowerBounds());
    private Effectiveness effectiveness = new Effectiveness();
    private Forecast forecast = new Forecast();
    private Alerts alerts = new Alerts();
    private int aggregationWindow = EngineSettings.DEFAULTS.aggregationWindow();
    private Cache cache = new Cache();
    private Status status = new Status();

    @Data
    public static class Weights {
        private double crimeCount = ScoringWeights.DEFAULTS.crimeCount();
        private double deathsInIntervention = ScoringWeights.DEFAULTS.deathsInIntervention();
        private double arrests = ScoringWeights.DEFAULTS.arrests();
        private double weaponsSeized = ScoringWeights.DEFAULTS.weaponsSeized();
        private double drugsSeizedKg = ScoringWeights.DEFAULTS.drugsSeizedKg();
        private double activeOperation = ScoringWeights.DEFAULTS.activeOperation();
    }

    @Data
    public static class Effectiveness {
        private EffectivenessDenominator denominator = EffectivenessSettings.DEFAULTS.denominator();
        private double arrestWeight = EffectivenessSettings.DEFAULTS.arrestWeight();
        private double weaponWeight = EffectivenessSettings.DEFAULTS.weaponWeight();
        private double drugKgWeight = EffectivenessSettings.DEFAULTS.drugKgWeight();
        private double lowThreshold = EffectivenessSettings.DEFAULTS.lowThreshold();
        private double highThreshold = EffectivenessSettings.DEFAULTS.highThreshold();
    }

    @Data
    public static class Forecast {
        private int horizon = ForecastSettings.DEFAULTS.horizon();
        private int maxHorizon = ForecastSettings.DEFAULTS.maxHorizon();
        private int periodsPerYear = ForecastSettings.DEFAULTS.periodsPerYear();
        private double trendThreshold = ForecastSettings.DEFAULTS.trendThreshold();
    }

    @Data
    public static class Alerts {
        private int volumeThreshold = AlertSettings.DEFAULTS.volumeThreshold();
        private double increaseThreshold = AlertSettings.DEFAULTS.increaseThreshold();
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private int maxEntries = 256;
    }

    @Data
    public static class Status {
        /** Age after which the last evaluation is reported as stale. */
        private Duration freshnessThreshold = Duration.ofHours(24);
    }

    /**
     * Converts the bound properties into validated engine settings.
     *
     * @throws IllegalArgumentException when a section is out of range
     */
    public EngineSettings toSettings() {
        return new EngineSettings(
            new ScoringWeights(
                weights.getCrimeCount(),
                weights.getDeathsInIntervention(),
                weights.getArrests(),
                weights.getWeaponsSeized(),
                weights.getDrugsSeizedKg(),
                weights.getActiveOperation()),
            new TierBreakpoints(tierBounds),
            new EffectivenessSettings(
                effectiveness.getDenominator(),
                effectiveness.getArrestWeight(),
                effectiveness.getWeaponWeight(),
                effectiveness.getDrugKgWeight(),
                effectiveness.getLowThreshold(),
                effectiveness.getHighThreshold()),
            new ForecastSettings(
                forecast.getHorizon(),
                forecast.getMaxHorizon(),
                forecast.getPeriodsPerYear(),
                forecast.getTrendThreshold()),
            new AlertSettings(
                alerts.getVolumeThreshold(),
                alerts.getIncreaseThreshold()),
            aggregationWindow);
    }
}
