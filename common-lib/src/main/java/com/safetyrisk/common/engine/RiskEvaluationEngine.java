package com.safetyrisk.common.engine;

import com.safetyrisk.common.aggregation.IndicatorAggregator;
import com.safetyrisk.common.alert.AlertGenerator;
import com.safetyrisk.common.classifier.RiskTierClassifier;
import com.safetyrisk.common.config.EngineSettings;
import com.safetyrisk.common.effectiveness.EffectivenessEstimator;
import com.safetyrisk.common.exception.InsufficientDataException;
import com.safetyrisk.common.exception.InvalidIndicatorException;
import com.safetyrisk.common.exception.RiskEngineException;
import com.safetyrisk.common.forecast.TrendDirectionClassifier;
import com.safetyrisk.common.forecast.TrendForecaster;
import com.safetyrisk.common.model.Effectiveness;
import com.safetyrisk.common.model.EvaluationReport;
import com.safetyrisk.common.model.ForecastPoint;
import com.safetyrisk.common.model.IndicatorRecord;
import com.safetyrisk.common.model.PeriodForecast;
import com.safetyrisk.common.model.RecordRejection;
import com.safetyrisk.common.model.ReportingPeriod;
import com.safetyrisk.common.model.RiskAlert;
import com.safetyrisk.common.model.RiskResult;
import com.safetyrisk.common.model.RiskTier;
import com.safetyrisk.common.model.ScoreBreakdown;
import com.safetyrisk.common.model.SeriesPoint;
import com.safetyrisk.common.model.TrendDirection;
import com.safetyrisk.common.recommendation.RecommendationGenerator;
import com.safetyrisk.common.scoring.RiskScoreCalculator;
import com.safetyrisk.common.validation.IndicatorValidator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Evaluates an indicator table into one {@link RiskResult} per neighborhood.
 *
 * <p>Pipeline per neighborhood:
 * <ol>
 *   <li>validate records; invalid or duplicate-period records become {@link RecordRejection}s</li>
 *   <li>order by period and aggregate the scoring window</li>
 *   <li>score → tier → effectiveness → recommendations</li>
 *   <li>trend direction and forecast from the full series, independently of the score</li>
 *   <li>alerts from the latest periods</li>
 * </ol>
 *
 * <p>Failures stay local to one neighborhood: a bad record or a failing neighborhood never
 * aborts the rest of the table, and too short a series only drops the forecast.
 *
 * <p>Stateless and thread-safe once constructed. No I/O. No logging.
 */
public final class RiskEvaluationEngine {

    private final EngineSettings settings;
    private final IndicatorValidator validator;
    private final IndicatorAggregator aggregator;
    private final RiskScoreCalculator scoreCalculator;
    private final RiskTierClassifier tierClassifier;
    private final EffectivenessEstimator effectivenessEstimator;
    private final TrendForecaster forecaster;
    private final TrendDirectionClassifier trendClassifier;
    private final RecommendationGenerator recommendationGenerator;
    private final AlertGenerator alertGenerator;

    public RiskEvaluationEngine() {
        this(EngineSettings.DEFAULTS);
    }

    public RiskEvaluationEngine(EngineSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Engine settings are required");
        }
        this.settings = settings;
        this.validator = new IndicatorValidator(settings.forecast().periodsPerYear());
        this.aggregator = new IndicatorAggregator(settings.aggregationWindow());
        this.scoreCalculator = new RiskScoreCalculator(settings.weights());
        this.tierClassifier = new RiskTierClassifier(settings.tiers());
        this.effectivenessEstimator = new EffectivenessEstimator(settings.effectiveness());
        this.forecaster = new TrendForecaster(settings.forecast().maxHorizon());
        this.trendClassifier = new TrendDirectionClassifier(settings.forecast().trendThreshold());
        this.recommendationGenerator = new RecommendationGenerator();
        this.alertGenerator = new AlertGenerator(settings.alerts());
    }

    public EngineSettings settings() {
        return settings;
    }

    /**
     * Evaluates a whole table. Records may arrive in any order and for any number of
     * neighborhoods; results are ordered by neighborhood id.
     */
    public EvaluationReport evaluate(Collection<IndicatorRecord> records) {
        if (records == null) {
            throw new IllegalArgumentException("Indicator table is required");
        }

        List<RecordRejection> rejections = new ArrayList<>();
        Map<String, List<IndicatorRecord>> byNeighborhood = new TreeMap<>();
        for (IndicatorRecord record : records) {
            try {
                validator.validate(record);
            } catch (InvalidIndicatorException e) {
                rejections.add(rejectionOf(e));
                continue;
            }
            byNeighborhood.computeIfAbsent(record.neighborhoodId(), id -> new ArrayList<>()).add(record);
        }

        List<RiskResult> results = new ArrayList<>();
        List<RiskAlert> alerts = new ArrayList<>();
        for (Map.Entry<String, List<IndicatorRecord>> entry : byNeighborhood.entrySet()) {
            String neighborhoodId = entry.getKey();
            List<IndicatorRecord> ordered = orderedWithoutDuplicates(entry.getValue(), rejections);
            try {
                RiskResult result = evaluateOrdered(neighborhoodId, ordered);
                List<RiskAlert> raised = alertGenerator.generate(neighborhoodId, ordered);
                results.add(result);
                alerts.addAll(raised);
            } catch (InvalidIndicatorException e) {
                rejections.add(rejectionOf(e));
            } catch (RiskEngineException e) {
                rejections.add(new RecordRejection(neighborhoodId, null, e.getMessage()));
            } catch (RuntimeException e) {
                rejections.add(new RecordRejection(neighborhoodId, null,
                    "evaluation failed: " + e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }

        alerts.sort(AlertGenerator.BY_PRIORITY);
        return new EvaluationReport(results, rejections, alerts);
    }

    /**
     * Evaluates the records of a single neighborhood.
     *
     * @throws InvalidIndicatorException on the first invalid record, a record of another
     *                                   neighborhood or a duplicate period
     */
    public RiskResult evaluateNeighborhood(String neighborhoodId, List<IndicatorRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new InvalidIndicatorException(neighborhoodId, null, "no records to evaluate");
        }
        Set<ReportingPeriod> seen = new HashSet<>();
        for (IndicatorRecord record : records) {
            validator.validate(record);
            if (!record.neighborhoodId().equals(neighborhoodId)) {
                throw new InvalidIndicatorException(neighborhoodId, record.period(),
                    "record belongs to neighborhood " + record.neighborhoodId());
            }
            if (!seen.add(record.period())) {
                throw new InvalidIndicatorException(neighborhoodId, record.period(), "duplicate period");
            }
        }
        List<IndicatorRecord> ordered = records.stream()
            .sorted(Comparator.comparing(IndicatorRecord::period))
            .toList();
        return evaluateOrdered(neighborhoodId, ordered);
    }

    /**
     * Projects {@code horizon} periods past the end of {@code series}.
     *
     * @throws InsufficientDataException when fewer than two distinct periods are given
     * @throws IllegalArgumentException  for a horizon above the configured maximum or a negative count
     */
    public List<ForecastPoint> forecast(List<SeriesPoint> series, int horizon) {
        return forecaster.forecast(series, horizon);
    }

    // ── per-neighborhood pipeline ──────────────────────────────────

    private RiskResult evaluateOrdered(String neighborhoodId, List<IndicatorRecord> ordered) {
        IndicatorRecord aggregate = aggregator.aggregate(ordered);
        int periodsAggregated = aggregator.windowOf(ordered).size();

        ScoreBreakdown breakdown = scoreCalculator.breakdown(aggregate);
        RiskTier tier = tierClassifier.classify(breakdown.score());
        Effectiveness effectiveness = effectivenessEstimator.estimate(aggregate);

        List<SeriesPoint> series = toSeries(ordered);
        TrendDirection trend = trendClassifier.classify(series);
        List<PeriodForecast> forecast = forecastOrNull(neighborhoodId, series);

        List<String> recommendations = recommendationGenerator.recommend(
            tier, effectiveness, breakdown.dominantIndicator(), aggregate);

        return new RiskResult(
            neighborhoodId,
            aggregate.period(),
            periodsAggregated,
            breakdown.score(),
            tier,
            breakdown,
            effectiveness,
            trend,
            forecast,
            recommendations);
    }

    private List<PeriodForecast> forecastOrNull(String neighborhoodId, List<SeriesPoint> series) {
        int periodsPerYear = settings.forecast().periodsPerYear();
        try {
            return forecaster.forecast(neighborhoodId, series, settings.forecast().horizon()).stream()
                .map(p -> new PeriodForecast(
                    ReportingPeriod.fromOrdinal(p.periodIndex(), periodsPerYear), p.predictedCrimeCount()))
                .toList();
        } catch (InsufficientDataException e) {
            return null;
        }
    }

    private List<SeriesPoint> toSeries(List<IndicatorRecord> ordered) {
        int periodsPerYear = settings.forecast().periodsPerYear();
        return ordered.stream()
            .map(r -> new SeriesPoint(r.period().ordinal(periodsPerYear), r.crimeCount()))
            .toList();
    }

    /** Sorts by period and moves every repeat of an already-seen period to the rejections. */
    private static List<IndicatorRecord> orderedWithoutDuplicates(List<IndicatorRecord> records,
                                                                  List<RecordRejection> rejections) {
        Set<ReportingPeriod> seen = new HashSet<>();
        List<IndicatorRecord> unique = new ArrayList<>(records.size());
        for (IndicatorRecord record : records) {
            if (seen.add(record.period())) {
                unique.add(record);
            } else {
                rejections.add(new RecordRejection(record.neighborhoodId(), record.period(), "duplicate period"));
            }
        }
        unique.sort(Comparator.comparing(IndicatorRecord::period));
        return unique;
    }

    private static RecordRejection rejectionOf(InvalidIndicatorException e) {
        return new RecordRejection(e.getNeighborhoodId(), e.getPeriod(), e.getReason());
    }
}
