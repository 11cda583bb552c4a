package com.safetyrisk.common.engine;

import com.safetyrisk.common.config.AlertSettings;
import com.safetyrisk.common.config.EffectivenessDenominator;
import com.safetyrisk.common.config.EffectivenessSettings;
import com.safetyrisk.common.config.EngineSettings;
import com.safetyrisk.common.config.ForecastSettings;
import com.safetyrisk.common.config.ScoringWeights;
import com.safetyrisk.common.config.TierBreakpoints;
import com.safetyrisk.common.exception.InvalidIndicatorException;
import com.safetyrisk.common.model.DominantIndicator;
import com.safetyrisk.common.model.EffectivenessBand;
import com.safetyrisk.common.model.EvaluationReport;
import com.safetyrisk.common.model.IndicatorRecord;
import com.safetyrisk.common.model.PeriodForecast;
import com.safetyrisk.common.model.RecordRejection;
import com.safetyrisk.common.model.ReportingPeriod;
import com.safetyrisk.common.model.RiskAlert.AlertPriority;
import com.safetyrisk.common.model.RiskAlert.AlertType;
import com.safetyrisk.common.model.RiskResult;
import com.safetyrisk.common.model.RiskTier;
import com.safetyrisk.common.model.TrendDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end verification of {@link RiskEvaluationEngine} on small indicator tables.
 */
class RiskEvaluationEngineTest {

    private static final double EPS = 1e-9;

    private final RiskEvaluationEngine engine = new RiskEvaluationEngine();

    private static IndicatorRecord record(String id, int year, int index, int crimes, int deaths,
                                          int arrests, int weapons, double drugsKg, String operation) {
        return new IndicatorRecord(id, ReportingPeriod.of(year, index),
            crimes, deaths, arrests, weapons, drugsKg, 8, operation);
    }

    // ── single neighborhood scenarios ──────────────────────────────────────

    @Nested
    @DisplayName("single neighborhood")
    class SingleNeighborhood {

        @Test
        @DisplayName("heavy enforcement → score 0, very low, high effectiveness")
        void heavyEnforcement() {
            EvaluationReport report = engine.evaluate(List.of(
                record("centro", 2024, 1, 15, 0, 8, 2, 1.2, "patrol")));

            RiskResult result = report.results().get(0);
            assertEquals(0.0, result.score(), EPS);
            assertEquals(RiskTier.VERY_LOW, result.tier());
            assertEquals(EffectivenessBand.HIGH, result.effectiveness().band());
            assertEquals(DominantIndicator.ARRESTS, result.breakdown().dominantIndicator());
            assertEquals(List.of("Maintain current preventive actions"), result.recommendations());
        }

        @Test
        @DisplayName("a death with no enforcement → high tier, use-of-force review first")
        void deathWithoutEnforcement() {
            EvaluationReport report = engine.evaluate(List.of(
                record("norte", 2024, 1, 10, 1, 0, 0, 0.0, "none")));

            RiskResult result = report.results().get(0);
            assertEquals(85.0, result.score(), EPS);
            assertEquals(RiskTier.VERY_HIGH, result.tier());
            assertFalse(result.effectiveness().isDefined());
            assertTrue(result.recommendations().get(0).startsWith("Review use-of-force"));
            assertTrue(result.recommendations().get(1).startsWith("Increase operational presence"));
            assertTrue(result.recommendations().get(result.recommendations().size() - 1)
                .startsWith("Consider launching police operations"));

            assertEquals(AlertType.INTERVENTION_DEATHS, report.alerts().get(0).type());
            assertEquals(AlertPriority.CRITICAL, report.alerts().get(0).priority());
        }

        @Test
        @DisplayName("single period → forecast omitted, trend stable, result still produced")
        void singlePeriodNoForecast() {
            RiskResult result = engine.evaluate(List.of(
                record("sul", 2024, 4, 6, 0, 0, 0, 0.0, "none"))).results().get(0);

            assertNull(result.forecast());
            assertFalse(result.hasForecast());
            assertEquals(TrendDirection.STABLE, result.trend());
            assertEquals(RiskTier.LOW, result.tier());
        }

        @Test
        @DisplayName("forecast crosses the year boundary")
        void forecastPeriods() {
            RiskResult result = engine.evaluate(List.of(
                record("oeste", 2024, 11, 4, 0, 0, 0, 0.0, "none"),
                record("oeste", 2024, 12, 6, 0, 0, 0, 0.0, "none"))).results().get(0);

            List<PeriodForecast> forecast = result.forecast();
            assertEquals(7, forecast.size());
            assertEquals(ReportingPeriod.of(2025, 1), forecast.get(0).period());
            assertEquals(8.0, forecast.get(0).predictedCrimeCount(), EPS);
            assertEquals(ReportingPeriod.of(2025, 7), forecast.get(6).period());
            assertEquals(TrendDirection.RISING, result.trend());
        }

        @Test
        @DisplayName("records out of order are evaluated by period")
        void outOfOrder() {
            RiskResult result = engine.evaluate(List.of(
                record("oeste", 2024, 3, 9, 0, 0, 0, 0.0, "none"),
                record("oeste", 2024, 1, 3, 0, 0, 0, 0.0, "raid"),
                record("oeste", 2024, 2, 6, 0, 0, 0, 0.0, "none"))).results().get(0);

            assertEquals(ReportingPeriod.of(2024, 3), result.latestPeriod());
            assertEquals(3, result.periodsAggregated());
            assertEquals(12.0, result.forecast().get(0).predictedCrimeCount(), EPS);
        }
    }

    // ── table behaviour ────────────────────────────────────────────────────

    @Nested
    @DisplayName("table evaluation")
    class TableEvaluation {

        @Test
        @DisplayName("results are ordered by neighborhood id")
        void orderedById() {
            EvaluationReport report = engine.evaluate(List.of(
                record("zona", 2024, 1, 1, 0, 0, 0, 0.0, "none"),
                record("alto", 2024, 1, 1, 0, 0, 0, 0.0, "none"),
                record("mata", 2024, 1, 1, 0, 0, 0, 0.0, "none")));

            assertEquals(List.of("alto", "mata", "zona"),
                report.results().stream().map(RiskResult::neighborhoodId).toList());
        }

        @Test
        @DisplayName("invalid records are rejected without aborting other neighborhoods")
        void partialFailure() {
            EvaluationReport report = engine.evaluate(List.of(
                record("a", 2024, 1, 5, 0, 0, 0, 0.0, "none"),
                record("b", 2024, 1, -3, 0, 0, 0, 0.0, "none"),
                record("b", 2024, 2, 7, 0, 0, 0, 0.0, "none"),
                record("c", 2024, 1, 4, 0, -1, 0, 0.0, "none")));

            assertEquals(List.of("a", "b"), report.results().stream().map(RiskResult::neighborhoodId).toList());
            assertEquals(2, report.rejections().size());

            RecordRejection first = report.rejections().get(0);
            assertEquals("b", first.neighborhoodId());
            assertEquals(ReportingPeriod.of(2024, 1), first.period());
            assertTrue(first.reason().contains("crimeCount"));
        }

        @Test
        @DisplayName("duplicate period keeps the first record and rejects the rest")
        void duplicatePeriod() {
            EvaluationReport report = engine.evaluate(List.of(
                record("a", 2024, 1, 5, 0, 0, 0, 0.0, "none"),
                record("a", 2024, 1, 50, 0, 0, 0, 0.0, "none")));

            assertEquals(5.0, report.results().get(0).score(), EPS);
            assertEquals(1, report.rejections().size());
            assertEquals("duplicate period", report.rejections().get(0).reason());
        }

        @Test
        @DisplayName("empty table → empty report")
        void emptyTable() {
            EvaluationReport report = engine.evaluate(List.of());
            assertTrue(report.results().isEmpty());
            assertTrue(report.rejections().isEmpty());
            assertTrue(report.alerts().isEmpty());
        }

        @Test
        @DisplayName("overflowing aggregate rejects only that neighborhood")
        void overflowingAggregate() {
            EvaluationReport report = engine.evaluate(List.of(
                record("a", 2024, 1, 1_500_000_000, 0, 0, 0, 0.0, "none"),
                record("a", 2024, 2, 1_500_000_000, 0, 0, 0, 0.0, "none"),
                record("b", 2024, 1, 12, 0, 0, 0, 0.0, "none")));

            assertEquals(List.of("b"), report.results().stream().map(RiskResult::neighborhoodId).toList());
            assertEquals(1, report.rejections().size());
            RecordRejection rejection = report.rejections().get(0);
            assertEquals("a", rejection.neighborhoodId());
            assertEquals(ReportingPeriod.of(2024, 2), rejection.period());
            assertTrue(rejection.reason().contains("overflows"));
        }

        @Test
        @DisplayName("an unexpected failure in one neighborhood does not abort the table")
        void unexpectedFailureIsolated() {
            // zero drug weight times an infinite drug total gives a NaN ratio
            EngineSettings settings = new EngineSettings(ScoringWeights.DEFAULTS, TierBreakpoints.DEFAULTS,
                new EffectivenessSettings(EffectivenessDenominator.CRIME_COUNT, 1.0, 1.0, 0.0, 0.15, 0.30),
                ForecastSettings.DEFAULTS, AlertSettings.DEFAULTS, 0);
            EvaluationReport report = new RiskEvaluationEngine(settings).evaluate(List.of(
                record("a", 2024, 1, 5, 0, 0, 0, Double.MAX_VALUE, "none"),
                record("a", 2024, 2, 5, 0, 0, 0, Double.MAX_VALUE, "none"),
                record("b", 2024, 1, 12, 0, 2, 0, 0.0, "patrol")));

            assertEquals(List.of("b"), report.results().stream().map(RiskResult::neighborhoodId).toList());
            assertEquals(1, report.rejections().size());
            assertEquals("a", report.rejections().get(0).neighborhoodId());
            assertNull(report.rejections().get(0).period());
        }

        @Test
        @DisplayName("null table is rejected")
        void nullTable() {
            assertThrows(IllegalArgumentException.class, () -> engine.evaluate(null));
        }

        @Test
        @DisplayName("same table twice → equal reports")
        void deterministic() {
            List<IndicatorRecord> table = List.of(
                record("a", 2024, 1, 12, 0, 2, 1, 0.3, "patrol"),
                record("a", 2024, 2, 18, 0, 1, 0, 0.0, "none"));
            assertEquals(engine.evaluate(table), engine.evaluate(table));
        }
    }

    // ── settings ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("aggregation window limits the scored periods but not the forecast")
    void aggregationWindow() {
        EngineSettings lastPeriodOnly = new EngineSettings(ScoringWeights.DEFAULTS, TierBreakpoints.DEFAULTS,
            EffectivenessSettings.DEFAULTS, ForecastSettings.DEFAULTS, AlertSettings.DEFAULTS, 1);
        RiskResult result = new RiskEvaluationEngine(lastPeriodOnly).evaluate(List.of(
            record("a", 2024, 1, 10, 0, 0, 0, 0.0, "none"),
            record("a", 2024, 2, 20, 0, 0, 0, 0.0, "none"))).results().get(0);

        assertEquals(1, result.periodsAggregated());
        assertEquals(20.0, result.score(), EPS);
        assertEquals(30.0, result.forecast().get(0).predictedCrimeCount(), EPS);
    }

    // ── evaluateNeighborhood() ─────────────────────────────────────────────

    @Nested
    @DisplayName("evaluateNeighborhood()")
    class EvaluateNeighborhood {

        @Test
        @DisplayName("sums every period of the neighborhood")
        void sums() {
            RiskResult result = engine.evaluateNeighborhood("a", List.of(
                record("a", 2024, 2, 4, 0, 0, 0, 0.0, "none"),
                record("a", 2024, 1, 6, 0, 0, 0, 0.0, "none")));
            assertEquals(10.0, result.score(), EPS);
            assertEquals(RiskTier.LOW_MEDIUM, result.tier());
        }

        @Test
        @DisplayName("foreign, duplicate or invalid records throw")
        void strict() {
            assertThrows(InvalidIndicatorException.class, () -> engine.evaluateNeighborhood("a", List.of(
                record("b", 2024, 1, 1, 0, 0, 0, 0.0, "none"))));
            assertThrows(InvalidIndicatorException.class, () -> engine.evaluateNeighborhood("a", List.of(
                record("a", 2024, 1, 1, 0, 0, 0, 0.0, "none"),
                record("a", 2024, 1, 2, 0, 0, 0, 0.0, "none"))));
            assertThrows(InvalidIndicatorException.class, () -> engine.evaluateNeighborhood("a", List.of(
                record("a", 2024, 1, 1, -2, 0, 0, 0.0, "none"))));
            assertThrows(InvalidIndicatorException.class, () -> engine.evaluateNeighborhood("a", List.of()));
        }
    }
}
