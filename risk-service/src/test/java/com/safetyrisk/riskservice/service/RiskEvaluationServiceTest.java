package com.safetyrisk.riskservice.service;

import com.safetyrisk.common.cache.EvaluationCache;
import com.safetyrisk.common.engine.RiskEvaluationEngine;
import com.safetyrisk.common.exception.InsufficientDataException;
import com.safetyrisk.common.model.EvaluationReport;
import com.safetyrisk.common.model.IndicatorRecord;
import com.safetyrisk.common.model.ReportingPeriod;
import com.safetyrisk.common.model.RiskTier;
import com.safetyrisk.common.model.SeriesPoint;
import com.safetyrisk.riskservice.config.RiskEngineProperties;
import com.safetyrisk.riskservice.dto.ForecastRequest;
import com.safetyrisk.riskservice.logger.EvaluationFlowLogger;
import com.safetyrisk.riskservice.status.SystemStatusTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskEvaluationServiceTest {

    private static final List<IndicatorRecord> TABLE = List.of(
        new IndicatorRecord("centro", ReportingPeriod.of(2024, 1), 10, 0, 1, 0, 0.0, 5, "none"),
        new IndicatorRecord("centro", ReportingPeriod.of(2024, 2), 14, 0, 2, 1, 0.0, 5, "patrol"),
        new IndicatorRecord("porto", ReportingPeriod.of(2024, 2), 50, 1, 0, 0, 0.0, 5, "none"));

    private RiskEngineProperties properties;
    private EvaluationCache cache;
    private SystemStatusTracker tracker;
    private RiskEvaluationService service;

    @BeforeEach
    void setUp() {
        properties = new RiskEngineProperties();
        cache = new EvaluationCache(properties.getCache().getMaxEntries());
        tracker = new SystemStatusTracker(properties, Clock.systemUTC());
        service = new RiskEvaluationService(new RiskEvaluationEngine(properties.toSettings()),
            cache, properties, tracker, new EvaluationFlowLogger());
    }

    // ── evaluate() ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("evaluate()")
    class Evaluate {

        @Test
        @DisplayName("emits one report with a result per neighborhood")
        void emitsReport() {
            StepVerifier.create(service.evaluate(TABLE))
                .assertNext(report -> {
                    assertEquals(2, report.results().size());
                    assertEquals("centro", report.results().get(0).neighborhoodId());
                    assertEquals(RiskTier.CRITICAL, report.results().get(1).tier());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("identical table is served from the cache")
        void cached() {
            EvaluationReport first = service.evaluate(TABLE).block();
            EvaluationReport second = service.evaluate(TABLE).block();

            assertSame(first, second);
            assertEquals(1, cache.stats().hits());
            assertEquals(1, cache.stats().misses());
        }

        @Test
        @DisplayName("disabled cache recomputes an equal report")
        void cacheDisabled() {
            properties.getCache().setEnabled(false);

            EvaluationReport first = service.evaluate(TABLE).block();
            EvaluationReport second = service.evaluate(TABLE).block();

            assertNotSame(first, second);
            assertEquals(first, second);
            assertEquals(0, cache.size());
        }

        @Test
        @DisplayName("updates the status tracker")
        void updatesStatus() {
            StepVerifier.create(service.evaluate(TABLE)).expectNextCount(1).verifyComplete();

            assertEquals(1, service.status().totalEvaluations());
            assertEquals(ReportingPeriod.of(2024, 2), service.status().latestPeriod());
            assertFalse(service.status().stale());
        }

        @Test
        @DisplayName("null table → IllegalArgumentException")
        void nullTable() {
            StepVerifier.create(service.evaluate(null))
                .expectError(IllegalArgumentException.class)
                .verify();
        }
    }

    // ── forecast() ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("forecast()")
    class Forecast {

        private final List<SeriesPoint> line = List.of(
            new SeriesPoint(0, 5), new SeriesPoint(1, 7), new SeriesPoint(2, 9));

        @Test
        @DisplayName("explicit horizon is honoured")
        void explicitHorizon() {
            StepVerifier.create(service.forecast(new ForecastRequest(line, 2)))
                .assertNext(points -> {
                    assertEquals(2, points.size());
                    assertEquals(11.0, points.get(0).predictedCrimeCount(), 1e-9);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("missing horizon falls back to the configured one")
        void defaultHorizon() {
            StepVerifier.create(service.forecast(new ForecastRequest(line, null)))
                .assertNext(points -> assertEquals(7, points.size()))
                .verifyComplete();
        }

        @Test
        @DisplayName("single point → InsufficientDataException")
        void insufficient() {
            StepVerifier.create(service.forecast(new ForecastRequest(List.of(new SeriesPoint(3, 4)), 2)))
                .expectError(InsufficientDataException.class)
                .verify();
        }

        @Test
        @DisplayName("missing series → IllegalArgumentException")
        void missingSeries() {
            StepVerifier.create(service.forecast(new ForecastRequest(null, 2)))
                .expectError(IllegalArgumentException.class)
                .verify();
        }
    }
}
