package com.safetyrisk.riskservice.service;

import com.safetyrisk.common.cache.EvaluationCache;
import com.safetyrisk.common.cache.InputFingerprint;
import com.safetyrisk.common.engine.RiskEvaluationEngine;
import com.safetyrisk.common.model.EvaluationReport;
import com.safetyrisk.common.model.ForecastPoint;
import com.safetyrisk.common.model.IndicatorRecord;
import com.safetyrisk.riskservice.config.RiskEngineProperties;
import com.safetyrisk.riskservice.dto.ForecastRequest;
import com.safetyrisk.riskservice.logger.EvaluationFlowLogger;
import com.safetyrisk.riskservice.status.SystemStatus;
import com.safetyrisk.riskservice.status.SystemStatusTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Runs the synchronous engine off the event loop and keeps the status tracker current.
 *
 * <p>Identical tables under identical settings are evaluated once and served from the
 * {@link EvaluationCache} afterwards, unless {@code risk-engine.cache.enabled} is false.
 */
@Service
public class RiskEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(RiskEvaluationService.class);

    private final RiskEvaluationEngine engine;
    private final EvaluationCache cache;
    private final RiskEngineProperties properties;
    private final SystemStatusTracker statusTracker;
    private final EvaluationFlowLogger flowLogger;

    public RiskEvaluationService(RiskEvaluationEngine engine,
                                 EvaluationCache cache,
                                 RiskEngineProperties properties,
                                 SystemStatusTracker statusTracker,
                                 EvaluationFlowLogger flowLogger) {
        this.engine = engine;
        this.cache = cache;
        this.properties = properties;
        this.statusTracker = statusTracker;
        this.flowLogger = flowLogger;
    }

    public Mono<EvaluationReport> evaluate(List<IndicatorRecord> records) {
        if (records == null) {
            return Mono.error(new IllegalArgumentException("Indicator table is required"));
        }
        return Mono.fromCallable(() -> evaluateTable(records))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnNext(statusTracker::recordEvaluation)
            .doOnEach(flowLogger.evaluationSummary())
            .doOnError(e -> log.error("Evaluation failed for {} records", records.size(), e));
    }

    public Mono<List<ForecastPoint>> forecast(ForecastRequest request) {
        if (request == null || request.series() == null) {
            return Mono.error(new IllegalArgumentException("Forecast series is required"));
        }
        int horizon = request.horizon() != null ? request.horizon() : properties.getForecast().getHorizon();
        return Mono.fromCallable(() -> engine.forecast(request.series(), horizon))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnEach(flowLogger.stage(EvaluationFlowLogger.FORECAST_COMPLETED));
    }

    public SystemStatus status() {
        return statusTracker.snapshot(cache.stats());
    }

    private EvaluationReport evaluateTable(List<IndicatorRecord> records) {
        if (!properties.getCache().isEnabled()) {
            return engine.evaluate(records);
        }
        InputFingerprint fingerprint = InputFingerprint.of(records, engine.settings());
        log.debug("Evaluating records={} fingerprint={}", records.size(), fingerprint);
        return cache.getOrCompute(fingerprint, () -> engine.evaluate(records));
    }
}
