package com.safetyrisk.riskservice.logger;

import com.safetyrisk.common.model.EvaluationReport;
import com.safetyrisk.riskservice.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a request's journey through the risk service. Pure side effects;
 * nothing here alters the pipeline.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}     request accepted by the controller</li>
 *   <li>{@link #EVALUATION_COMPLETED} table evaluated (or served from cache)</li>
 *   <li>{@link #FORECAST_COMPLETED}   stand-alone forecast computed</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(EvaluationFlowLogger.FORECAST_COMPLETED))
 * </pre>
 */
@Component
public class EvaluationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(EvaluationFlowLogger.class);

    public static final String REQUEST_RECEIVED     = "REQUEST_RECEIVED";
    public static final String EVALUATION_COMPLETED = "EVALUATION_COMPLETED";
    public static final String FORECAST_COMPLETED   = "FORECAST_COMPLETED";

    /**
     * Returns a {@code doOnEach} consumer logging {@code stageName} on {@code onNext}.
     * The trace id is read from the signal's Reactor Context, never from MDC.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[EvaluationFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /**
     * Logs {@link #EVALUATION_COMPLETED} with the report's counts.
     */
    public Consumer<Signal<EvaluationReport>> evaluationSummary() {
        return signal -> {
            if (!signal.isOnNext()) return;
            EvaluationReport report = signal.get();
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[EvaluationFlow] stage={} neighborhoods={} rejections={} alerts={} traceId={}",
                         EVALUATION_COMPLETED,
                         report.results().size(), report.rejections().size(), report.alerts().size(),
                         traceId)
            );
        };
    }

    /**
     * For callers that hold the trace id directly, before any Reactor Context exists.
     */
    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[EvaluationFlow] stage={} traceId={}", stageName, traceId)
        );
    }
}
