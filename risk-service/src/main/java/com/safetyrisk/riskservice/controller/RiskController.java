package com.safetyrisk.riskservice.controller;

import com.safetyrisk.common.model.EvaluationReport;
import com.safetyrisk.common.model.ForecastPoint;
import com.safetyrisk.common.model.IndicatorRecord;
import com.safetyrisk.riskservice.dto.ForecastRequest;
import com.safetyrisk.riskservice.logger.EvaluationFlowLogger;
import com.safetyrisk.riskservice.service.RiskEvaluationService;
import com.safetyrisk.riskservice.status.SystemStatus;
import com.safetyrisk.riskservice.trace.TraceContextUtil;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/risk")
public class RiskController {

    private final RiskEvaluationService evaluationService;
    private final EvaluationFlowLogger flowLogger;

    public RiskController(RiskEvaluationService evaluationService, EvaluationFlowLogger flowLogger) {
        this.evaluationService = evaluationService;
        this.flowLogger = flowLogger;
    }

    @PostMapping("/evaluate")
    public Mono<ResponseEntity<EvaluationReport>> evaluate(
            @RequestBody List<IndicatorRecord> records,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceIdHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceIdHeader);
        flowLogger.logWithTraceId(EvaluationFlowLogger.REQUEST_RECEIVED, traceId);
        return TraceContextUtil.withTraceId(
            evaluationService.evaluate(records)
                .map(report -> ResponseEntity.ok()
                    .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
                    .body(report)),
            traceId);
    }

    @PostMapping("/forecast")
    public Mono<ResponseEntity<List<ForecastPoint>>> forecast(
            @RequestBody ForecastRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceIdHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceIdHeader);
        flowLogger.logWithTraceId(EvaluationFlowLogger.REQUEST_RECEIVED, traceId);
        return TraceContextUtil.withTraceId(
            evaluationService.forecast(request)
                .map(points -> ResponseEntity.ok()
                    .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
                    .body(points)),
            traceId);
    }

    @GetMapping("/status")
    public ResponseEntity<SystemStatus> status() {
        return ResponseEntity.ok(evaluationService.status());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
