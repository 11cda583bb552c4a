package com.safetyrisk.riskservice.exception;

import com.safetyrisk.common.exception.InsufficientDataException;
import com.safetyrisk.common.exception.InvalidIndicatorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps engine and request failures onto {@link ErrorResponse} bodies.
 *
 * <ul>
 *   <li>{@link InvalidIndicatorException}, {@link IllegalArgumentException}: 400</li>
 *   <li>{@link InsufficientDataException}: 422</li>
 *   <li>{@link ResponseStatusException} such as a malformed body: its own status</li>
 *   <li>anything else: 500</li>
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidIndicatorException.class)
    public ResponseEntity<ErrorResponse> handleInvalidIndicator(InvalidIndicatorException ex) {
        log.warn("Rejected indicator: {}", ex.getMessage());
        Map<String, Object> details = new HashMap<>();
        if (ex.getNeighborhoodId() != null) {
            details.put("neighborhoodId", ex.getNeighborhoodId());
        }
        if (ex.getPeriod() != null) {
            details.put("period", ex.getPeriod().toString());
        }
        details.put("reason", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Indicator", ex.getMessage(), details);
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientData(InsufficientDataException ex) {
        log.warn("Insufficient data: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Data", ex.getMessage(),
            Map.of("distinctPeriods", ex.getDistinctPeriods()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), null);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException ex) {
        log.warn("Request failed: {}", ex.getMessage());
        HttpStatusCode code = ex.getStatusCode();
        HttpStatus status = HttpStatus.resolve(code.value());
        String error = status != null ? status.getReasonPhrase() : "Error";
        return respond(code, error, ex.getReason(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatusCode status, String error,
                                                         String message, Map<String, Object> details) {
        ErrorResponse body = ErrorResponse.builder()
            .timestamp(Instant.now())
            .status(status.value())
            .error(error)
            .message(message)
            .details(details)
            .build();
        return ResponseEntity.status(status).body(body);
    }
}
