package com.planforge.api.exception;

import com.planforge.api.dto.response.ErrorResponse;
import com.planforge.common.constants.FailureClassification;
import com.planforge.core.attempt.PlanNotFoundException;
import com.planforge.core.attempt.RejectionReason;
import com.planforge.core.attempt.ReservationResult;
import com.planforge.core.event.GenerationErrorMessages;
import com.planforge.core.ratelimit.RateLimitExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Error bodies are always JSON, including on the event-stream endpoint, so the content type is preset
 * rather than negotiated.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        StringBuilder errors = new StringBuilder();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.append(fieldName).append(": ").append(error.getDefaultMessage()).append("; ");
        });

        ErrorResponse body = build(HttpStatus.BAD_REQUEST, "validation_failed", errors.toString().trim(), request);
        return respond(HttpStatus.BAD_REQUEST, body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        log.warn("[API] Unreadable request body | error={}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, build(HttpStatus.BAD_REQUEST, "invalid_request", "Malformed request body", request));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            WebRequest request
    ) {
        String message = "Invalid value for '" + ex.getName() + "'";
        return respond(HttpStatus.BAD_REQUEST, build(HttpStatus.BAD_REQUEST, "invalid_request", message, request));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            WebRequest request
    ) {
        return respond(HttpStatus.BAD_REQUEST, build(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage(), request));
    }

    @ExceptionHandler(PlanNotFoundException.class)
    public ResponseEntity<ErrorResponse> handlePlanNotFound(
            PlanNotFoundException ex,
            WebRequest request
    ) {
        return respond(HttpStatus.NOT_FOUND, build(HttpStatus.NOT_FOUND, "plan_not_found", "Plan not found", request));
    }

    @ExceptionHandler(GenerationRejectedException.class)
    public ResponseEntity<ErrorResponse> handleGenerationRejected(
            GenerationRejectedException ex,
            WebRequest request
    ) {
        ReservationResult result = ex.getResult();
        boolean capped = result.getRejectionReason() == RejectionReason.CAPPED;
        HttpStatus status = capped ? HttpStatus.TOO_MANY_REQUESTS : HttpStatus.CONFLICT;

        ErrorResponse body = capped
            ? build(status, GenerationErrorMessages.codeFor(FailureClassification.CAPPED),
                GenerationErrorMessages.messageFor(FailureClassification.CAPPED), request)
            : build(status, GenerationErrorMessages.IN_PROGRESS_CODE, GenerationErrorMessages.IN_PROGRESS_MESSAGE, request);
        body.setAttemptsUsed(result.getAttemptsUsed());
        body.setAttemptCap(result.getAttemptCap());
        return respond(status, body);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(
            RateLimitExceededException ex,
            WebRequest request
    ) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
            .contentType(MediaType.APPLICATION_JSON)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
            .body(build(HttpStatus.TOO_MANY_REQUESTS, "rate_limited", ex.getMessage(), request));
    }

    @ExceptionHandler(GenerationCapacityException.class)
    public ResponseEntity<ErrorResponse> handleCapacity(
            GenerationCapacityException ex,
            WebRequest request
    ) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .contentType(MediaType.APPLICATION_JSON)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
            .body(build(HttpStatus.SERVICE_UNAVAILABLE, "server_busy",
                "Too many generations in progress. Please retry shortly.", request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request
    ) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
            build(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred", request));
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorResponse body) {
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }

    private static ErrorResponse build(HttpStatus status, String error, String message, WebRequest request) {
        return ErrorResponse.builder()
            .error(error)
            .message(message)
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getDescription(false).replace("uri=", ""))
            .build();
    }
}
