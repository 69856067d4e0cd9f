package com.routely.backend.exception;

import com.routely.backend.model.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.LocalDateTime;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String ADMIN_PATH = "/api/v1/admin";

    @ExceptionHandler(RoutePlanningException.class)
    public ResponseEntity<ErrorResponse> handleRoutePlanning(RoutePlanningException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex, request);
        if (ex instanceof FareRuleMissingException || status.is5xxServerError() && !ex.isRetryable()) {
            log.error("{} at {}: {}", ex.getCode(), request.getRequestURI(), ex.getMessage());
        } else {
            log.warn("{} at {}: {}", ex.getCode(), request.getRequestURI(), ex.getMessage());
        }
        return build(status, ex.getCode(), ex.getMessage(), ex.isRetryable(), request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParams(MissingServletRequestParameterException ex,
            HttpServletRequest request) {
        log.warn("Bad Request: Missing parameter - {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), null, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex,
            HttpServletRequest request) {
        log.warn("Bad Request: Unreadable body - {}", ex.getMostSpecificCause().getMessage());
        return build(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Malformed request: "
                + ex.getMostSpecificCause().getMessage(), null, request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NoResourceFoundException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(Exception ex, HttpServletRequest request) {
        log.error("Internal Server Error at {}: ", request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "An unexpected error occurred. Please check logs.", null, request);
    }

    static HttpStatus statusFor(RoutePlanningException ex, HttpServletRequest request) {
        if (ex instanceof IntegrityException) {
            return request.getRequestURI().startsWith(ADMIN_PATH)
                    ? HttpStatus.INTERNAL_SERVER_ERROR
                    : HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (ex instanceof StationNotFoundException || ex instanceof NoPathException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof InvalidPlanRequestException || ex instanceof InvalidPassengerTypeException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (ex instanceof SearchBudgetExceededException || ex instanceof SnapshotUnavailableException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message, Boolean retryable,
            HttpServletRequest request) {
        ErrorResponse error = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .retryable(retryable)
                .build();
        return new ResponseEntity<>(error, status);
    }
}
