package com.homeplanner.mortgage.controller;

import com.homeplanner.mortgage.controller.dto.ErrorResponseDto;
import com.homeplanner.mortgage.exception.InvalidLoanException;
import com.homeplanner.mortgage.exception.InvalidPlanException;
import com.homeplanner.mortgage.exception.InvariantViolationException;
import com.homeplanner.mortgage.web.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidLoanException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidLoan(InvalidLoanException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_LOAN", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(InvalidPlanException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidPlan(InvalidPlanException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_PLAN", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDto> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, Object> fields = new HashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed", fields);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponseDto> handleConstraintViolation(ConstraintViolationException ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> handleUnreadable(HttpMessageNotReadableException ex) {
        String reason = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body could not be read",
                Map.of("reason", String.valueOf(reason)));
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ErrorResponseDto> handleInvariantViolation(InvariantViolationException ex) {
        log.error("Invariant violation while computing a schedule: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INVARIANT_VIOLATION", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error",
                Map.of("reason", String.valueOf(ex.getMessage())));
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.currentTraceId().orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, traceId));
    }
}
