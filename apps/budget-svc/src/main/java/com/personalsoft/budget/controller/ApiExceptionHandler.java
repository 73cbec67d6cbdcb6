package com.personalsoft.budget.controller;

import com.personalsoft.budget.controller.dto.ErrorResponseDto;
import com.personalsoft.budget.schedule.InvalidRecurringRuleException;
import com.personalsoft.budget.security.RequestContextHolder;
import com.personalsoft.budget.security.UnauthenticatedException;
import com.personalsoft.budget.service.BudgetItemNotFoundException;
import jakarta.validation.ConstraintViolationException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponseDto> handleMalformedRequest(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", "Malformed request", Map.of("reason", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(InvalidRecurringRuleException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidRule(InvalidRecurringRuleException ex) {
        log.warn("Rejected recurring rule {}: {}", ex.ruleId(), ex.getMessage());
        Map<String, Object> details = new HashMap<>();
        details.put("ruleId", ex.ruleId() != null ? ex.ruleId().toString() : null);
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_RULE", ex.getMessage(), details);
    }

    @ExceptionHandler(BudgetItemNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(BudgetItemNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<ErrorResponseDto> handleUnauthenticated(UnauthenticatedException ex) {
        return build(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED", "X-User-Id header is required", Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", Map.of("reason", String.valueOf(ex.getMessage())));
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.traceId().orElse(null);
        ErrorResponseDto body = details.isEmpty()
                ? ErrorResponseDto.of(code, message, traceId)
                : new ErrorResponseDto(code, message, details, traceId);
        return ResponseEntity.status(status).body(body);
    }
}
