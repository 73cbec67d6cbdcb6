package com.personalsoft.budget.controller.dto;

import java.util.Map;

/** Uniform error body; {@code details} is never null. */
public record ErrorResponseDto(String code, String message, Map<String, Object> details, String traceId) {

    public ErrorResponseDto {
        details = details == null ? Map.of() : details;
    }

    public static ErrorResponseDto of(String code, String message, String traceId) {
        return new ErrorResponseDto(code, message, Map.of(), traceId);
    }
}
