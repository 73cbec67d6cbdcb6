package com.personalsoft.budget.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record WeekItemsResponseDto(List<WeekItemDto> items, String traceId) {

    public record WeekItemDto(String id, LocalDate date, String title, String source, BigDecimal amount, boolean overdue) {
    }
}
