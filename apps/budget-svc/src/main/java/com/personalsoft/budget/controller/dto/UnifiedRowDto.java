package com.personalsoft.budget.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record UnifiedRowDto(
        String occurrenceId,
        String kind,
        String ruleId,
        String type,
        String category,
        String description,
        BigDecimal amount,
        LocalDate dueDate,
        LocalDate effectiveDate,
        boolean postponed,
        boolean paid,
        LocalDate paidOn,
        boolean overdue,
        boolean dueToday,
        String status
) {
}
