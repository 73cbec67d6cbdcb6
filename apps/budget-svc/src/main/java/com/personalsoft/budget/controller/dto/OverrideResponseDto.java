package com.personalsoft.budget.controller.dto;

import java.time.LocalDate;

public record OverrideResponseDto(
        String occurrenceId,
        String ruleId,
        LocalDate occurrenceDate,
        LocalDate effectiveDate,
        boolean paid,
        LocalDate paidOn,
        boolean skipped
) {
}
