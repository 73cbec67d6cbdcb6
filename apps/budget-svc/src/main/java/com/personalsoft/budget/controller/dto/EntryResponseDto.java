package com.personalsoft.budget.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record EntryResponseDto(
        String id,
        String type,
        String category,
        String description,
        BigDecimal amount,
        LocalDate dueDate,
        boolean paid,
        LocalDate paidOn
) {
}
