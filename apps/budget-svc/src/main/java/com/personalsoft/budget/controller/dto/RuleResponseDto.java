package com.personalsoft.budget.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record RuleResponseDto(
        String id,
        String type,
        String category,
        String description,
        BigDecimal amount,
        String frequency,
        Integer dom,
        Integer dow,
        LocalDate startAnchor,
        boolean active,
        LocalDate endDate
) {
}
