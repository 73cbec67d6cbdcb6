package com.personalsoft.budget.controller.dto;

import com.personalsoft.budget.model.EntryType;
import com.personalsoft.budget.model.Frequency;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;

// dom/dow ranges are checked by RecurringRuleValidator so the error names the rule
public record RuleRequestDto(
        @NotNull EntryType type,
        @Size(max = 64) String category,
        @Size(max = 255) String description,
        @NotNull @DecimalMin("0.00") BigDecimal amount,
        @NotNull Frequency frequency,
        Integer dom,
        Integer dow,
        @NotNull LocalDate startAnchor,
        Boolean active,
        LocalDate endDate
) {
}
