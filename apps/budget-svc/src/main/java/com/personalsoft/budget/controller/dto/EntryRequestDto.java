package com.personalsoft.budget.controller.dto;

import com.personalsoft.budget.model.EntryType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;

public record EntryRequestDto(
        @NotNull EntryType type,
        @Size(max = 64) String category,
        @Size(max = 255) String description,
        @NotNull @DecimalMin("0.00") BigDecimal amount,
        @NotNull LocalDate dueDate
) {
}
