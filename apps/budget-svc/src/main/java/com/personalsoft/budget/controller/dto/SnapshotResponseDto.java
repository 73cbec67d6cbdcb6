package com.personalsoft.budget.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record SnapshotResponseDto(
        PeriodDto period,
        TotalsDto totals,
        Integer count,
        List<UnifiedRowDto> rows,
        String traceId
) {

    public record PeriodDto(String month, LocalDate from, LocalDate to, LocalDate today) {
    }

    public record TotalsDto(BigDecimal totalIncome, BigDecimal totalExpenses, BigDecimal remainingToPay) {
    }
}
