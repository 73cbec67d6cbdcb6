package com.personalsoft.budget.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

public record Totals(BigDecimal totalIncome, BigDecimal totalExpenses, BigDecimal remainingToPay) {

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);

    public static Totals empty() {
        return new Totals(ZERO, ZERO, ZERO);
    }

    /** Remaining-to-pay only counts unpaid expenses. */
    public static Totals of(List<? extends UnifiedRow> rows) {
        BigDecimal income = BigDecimal.ZERO;
        BigDecimal expenses = BigDecimal.ZERO;
        BigDecimal unpaid = BigDecimal.ZERO;
        for (UnifiedRow row : rows) {
            BigDecimal amount = row.amount() == null ? BigDecimal.ZERO : row.amount().abs();
            if (row.type() == EntryType.INCOME) {
                income = income.add(amount);
                continue;
            }
            expenses = expenses.add(amount);
            if (!row.isPaid()) {
                unpaid = unpaid.add(amount);
            }
        }
        return new Totals(
                income.setScale(2, RoundingMode.HALF_UP),
                expenses.setScale(2, RoundingMode.HALF_UP),
                unpaid.setScale(2, RoundingMode.HALF_UP)
        );
    }
}
