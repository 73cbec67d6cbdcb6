package com.personalsoft.budget.model;

import static com.personalsoft.budget.BudgetFixtures.expense;
import static com.personalsoft.budget.BudgetFixtures.income;
import static com.personalsoft.budget.BudgetFixtures.monthly;
import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class UnifiedRowTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 11, 10);

    @Test
    void unpaidExpenseBeforeTodayIsOverdue() {
        UnifiedRow row = UnifiedRow.OneTime.from(expense("Water", TODAY.minusDays(1), BigDecimal.TEN));

        assertThat(row.isOverdue(TODAY)).isTrue();
        assertThat(row.isDueToday(TODAY)).isFalse();
        assertThat(row.status(TODAY)).isEqualTo(RowStatus.OVERDUE);
    }

    @Test
    void incomeIsNeverOverdue() {
        UnifiedRow row = UnifiedRow.OneTime.from(income("Invoice", TODAY.minusDays(5), BigDecimal.TEN));

        assertThat(row.isOverdue(TODAY)).isFalse();
        assertThat(row.status(TODAY)).isEqualTo(RowStatus.UPCOMING);
    }

    @Test
    void recurringRowUsesEffectiveDateForOverdue() {
        RecurringRule phone = monthly("Phone", 5, LocalDate.of(2025, 1, 1), new BigDecimal("60"));
        UnifiedRow.Recurring row = UnifiedRow.Recurring.from(phone, LocalDate.of(2025, 11, 5),
                new ResolvedOccurrence(LocalDate.of(2025, 11, 12), Optional.empty()));

        assertThat(row.isPostponed()).isTrue();
        assertThat(row.dueDate()).isEqualTo(LocalDate.of(2025, 11, 5));
        assertThat(row.isOverdue(TODAY)).isFalse();
        assertThat(row.occurrenceId()).isEqualTo(phone.id() + ":2025-11-05");
        assertThat(row.ruleId()).contains(phone.id());
    }

    @Test
    void totalsRoundToCents() {
        List<UnifiedRow> rows = List.of(
                UnifiedRow.OneTime.from(expense("A", TODAY, new BigDecimal("10.005"))),
                UnifiedRow.OneTime.from(expense("B", TODAY, new BigDecimal("5")).withPaidOn(TODAY)),
                UnifiedRow.OneTime.from(income("C", TODAY, new BigDecimal("1.1")))
        );

        Totals totals = Totals.of(rows);

        assertThat(totals.totalIncome()).isEqualTo(new BigDecimal("1.10"));
        assertThat(totals.totalExpenses()).isEqualTo(new BigDecimal("15.01"));
        assertThat(totals.remainingToPay()).isEqualTo(new BigDecimal("10.01"));
    }
}
