package com.personalsoft.budget;

import com.personalsoft.budget.model.EntryType;
import com.personalsoft.budget.model.Frequency;
import com.personalsoft.budget.model.OccurrenceOverride;
import com.personalsoft.budget.model.OneTimeEntry;
import com.personalsoft.budget.model.RecurringRule;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

public final class BudgetFixtures {

    public static final UUID USER = UUID.fromString("00000000-0000-0000-0000-0000000000aa");

    private BudgetFixtures() {
    }

    public static RecurringRule monthly(String description, int dom, LocalDate anchor, BigDecimal amount) {
        return rule(description, Frequency.MONTHLY, dom, null, anchor, amount);
    }

    public static RecurringRule weekly(String description, int dow, LocalDate anchor) {
        return rule(description, Frequency.WEEKLY, null, dow, anchor, new BigDecimal("25.00"));
    }

    public static RecurringRule biweekly(String description, int dow, LocalDate anchor) {
        return rule(description, Frequency.BIWEEKLY, null, dow, anchor, new BigDecimal("1200.00"));
    }

    public static RecurringRule rule(String description, Frequency frequency, Integer dom, Integer dow, LocalDate anchor, BigDecimal amount) {
        return new RecurringRule(
                UUID.randomUUID(),
                USER,
                EntryType.EXPENSE,
                "bill",
                description,
                amount,
                frequency,
                dom,
                dow,
                anchor,
                true,
                Optional.empty()
        );
    }

    public static OneTimeEntry expense(String description, LocalDate dueDate, BigDecimal amount) {
        return new OneTimeEntry(UUID.randomUUID(), USER, EntryType.EXPENSE, "other", description, amount, dueDate, Optional.empty());
    }

    public static OneTimeEntry income(String description, LocalDate dueDate, BigDecimal amount) {
        return new OneTimeEntry(UUID.randomUUID(), USER, EntryType.INCOME, "business_income", description, amount, dueDate, Optional.empty());
    }

    public static OccurrenceOverride postponed(RecurringRule rule, LocalDate occurrenceDate, LocalDate newDate) {
        return new OccurrenceOverride(USER, rule.id(), occurrenceDate, Optional.of(newDate), Optional.empty(), false, Instant.parse("2025-01-01T00:00:00Z"));
    }

    public static OccurrenceOverride paid(RecurringRule rule, LocalDate occurrenceDate, LocalDate paidOn) {
        return new OccurrenceOverride(USER, rule.id(), occurrenceDate, Optional.empty(), Optional.of(paidOn), false, Instant.parse("2025-01-01T00:00:00Z"));
    }

    public static OccurrenceOverride skipped(RecurringRule rule, LocalDate occurrenceDate) {
        return new OccurrenceOverride(USER, rule.id(), occurrenceDate, Optional.empty(), Optional.empty(), true, Instant.parse("2025-01-01T00:00:00Z"));
    }
}
