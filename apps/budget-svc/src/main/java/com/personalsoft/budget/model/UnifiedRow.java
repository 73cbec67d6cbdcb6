package com.personalsoft.budget.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * One materialized obligation inside a snapshot window. Either a one-time entry or a single
 * occurrence of a recurring rule; each variant carries only the fields it can have.
 *
 * <p>The overdue and due-today flags depend on the caller's "today" and are derived on demand,
 * never stored on the row.
 */
public sealed interface UnifiedRow permits UnifiedRow.OneTime, UnifiedRow.Recurring {

    String occurrenceId();

    RowKind kind();

    Optional<UUID> ruleId();

    EntryType type();

    String category();

    String description();

    BigDecimal amount();

    /** Originally scheduled date. */
    LocalDate dueDate();

    /** Date after overrides; drives filtering, sorting and the overdue flag. */
    LocalDate effectiveDate();

    Optional<LocalDate> paidOn();

    default boolean isPaid() {
        return paidOn().isPresent();
    }

    default boolean isOverdue(LocalDate today) {
        return type() == EntryType.EXPENSE && !isPaid() && effectiveDate().isBefore(today);
    }

    default boolean isDueToday(LocalDate today) {
        return type() == EntryType.EXPENSE && !isPaid() && effectiveDate().isEqual(today);
    }

    default RowStatus status(LocalDate today) {
        if (isPaid()) {
            return RowStatus.PAID;
        }
        return isOverdue(today) ? RowStatus.OVERDUE : RowStatus.UPCOMING;
    }

    record OneTime(
            UUID entryId,
            EntryType type,
            String category,
            String description,
            BigDecimal amount,
            LocalDate dueDate,
            Optional<LocalDate> paidOn
    ) implements UnifiedRow {

        public static OneTime from(OneTimeEntry entry) {
            return new OneTime(
                    entry.id(),
                    entry.type(),
                    entry.category(),
                    entry.description(),
                    entry.amount(),
                    entry.dueDate(),
                    entry.paidOn()
            );
        }

        @Override
        public String occurrenceId() {
            return entryId.toString();
        }

        @Override
        public RowKind kind() {
            return RowKind.ONE_TIME;
        }

        @Override
        public Optional<UUID> ruleId() {
            return Optional.empty();
        }

        @Override
        public LocalDate effectiveDate() {
            return dueDate;
        }
    }

    record Recurring(
            UUID rule,
            LocalDate occurrenceDate,
            LocalDate effectiveDate,
            EntryType type,
            String category,
            String description,
            BigDecimal amount,
            Optional<LocalDate> paidOn
    ) implements UnifiedRow {

        public static Recurring from(RecurringRule rule, LocalDate occurrenceDate, ResolvedOccurrence resolved) {
            return new Recurring(
                    rule.id(),
                    occurrenceDate,
                    resolved.effectiveDate(),
                    rule.type(),
                    rule.category(),
                    rule.description(),
                    rule.amount(),
                    resolved.paidOn()
            );
        }

        public OccurrenceKey key() {
            return new OccurrenceKey(rule, occurrenceDate);
        }

        @Override
        public String occurrenceId() {
            return key().asOccurrenceId();
        }

        @Override
        public RowKind kind() {
            return RowKind.RECURRING;
        }

        @Override
        public Optional<UUID> ruleId() {
            return Optional.of(rule);
        }

        @Override
        public LocalDate dueDate() {
            return occurrenceDate;
        }

        public boolean isPostponed() {
            return !effectiveDate.isEqual(occurrenceDate);
        }
    }
}
