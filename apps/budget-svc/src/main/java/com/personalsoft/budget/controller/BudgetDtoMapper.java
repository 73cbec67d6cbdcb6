package com.personalsoft.budget.controller;

import com.personalsoft.budget.controller.dto.EntryResponseDto;
import com.personalsoft.budget.controller.dto.OverrideResponseDto;
import com.personalsoft.budget.controller.dto.RuleResponseDto;
import com.personalsoft.budget.controller.dto.SnapshotResponseDto;
import com.personalsoft.budget.controller.dto.UnifiedRowDto;
import com.personalsoft.budget.model.OccurrenceOverride;
import com.personalsoft.budget.model.OneTimeEntry;
import com.personalsoft.budget.model.RecurringRule;
import com.personalsoft.budget.model.Snapshot;
import com.personalsoft.budget.model.Totals;
import com.personalsoft.budget.model.UnifiedRow;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

final class BudgetDtoMapper {

    private BudgetDtoMapper() {
    }

    static SnapshotResponseDto toSnapshot(Snapshot snapshot, YearMonth month, String traceId) {
        Totals totals = snapshot.totals();
        return new SnapshotResponseDto(
                new SnapshotResponseDto.PeriodDto(
                        month != null ? month.toString() : null,
                        snapshot.windowStart(),
                        snapshot.windowEnd(),
                        snapshot.today()
                ),
                new SnapshotResponseDto.TotalsDto(totals.totalIncome(), totals.totalExpenses(), totals.remainingToPay()),
                snapshot.rows().size(),
                snapshot.rows().stream().map(row -> toRow(row, snapshot.today())).toList(),
                traceId
        );
    }

    static UnifiedRowDto toRow(UnifiedRow row, LocalDate today) {
        return new UnifiedRowDto(
                row.occurrenceId(),
                row.kind().name(),
                row.ruleId().map(UUID::toString).orElse(null),
                row.type().name(),
                row.category(),
                row.description(),
                row.amount(),
                row.dueDate(),
                row.effectiveDate(),
                row instanceof UnifiedRow.Recurring recurring && recurring.isPostponed(),
                row.isPaid(),
                row.paidOn().orElse(null),
                row.isOverdue(today),
                row.isDueToday(today),
                row.status(today).name()
        );
    }

    static EntryResponseDto toEntry(OneTimeEntry entry) {
        return new EntryResponseDto(
                entry.id().toString(),
                entry.type().name(),
                entry.category(),
                entry.description(),
                entry.amount(),
                entry.dueDate(),
                entry.isPaid(),
                entry.paidOn().orElse(null)
        );
    }

    static RuleResponseDto toRule(RecurringRule rule) {
        return new RuleResponseDto(
                rule.id().toString(),
                rule.type().name(),
                rule.category(),
                rule.description(),
                rule.amount(),
                rule.frequency().name(),
                rule.dom(),
                rule.dow(),
                rule.startAnchor(),
                rule.active(),
                rule.endDate().orElse(null)
        );
    }

    static OverrideResponseDto toOverride(OccurrenceOverride override) {
        return new OverrideResponseDto(
                override.key().asOccurrenceId(),
                override.ruleId().toString(),
                override.occurrenceDate(),
                override.effectiveDate().orElse(override.occurrenceDate()),
                override.isPaid(),
                override.paidOn().orElse(null),
                override.skipped()
        );
    }
}
