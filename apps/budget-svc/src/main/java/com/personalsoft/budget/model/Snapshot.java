package com.personalsoft.budget.model;

import java.time.LocalDate;
import java.util.List;

public record Snapshot(
        LocalDate windowStart,
        LocalDate windowEnd,
        LocalDate today,
        List<UnifiedRow> rows,
        Totals totals
) {
    public Snapshot {
        rows = List.copyOf(rows);
    }

    public static Snapshot empty(LocalDate windowStart, LocalDate windowEnd, LocalDate today) {
        return new Snapshot(windowStart, windowEnd, today, List.of(), Totals.empty());
    }

    public List<UnifiedRow> overdueRows() {
        return rows.stream().filter(row -> row.isOverdue(today)).toList();
    }

    public List<UnifiedRow> dueTodayRows() {
        return rows.stream().filter(row -> row.isDueToday(today)).toList();
    }

    public List<UnifiedRow> unpaidRows() {
        return rows.stream().filter(row -> !row.isPaid()).toList();
    }
}
