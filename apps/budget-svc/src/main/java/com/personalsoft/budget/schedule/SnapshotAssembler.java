package com.personalsoft.budget.schedule;

import com.personalsoft.budget.model.OccurrenceOverride;
import com.personalsoft.budget.model.OneTimeEntry;
import com.personalsoft.budget.model.RecurringRule;
import com.personalsoft.budget.model.ResolvedOccurrence;
import com.personalsoft.budget.model.Snapshot;
import com.personalsoft.budget.model.Totals;
import com.personalsoft.budget.model.UnifiedRow;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Merges one-time entries with the expanded, override-resolved occurrences of every recurring
 * rule into a single sorted row set for an inclusive window.
 *
 * <p>Stateless and side-effect free: the inputs are read, never modified, and equal inputs always
 * yield equal snapshots in the same order.
 */
@Component
public class SnapshotAssembler {

    static final Comparator<UnifiedRow> ROW_ORDER = Comparator
            .comparing(UnifiedRow::effectiveDate)
            .thenComparing(row -> Objects.requireNonNullElse(row.description(), ""))
            .thenComparing(UnifiedRow::occurrenceId);

    private final RuleExpander ruleExpander;
    private final OverrideResolver overrideResolver;
    private final RecurringRuleValidator ruleValidator;

    public SnapshotAssembler(RuleExpander ruleExpander, OverrideResolver overrideResolver, RecurringRuleValidator ruleValidator) {
        this.ruleExpander = ruleExpander;
        this.overrideResolver = overrideResolver;
        this.ruleValidator = ruleValidator;
    }

    /**
     * @throws InvalidRecurringRuleException when a rule is structurally malformed
     */
    public Snapshot computeSnapshot(
            Collection<OneTimeEntry> entries,
            Collection<RecurringRule> rules,
            Collection<OccurrenceOverride> overrides,
            LocalDate windowStart,
            LocalDate windowEnd,
            LocalDate today
    ) {
        Objects.requireNonNull(windowStart, "windowStart");
        Objects.requireNonNull(windowEnd, "windowEnd");
        Objects.requireNonNull(today, "today");
        if (windowStart.isAfter(windowEnd)) {
            return Snapshot.empty(windowStart, windowEnd, today);
        }

        List<UnifiedRow> rows = new ArrayList<>();
        rows.addAll(oneTimeRows(entries, windowStart, windowEnd));
        rows.addAll(recurringRows(rules, OverrideIndex.of(overrides), windowStart, windowEnd));

        List<UnifiedRow> sorted = deduplicate(rows).stream()
                .sorted(ROW_ORDER)
                .toList();
        return new Snapshot(windowStart, windowEnd, today, sorted, Totals.of(sorted));
    }

    private static List<UnifiedRow.OneTime> oneTimeRows(Collection<OneTimeEntry> entries, LocalDate windowStart, LocalDate windowEnd) {
        if (entries == null || entries.isEmpty()) {
            return List.of();
        }
        return entries.stream()
                .filter(Objects::nonNull)
                .filter(entry -> entry.dueDate() != null)
                .filter(entry -> CalendarMath.within(entry.dueDate(), windowStart, windowEnd))
                .map(UnifiedRow.OneTime::from)
                .toList();
    }

    private List<UnifiedRow.Recurring> recurringRows(
            Collection<RecurringRule> rules,
            OverrideIndex overrides,
            LocalDate windowStart,
            LocalDate windowEnd
    ) {
        if (rules == null || rules.isEmpty()) {
            return List.of();
        }
        List<UnifiedRow.Recurring> rows = new ArrayList<>();
        for (RecurringRule rule : rules) {
            if (rule == null) {
                continue;
            }
            ruleValidator.validate(rule);
            for (LocalDate occurrenceDate : ruleExpander.expand(rule, windowStart, windowEnd)) {
                OccurrenceOverride override = overrides.find(rule.id(), occurrenceDate).orElse(null);
                // a postponement can move the occurrence out of the requested window
                materialize(rule, occurrenceDate, override, windowStart, windowEnd).ifPresent(rows::add);
            }
            for (OccurrenceOverride override : overrides.postponedFor(rule.id())) {
                if (isPulledIn(rule, override, windowStart, windowEnd)) {
                    materialize(rule, override.occurrenceDate(), override, windowStart, windowEnd).ifPresent(rows::add);
                }
            }
        }
        return rows;
    }

    private Optional<UnifiedRow.Recurring> materialize(
            RecurringRule rule,
            LocalDate occurrenceDate,
            OccurrenceOverride override,
            LocalDate windowStart,
            LocalDate windowEnd
    ) {
        Optional<ResolvedOccurrence> resolved = overrideResolver.resolve(rule, occurrenceDate, override);
        return resolved
                .filter(occurrence -> CalendarMath.within(occurrence.effectiveDate(), windowStart, windowEnd))
                .map(occurrence -> UnifiedRow.Recurring.from(rule, occurrenceDate, occurrence));
    }

    // Scheduled outside the window but postponed into it; the original date must still be a real
    // occurrence of the rule, otherwise the override is stale and stays inert.
    private boolean isPulledIn(RecurringRule rule, OccurrenceOverride override, LocalDate windowStart, LocalDate windowEnd) {
        LocalDate occurrenceDate = override.occurrenceDate();
        if (CalendarMath.within(occurrenceDate, windowStart, windowEnd)) {
            return false;
        }
        return ruleExpander.expand(rule, occurrenceDate, occurrenceDate).contains(occurrenceDate);
    }

    private static List<UnifiedRow> deduplicate(List<UnifiedRow> rows) {
        Map<String, UnifiedRow> byOccurrence = new LinkedHashMap<>();
        for (UnifiedRow row : rows) {
            byOccurrence.putIfAbsent(row.occurrenceId(), row);
        }
        return new ArrayList<>(byOccurrence.values());
    }
}
