package com.personalsoft.budget.schedule;

import com.personalsoft.budget.model.OccurrenceKey;
import com.personalsoft.budget.model.OccurrenceOverride;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Sparse exception table over recurring rules, keyed by rule and original occurrence date.
 * Overrides for rules that no longer exist are kept but never looked up.
 */
public final class OverrideIndex {

    private static final OverrideIndex EMPTY = new OverrideIndex(Map.of(), Map.of());

    private final Map<OccurrenceKey, OccurrenceOverride> byKey;
    private final Map<UUID, List<OccurrenceOverride>> postponedByRule;

    private OverrideIndex(Map<OccurrenceKey, OccurrenceOverride> byKey, Map<UUID, List<OccurrenceOverride>> postponedByRule) {
        this.byKey = byKey;
        this.postponedByRule = postponedByRule;
    }

    /**
     * Builds the lookup table. When the input holds more than one override for the same key the
     * most recently updated one wins; on equal timestamps the later one in input order wins.
     */
    public static OverrideIndex of(Collection<OccurrenceOverride> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return EMPTY;
        }
        Map<OccurrenceKey, OccurrenceOverride> byKey = new HashMap<>();
        for (OccurrenceOverride candidate : overrides) {
            if (candidate == null || candidate.ruleId() == null || candidate.occurrenceDate() == null) {
                continue;
            }
            byKey.merge(candidate.key(), candidate, OverrideIndex::mostRecent);
        }
        Map<UUID, List<OccurrenceOverride>> postponedByRule = byKey.values().stream()
                .filter(OccurrenceOverride::isPostponed)
                .sorted(Comparator.comparing(OccurrenceOverride::occurrenceDate))
                .collect(Collectors.groupingBy(OccurrenceOverride::ruleId, Collectors.toUnmodifiableList()));
        return new OverrideIndex(Map.copyOf(byKey), Map.copyOf(postponedByRule));
    }

    public Optional<OccurrenceOverride> find(UUID ruleId, LocalDate occurrenceDate) {
        return Optional.ofNullable(byKey.get(new OccurrenceKey(ruleId, occurrenceDate)));
    }

    /** Postponed overrides of {@code ruleId}, ordered by original occurrence date. */
    public List<OccurrenceOverride> postponedFor(UUID ruleId) {
        return postponedByRule.getOrDefault(ruleId, List.of());
    }

    private static OccurrenceOverride mostRecent(OccurrenceOverride current, OccurrenceOverride candidate) {
        if (current.updatedAt() == null) {
            return candidate;
        }
        if (candidate.updatedAt() == null) {
            return current;
        }
        return candidate.updatedAt().isBefore(current.updatedAt()) ? current : candidate;
    }
}
