package com.personalsoft.budget.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * Identity of one occurrence of a rule: the rule and the date the expander originally produced.
 * Postponing an occurrence never changes its key.
 */
public record OccurrenceKey(UUID ruleId, LocalDate occurrenceDate) {

    public OccurrenceKey {
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(occurrenceDate, "occurrenceDate");
    }

    public String asOccurrenceId() {
        return ruleId + ":" + occurrenceDate;
    }
}
