package com.personalsoft.budget.schedule;

import com.personalsoft.budget.model.OccurrenceOverride;
import com.personalsoft.budget.model.RecurringRule;
import com.personalsoft.budget.model.ResolvedOccurrence;
import java.time.LocalDate;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class OverrideResolver {

    /**
     * Applies a per-occurrence exception to a raw occurrence date.
     *
     * @return the effective occurrence, or empty when the occurrence was skipped
     */
    public Optional<ResolvedOccurrence> resolve(RecurringRule rule, LocalDate occurrenceDate, OccurrenceOverride override) {
        if (override == null) {
            return Optional.of(new ResolvedOccurrence(occurrenceDate, Optional.empty()));
        }
        if (!rule.id().equals(override.ruleId()) || !occurrenceDate.equals(override.occurrenceDate())) {
            throw new IllegalArgumentException("override " + override.key() + " does not belong to occurrence "
                    + rule.id() + ":" + occurrenceDate);
        }
        if (override.skipped()) {
            return Optional.empty();
        }
        return Optional.of(new ResolvedOccurrence(
                override.effectiveDate().orElse(occurrenceDate),
                override.paidOn()
        ));
    }
}
