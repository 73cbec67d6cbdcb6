package com.personalsoft.budget.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * A recurring income or bill. {@code dom} is only meaningful for {@link Frequency#MONTHLY},
 * {@code dow} (1 = Monday .. 7 = Sunday) only for the weekly cadences.
 */
public record RecurringRule(
        UUID id,
        UUID userId,
        EntryType type,
        String category,
        String description,
        BigDecimal amount,
        Frequency frequency,
        Integer dom,
        Integer dow,
        LocalDate startAnchor,
        boolean active,
        Optional<LocalDate> endDate
) {
    public RecurringRule {
        endDate = endDate == null ? Optional.empty() : endDate;
    }
}
