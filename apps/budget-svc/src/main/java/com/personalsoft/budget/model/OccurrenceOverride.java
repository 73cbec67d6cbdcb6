package com.personalsoft.budget.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

public record OccurrenceOverride(
        UUID userId,
        UUID ruleId,
        LocalDate occurrenceDate,
        Optional<LocalDate> effectiveDate,
        Optional<LocalDate> paidOn,
        boolean skipped,
        Instant updatedAt
) {
    public OccurrenceOverride {
        effectiveDate = effectiveDate == null ? Optional.empty() : effectiveDate;
        paidOn = paidOn == null ? Optional.empty() : paidOn;
    }

    public static OccurrenceOverride blank(UUID userId, OccurrenceKey key, Instant now) {
        return new OccurrenceOverride(userId, key.ruleId(), key.occurrenceDate(), Optional.empty(), Optional.empty(), false, now);
    }

    public OccurrenceKey key() {
        return new OccurrenceKey(ruleId, occurrenceDate);
    }

    public boolean isPaid() {
        return paidOn.isPresent();
    }

    public boolean isPostponed() {
        return effectiveDate.isPresent();
    }

    public OccurrenceOverride withPaidOn(LocalDate newPaidOn, Instant now) {
        return new OccurrenceOverride(userId, ruleId, occurrenceDate, effectiveDate, Optional.ofNullable(newPaidOn), skipped, now);
    }

    public OccurrenceOverride withEffectiveDate(LocalDate newEffectiveDate, Instant now) {
        return new OccurrenceOverride(userId, ruleId, occurrenceDate, Optional.ofNullable(newEffectiveDate), paidOn, skipped, now);
    }

    public OccurrenceOverride withSkipped(boolean newSkipped, Instant now) {
        return new OccurrenceOverride(userId, ruleId, occurrenceDate, effectiveDate, paidOn, newSkipped, now);
    }
}
