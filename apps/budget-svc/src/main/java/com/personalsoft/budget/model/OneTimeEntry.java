package com.personalsoft.budget.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

public record OneTimeEntry(
        UUID id,
        UUID userId,
        EntryType type,
        String category,
        String description,
        BigDecimal amount,
        LocalDate dueDate,
        Optional<LocalDate> paidOn
) {
    public OneTimeEntry {
        paidOn = paidOn == null ? Optional.empty() : paidOn;
    }

    public boolean isPaid() {
        return paidOn.isPresent();
    }

    public OneTimeEntry withPaidOn(LocalDate newPaidOn) {
        return new OneTimeEntry(id, userId, type, category, description, amount, dueDate, Optional.ofNullable(newPaidOn));
    }

    public OneTimeEntry withDueDate(LocalDate newDueDate) {
        return new OneTimeEntry(id, userId, type, category, description, amount, newDueDate, paidOn);
    }
}
