package com.personalsoft.budget.service;

import com.personalsoft.budget.model.EntryType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/** Create (no id) or edit (id present) a one-time entry. Payment state is not touched by edits. */
public record EntryCommand(
        Optional<UUID> id,
        EntryType type,
        String category,
        String description,
        BigDecimal amount,
        LocalDate dueDate
) {
    public EntryCommand {
        id = id == null ? Optional.empty() : id;
    }
}
