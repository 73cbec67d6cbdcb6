package com.personalsoft.budget.service;

import com.personalsoft.budget.model.EntryType;
import com.personalsoft.budget.model.Frequency;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

public record RuleCommand(
        Optional<UUID> id,
        EntryType type,
        String category,
        String description,
        BigDecimal amount,
        Frequency frequency,
        Integer dom,
        Integer dow,
        LocalDate startAnchor,
        Boolean active,
        Optional<LocalDate> endDate
) {
    public RuleCommand {
        id = id == null ? Optional.empty() : id;
        endDate = endDate == null ? Optional.empty() : endDate;
    }

    public boolean activeFlag() {
        return active == null || active;
    }
}
