package com.personalsoft.budget.repository;

import com.personalsoft.budget.model.OneTimeEntry;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

public interface BudgetEntryRepository {

    OneTimeEntry save(OneTimeEntry entry);

    Optional<OneTimeEntry> findById(UUID entryId);

    List<OneTimeEntry> findByUserId(UUID userId);

    /**
     * Atomically replaces the stored entry with {@code change} applied to it.
     *
     * @return the new entry, or empty when no entry is stored under {@code entryId}
     */
    Optional<OneTimeEntry> update(UUID entryId, UnaryOperator<OneTimeEntry> change);

    boolean deleteById(UUID entryId);
}
