package com.personalsoft.budget.repository;

import com.personalsoft.budget.model.OneTimeEntry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryBudgetEntryRepository implements BudgetEntryRepository {

    private final Map<UUID, OneTimeEntry> storage = new ConcurrentHashMap<>();

    @Override
    public OneTimeEntry save(OneTimeEntry entry) {
        storage.put(entry.id(), entry);
        return entry;
    }

    @Override
    public Optional<OneTimeEntry> findById(UUID entryId) {
        return Optional.ofNullable(storage.get(entryId));
    }

    @Override
    public List<OneTimeEntry> findByUserId(UUID userId) {
        return storage.values().stream()
                .filter(entry -> entry.userId().equals(userId))
                .sorted(Comparator.comparing(OneTimeEntry::dueDate).thenComparing(OneTimeEntry::id))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public Optional<OneTimeEntry> update(UUID entryId, UnaryOperator<OneTimeEntry> change) {
        return Optional.ofNullable(storage.computeIfPresent(entryId, (id, current) -> change.apply(current)));
    }

    @Override
    public boolean deleteById(UUID entryId) {
        return storage.remove(entryId) != null;
    }
}
