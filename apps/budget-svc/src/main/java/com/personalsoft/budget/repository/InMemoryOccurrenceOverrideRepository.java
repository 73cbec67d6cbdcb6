package com.personalsoft.budget.repository;

import com.personalsoft.budget.model.OccurrenceKey;
import com.personalsoft.budget.model.OccurrenceOverride;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryOccurrenceOverrideRepository implements OccurrenceOverrideRepository {

    private final Map<StorageKey, OccurrenceOverride> storage = new ConcurrentHashMap<>();

    @Override
    public List<OccurrenceOverride> findByUserId(UUID userId) {
        return storage.values().stream()
                .filter(override -> override.userId().equals(userId))
                .sorted(Comparator.comparing(OccurrenceOverride::ruleId).thenComparing(OccurrenceOverride::occurrenceDate))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public OccurrenceOverride update(UUID userId, OccurrenceKey key, Function<Optional<OccurrenceOverride>, OccurrenceOverride> change) {
        return storage.compute(new StorageKey(userId, key), (storageKey, current) -> change.apply(Optional.ofNullable(current)));
    }

    private record StorageKey(UUID userId, OccurrenceKey key) {
    }
}
