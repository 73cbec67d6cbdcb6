package com.personalsoft.budget.repository;

import com.personalsoft.budget.model.RecurringRule;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryRecurringRuleRepository implements RecurringRuleRepository {

    private final Map<UUID, RecurringRule> storage = new ConcurrentHashMap<>();

    @Override
    public RecurringRule save(RecurringRule rule) {
        storage.put(rule.id(), rule);
        return rule;
    }

    @Override
    public Optional<RecurringRule> findById(UUID ruleId) {
        return Optional.ofNullable(storage.get(ruleId));
    }

    @Override
    public List<RecurringRule> findByUserId(UUID userId) {
        return storage.values().stream()
                .filter(rule -> rule.userId().equals(userId))
                .sorted(Comparator.comparing(RecurringRule::startAnchor).thenComparing(RecurringRule::id))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public boolean deleteById(UUID ruleId) {
        return storage.remove(ruleId) != null;
    }
}
