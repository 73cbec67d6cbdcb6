package com.personalsoft.budget.repository;

import com.personalsoft.budget.model.RecurringRule;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RecurringRuleRepository {

    RecurringRule save(RecurringRule rule);

    Optional<RecurringRule> findById(UUID ruleId);

    List<RecurringRule> findByUserId(UUID userId);

    /** Overrides pointing at the deleted rule are left in place. */
    boolean deleteById(UUID ruleId);
}
