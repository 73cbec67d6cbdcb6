package com.personalsoft.budget.schedule;

import java.util.UUID;

/**
 * Raised for a structurally malformed recurring rule. Such rules are a data-integrity problem
 * and are reported to the caller rather than silently corrected.
 */
public class InvalidRecurringRuleException extends RuntimeException {

    private final UUID ruleId;

    public InvalidRecurringRuleException(UUID ruleId, String reason) {
        super("Invalid recurring rule " + ruleId + ": " + reason);
        this.ruleId = ruleId;
    }

    public UUID ruleId() {
        return ruleId;
    }
}
