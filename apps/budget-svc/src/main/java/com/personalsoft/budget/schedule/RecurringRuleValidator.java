package com.personalsoft.budget.schedule;

import com.personalsoft.budget.model.Frequency;
import com.personalsoft.budget.model.RecurringRule;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

@Component
public class RecurringRuleValidator {

    public void validate(RecurringRule rule) {
        if (rule.frequency() == null) {
            throw new InvalidRecurringRuleException(rule.id(), "frequency must be provided");
        }
        if (rule.type() == null) {
            throw new InvalidRecurringRuleException(rule.id(), "type must be provided");
        }
        if (rule.startAnchor() == null) {
            throw new InvalidRecurringRuleException(rule.id(), "startAnchor must be provided");
        }
        if (rule.amount() == null || rule.amount().compareTo(BigDecimal.ZERO) < 0) {
            throw new InvalidRecurringRuleException(rule.id(), "amount must be zero or positive");
        }
        if (rule.endDate().isPresent() && rule.endDate().get().isBefore(rule.startAnchor())) {
            throw new InvalidRecurringRuleException(rule.id(), "endDate must not be before startAnchor");
        }
        if (rule.frequency() == Frequency.MONTHLY) {
            if (rule.dom() == null) {
                throw new InvalidRecurringRuleException(rule.id(), "monthly rule requires dom");
            }
            if (rule.dom() < 1 || rule.dom() > 31) {
                throw new InvalidRecurringRuleException(rule.id(), "dom must be between 1 and 31");
            }
            if (rule.dow() != null) {
                throw new InvalidRecurringRuleException(rule.id(), "monthly rule must not set dow");
            }
            return;
        }
        if (rule.dow() == null) {
            throw new InvalidRecurringRuleException(rule.id(), rule.frequency().name().toLowerCase() + " rule requires dow");
        }
        if (rule.dow() < 1 || rule.dow() > 7) {
            throw new InvalidRecurringRuleException(rule.id(), "dow must be between 1 (Monday) and 7 (Sunday)");
        }
        if (rule.dom() != null) {
            throw new InvalidRecurringRuleException(rule.id(), rule.frequency().name().toLowerCase() + " rule must not set dom");
        }
    }
}
