package com.personalsoft.budget.schedule;

import static com.personalsoft.budget.BudgetFixtures.biweekly;
import static com.personalsoft.budget.BudgetFixtures.monthly;
import static com.personalsoft.budget.BudgetFixtures.weekly;
import static org.assertj.core.api.Assertions.assertThat;

import com.personalsoft.budget.model.RecurringRule;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RuleExpanderTest {

    private final RuleExpander expander = new RuleExpander();

    @Test
    void monthlyDom31FiresOnceInFebruary() {
        RecurringRule rent = monthly("Rent", 31, LocalDate.of(2025, 1, 1), new BigDecimal("100"));

        assertThat(expander.expand(rent, LocalDate.of(2025, 2, 1), LocalDate.of(2025, 2, 28)))
                .containsExactly(LocalDate.of(2025, 2, 28));
        assertThat(expander.expand(rent, LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 29)))
                .containsExactly(LocalDate.of(2024, 2, 29));
    }

    @Test
    void monthlyClampsEveryShortMonth() {
        RecurringRule rent = monthly("Rent", 31, LocalDate.of(2025, 1, 1), new BigDecimal("100"));

        assertThat(expander.expand(rent, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 6, 30)))
                .containsExactly(
                        LocalDate.of(2025, 1, 31),
                        LocalDate.of(2025, 2, 28),
                        LocalDate.of(2025, 3, 31),
                        LocalDate.of(2025, 4, 30),
                        LocalDate.of(2025, 5, 31),
                        LocalDate.of(2025, 6, 30)
                );
    }

    @Test
    void monthlyRespectsStartAnchorAsLowerBound() {
        RecurringRule phone = monthly("Phone", 10, LocalDate.of(2025, 3, 15), new BigDecimal("45"));

        assertThat(expander.expand(phone, LocalDate.of(2025, 3, 1), LocalDate.of(2025, 5, 31)))
                .containsExactly(LocalDate.of(2025, 4, 10), LocalDate.of(2025, 5, 10));
    }

    @Test
    void weeklyStepsFromFirstMatchingWeekday() {
        RecurringRule gas = weekly("Gas", 5, LocalDate.of(2025, 1, 1));

        assertThat(expander.expand(gas, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31)))
                .containsExactly(
                        LocalDate.of(2025, 1, 3),
                        LocalDate.of(2025, 1, 10),
                        LocalDate.of(2025, 1, 17),
                        LocalDate.of(2025, 1, 24),
                        LocalDate.of(2025, 1, 31)
                );
    }

    @Test
    void biweeklyIsAnchoredToStartAnchorNotWindow() {
        RecurringRule payroll = biweekly("Payroll", 1, LocalDate.of(2025, 1, 6));

        assertThat(expander.expand(payroll, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 2, 28)))
                .containsExactly(
                        LocalDate.of(2025, 1, 6),
                        LocalDate.of(2025, 1, 20),
                        LocalDate.of(2025, 2, 3),
                        LocalDate.of(2025, 2, 17)
                );
        // a window starting on an "off" Monday must not re-phase the cadence
        assertThat(expander.expand(payroll, LocalDate.of(2025, 1, 13), LocalDate.of(2025, 2, 9)))
                .containsExactly(LocalDate.of(2025, 1, 20), LocalDate.of(2025, 2, 3));
    }

    @Test
    void biweeklyAnchorOffWeekdayStartsOnNextMatchingDay() {
        // anchor is a Wednesday, cadence day is Friday
        RecurringRule loan = biweekly("Loan", 5, LocalDate.of(2025, 1, 1));

        assertThat(expander.expand(loan, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31)))
                .containsExactly(LocalDate.of(2025, 1, 3), LocalDate.of(2025, 1, 17), LocalDate.of(2025, 1, 31));
    }

    @Test
    void anchorAfterWindowYieldsNothing() {
        RecurringRule rent = monthly("Rent", 1, LocalDate.of(2026, 1, 1), new BigDecimal("100"));

        assertThat(expander.expand(rent, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 12, 31))).isEmpty();
    }

    @Test
    void invertedWindowYieldsNothing() {
        RecurringRule gas = weekly("Gas", 5, LocalDate.of(2025, 1, 1));

        assertThat(expander.expand(gas, LocalDate.of(2025, 2, 1), LocalDate.of(2025, 1, 1))).isEmpty();
    }

    @Test
    void inactiveRuleYieldsNothing() {
        RecurringRule gas = weekly("Gas", 5, LocalDate.of(2025, 1, 1));
        RecurringRule paused = new RecurringRule(gas.id(), gas.userId(), gas.type(), gas.category(), gas.description(),
                gas.amount(), gas.frequency(), gas.dom(), gas.dow(), gas.startAnchor(), false, Optional.empty());

        assertThat(expander.expand(paused, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31))).isEmpty();
    }

    @Test
    void endDateCapsOccurrences() {
        RecurringRule gas = weekly("Gas", 5, LocalDate.of(2025, 1, 1));
        RecurringRule ending = new RecurringRule(gas.id(), gas.userId(), gas.type(), gas.category(), gas.description(),
                gas.amount(), gas.frequency(), gas.dom(), gas.dow(), gas.startAnchor(), true, Optional.of(LocalDate.of(2025, 1, 15)));

        assertThat(expander.expand(ending, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31)))
                .containsExactly(LocalDate.of(2025, 1, 3), LocalDate.of(2025, 1, 10));
    }

    @Test
    void adjacentWindowsPartitionTheOccurrences() {
        List<RecurringRule> rules = List.of(
                monthly("Rent", 31, LocalDate.of(2024, 1, 1), new BigDecimal("100")),
                weekly("Gas", 3, LocalDate.of(2024, 1, 1)),
                biweekly("Payroll", 5, LocalDate.of(2024, 1, 5))
        );
        LocalDate a = LocalDate.of(2024, 1, 1);
        LocalDate b = LocalDate.of(2024, 2, 29);
        LocalDate c = LocalDate.of(2024, 5, 17);

        for (RecurringRule rule : rules) {
            List<LocalDate> joined = new ArrayList<>(expander.expand(rule, a, b));
            joined.addAll(expander.expand(rule, b.plusDays(1), c));
            assertThat(joined).as(rule.description()).isEqualTo(expander.expand(rule, a, c));
        }
    }

    @Test
    void nextAfterStepsOneCadence() {
        assertThat(expander.nextAfter(weekly("Gas", 5, LocalDate.of(2025, 1, 1)), LocalDate.of(2025, 1, 3)))
                .isEqualTo(LocalDate.of(2025, 1, 10));
        assertThat(expander.nextAfter(biweekly("Payroll", 1, LocalDate.of(2025, 1, 6)), LocalDate.of(2025, 1, 6)))
                .isEqualTo(LocalDate.of(2025, 1, 20));
        assertThat(expander.nextAfter(monthly("Rent", 31, LocalDate.of(2025, 1, 1), BigDecimal.TEN), LocalDate.of(2025, 1, 31)))
                .isEqualTo(LocalDate.of(2025, 2, 28));
    }
}
