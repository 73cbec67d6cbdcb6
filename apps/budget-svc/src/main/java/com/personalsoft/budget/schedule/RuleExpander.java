package com.personalsoft.budget.schedule;

import com.personalsoft.budget.model.RecurringRule;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns a recurring rule into the raw dates it produces inside an inclusive window. Overrides are
 * not consulted here, so the output only depends on the rule and the window.
 */
@Component
public class RuleExpander {

    private static final int WEEK = 7;
    private static final int FORTNIGHT = 14;

    /**
     * @return ascending, duplicate-free dates, each on or after both the rule's start anchor and
     *         {@code windowStart}, and on or before {@code windowEnd} and the rule's end date
     */
    public List<LocalDate> expand(RecurringRule rule, LocalDate windowStart, LocalDate windowEnd) {
        if (!rule.active() || windowStart.isAfter(windowEnd) || rule.startAnchor().isAfter(windowEnd)) {
            return List.of();
        }
        LocalDate from = CalendarMath.later(rule.startAnchor(), windowStart);
        LocalDate to = rule.endDate().map(end -> CalendarMath.earlier(end, windowEnd)).orElse(windowEnd);
        if (from.isAfter(to)) {
            return List.of();
        }
        return switch (rule.frequency()) {
            case MONTHLY -> expandMonthly(rule.dom(), from, to);
            case WEEKLY -> stepFrom(CalendarMath.stepToWeekday(from, rule.dow()), WEEK, to);
            case BIWEEKLY -> stepFrom(firstBiweeklyOnOrAfter(rule, from), FORTNIGHT, to);
        };
    }

    /**
     * Default target for postponing an occurrence by one cadence step: a week, two weeks, or the
     * same day-of-month (clamped) in the following month.
     */
    public LocalDate nextAfter(RecurringRule rule, LocalDate occurrenceDate) {
        return switch (rule.frequency()) {
            case WEEKLY -> CalendarMath.addDays(occurrenceDate, WEEK);
            case BIWEEKLY -> CalendarMath.addDays(occurrenceDate, FORTNIGHT);
            case MONTHLY -> CalendarMath.clampDom(YearMonth.from(occurrenceDate).plusMonths(1), rule.dom());
        };
    }

    private static List<LocalDate> expandMonthly(int dom, LocalDate from, LocalDate to) {
        List<LocalDate> dates = new ArrayList<>();
        YearMonth cursor = YearMonth.from(from);
        YearMonth last = YearMonth.from(to);
        while (!cursor.isAfter(last)) {
            LocalDate candidate = CalendarMath.clampDom(cursor, dom);
            if (CalendarMath.within(candidate, from, to)) {
                dates.add(candidate);
            }
            cursor = cursor.plusMonths(1);
        }
        return dates;
    }

    // The biweekly phase is fixed by the anchor, not by the window, so overlapping queries agree.
    private static LocalDate firstBiweeklyOnOrAfter(RecurringRule rule, LocalDate from) {
        LocalDate first = CalendarMath.stepToWeekday(rule.startAnchor(), rule.dow());
        if (!first.isBefore(from)) {
            return first;
        }
        long gap = ChronoUnit.DAYS.between(first, from);
        long periods = (gap + FORTNIGHT - 1) / FORTNIGHT;
        return CalendarMath.addDays(first, periods * FORTNIGHT);
    }

    private static List<LocalDate> stepFrom(LocalDate start, int stepDays, LocalDate to) {
        List<LocalDate> dates = new ArrayList<>();
        LocalDate cursor = start;
        while (!cursor.isAfter(to)) {
            dates.add(cursor);
            cursor = CalendarMath.addDays(cursor, stepDays);
        }
        return dates;
    }
}
