package com.personalsoft.budget.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar-date helpers for the schedule engine. Everything works on {@link LocalDate}; callers
 * convert a zoned "now" to a local date before calling in.
 */
public final class CalendarMath {

    private CalendarMath() {
    }

    public static int lastDayOfMonth(int year, int month) {
        return YearMonth.of(year, month).lengthOfMonth();
    }

    /**
     * Day-of-month clamped to the month's length, so dom 31 lands on April 30 and on
     * February 28 or 29.
     */
    public static LocalDate clampDom(int year, int month, int dom) {
        if (dom < 1 || dom > 31) {
            throw new IllegalArgumentException("dom must be between 1 and 31: " + dom);
        }
        return LocalDate.of(year, month, Math.min(dom, lastDayOfMonth(year, month)));
    }

    public static LocalDate clampDom(YearMonth month, int dom) {
        return clampDom(month.getYear(), month.getMonthValue(), dom);
    }

    public static LocalDate addDays(LocalDate date, long days) {
        return date.plusDays(days);
    }

    /** 1 = Monday .. 7 = Sunday. */
    public static int weekdayOf(LocalDate date) {
        return date.getDayOfWeek().getValue();
    }

    /** Smallest date on or after {@code date} that falls on {@code targetWeekday}. */
    public static LocalDate stepToWeekday(LocalDate date, int targetWeekday) {
        if (targetWeekday < 1 || targetWeekday > 7) {
            throw new IllegalArgumentException("weekday must be between 1 and 7: " + targetWeekday);
        }
        return date.with(TemporalAdjusters.nextOrSame(DayOfWeek.of(targetWeekday)));
    }

    public static LocalDate later(LocalDate a, LocalDate b) {
        return a.isAfter(b) ? a : b;
    }

    public static LocalDate earlier(LocalDate a, LocalDate b) {
        return a.isBefore(b) ? a : b;
    }

    public static boolean within(LocalDate date, LocalDate fromInclusive, LocalDate toInclusive) {
        return !date.isBefore(fromInclusive) && !date.isAfter(toInclusive);
    }
}
