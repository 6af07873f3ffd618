package com.casegovernor.rules;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Set;

/** Business-day arithmetic over weekends and a fixed holiday set. */
public final class BusinessCalendar {

    private final Set<LocalDate> holidays;

    public BusinessCalendar(Set<LocalDate> holidays) {
        this.holidays = Set.copyOf(holidays);
    }

    public boolean isBusinessDay(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY && !holidays.contains(date);
    }

    /**
     * Moves {@code days} business days forward from {@code start}. With zero days the
     * result is {@code start} itself or, when that is not a business day, the next one.
     */
    public LocalDate addBusinessDays(LocalDate start, int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must not be negative: " + days);
        }
        LocalDate date = start;
        if (days == 0) {
            while (!isBusinessDay(date)) {
                date = date.plusDays(1);
            }
            return date;
        }
        int remaining = days;
        while (remaining > 0) {
            date = date.plusDays(1);
            if (isBusinessDay(date)) {
                remaining--;
            }
        }
        return date;
    }
}
