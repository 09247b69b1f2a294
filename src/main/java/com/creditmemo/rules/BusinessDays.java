package com.creditmemo.rules;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Business-day arithmetic on a Monday to Friday week. Holidays are not observed.
 */
public final class BusinessDays {

    private BusinessDays() {
    }

    /**
     * Weekdays in the closed interval [start, end] minus one. Same day is 0,
     * Friday to the following Monday is 1, and an interval with no weekday is -1.
     */
    public static int between(LocalDate start, LocalDate end) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("End date " + end + " is before start date " + start);
        }
        return (int) (countWeekdays(start, end) - 1);
    }

    static long countWeekdays(LocalDate start, LocalDate end) {
        long days = ChronoUnit.DAYS.between(start, end) + 1;
        long fullWeeks = days / 7;
        long weekdays = fullWeeks * 5;
        LocalDate cursor = start.plusDays(fullWeeks * 7);
        while (!cursor.isAfter(end)) {
            if (isWeekday(cursor)) {
                weekdays++;
            }
            cursor = cursor.plusDays(1);
        }
        return weekdays;
    }

    public static boolean isWeekday(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }
}
