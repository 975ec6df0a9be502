package com.shiftpay.utils;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Working-day arithmetic over a fixed Monday to Friday work week.
 * All methods work on plain calendar dates; time of day and timezone are resolved by the caller.
 */
public final class DateUtils {

    private DateUtils() {
    }

    public static boolean isWeekendDay(LocalDate localDate) {
        return localDate.getDayOfWeek().equals(DayOfWeek.SATURDAY) || localDate.getDayOfWeek().equals(DayOfWeek.SUNDAY);
    }

    public static boolean isWorkingDay(LocalDate localDate) {
        return !isWeekendDay(localDate);
    }

    /**
     * Counts working days in period.
     *
     * @param dateFrom inclusive
     * @param dateTo inclusive
     * @return number of working days, 0 when dateFrom is after dateTo
     */
    public static int getWorkingDaysBetween(LocalDate dateFrom, LocalDate dateTo) {
        int workingDays = 0;
        LocalDate localDate = dateFrom;
        while (!localDate.isAfter(dateTo)) {
            if(isWorkingDay(localDate)) workingDays++;
            localDate = localDate.plusDays(1);
        }
        return workingDays;
    }

    public static int getWorkingDaysInMonth(LocalDate referenceDate) {
        return getWorkingDaysBetween(getFirstDayOfMonth(referenceDate), getLastDayOfMonth(referenceDate));
    }

    /**
     * Working days from the first of the month up to and including the reference date.
     */
    public static int getWorkingDaysElapsed(LocalDate referenceDate) {
        return getWorkingDaysBetween(getFirstDayOfMonth(referenceDate), referenceDate);
    }

    /**
     * Working days after the reference date until the end of its month.
     */
    public static int getWorkingDaysRemaining(LocalDate referenceDate) {
        LocalDate tomorrow = referenceDate.plusDays(1);
        LocalDate monthEnd = getLastDayOfMonth(referenceDate);
        if (tomorrow.isAfter(monthEnd)) return 0;
        return getWorkingDaysBetween(tomorrow, monthEnd);
    }

    /**
     * Working days of the reference month that passed before the system was launched.
     * A launch on or before the first of the month yields 0. The count never runs past the
     * reference date, so a launch later than the reference date (same month or a future month)
     * yields the working days elapsed so far.
     */
    public static int getGhostDays(LocalDate systemLaunchDate, LocalDate referenceDate) {
        LocalDate monthStart = getFirstDayOfMonth(referenceDate);
        if (!systemLaunchDate.isAfter(monthStart)) return 0;

        LocalDate dayBeforeLaunch = systemLaunchDate.minusDays(1);
        LocalDate lastGhostDay = dayBeforeLaunch.isBefore(referenceDate) ? dayBeforeLaunch : referenceDate;
        return getWorkingDaysBetween(monthStart, lastGhostDay);
    }

    public static LocalDate getFirstDayOfMonth(LocalDate localDate) {
        YearMonth month = YearMonth.from(localDate);
        return month.atDay(1);
    }

    public static LocalDate getLastDayOfMonth(LocalDate localDate) {
        YearMonth month = YearMonth.from(localDate);
        return month.atEndOfMonth();
    }

    public static boolean isSameMonth(LocalDate a, LocalDate b) {
        return YearMonth.from(a).equals(YearMonth.from(b));
    }
}
