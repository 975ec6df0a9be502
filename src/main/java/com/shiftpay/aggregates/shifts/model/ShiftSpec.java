package com.shiftpay.aggregates.shifts.model;

import com.shiftpay.exceptions.PayrollValidationException;
import com.shiftpay.exceptions.PayrollValidationException.ErrorType;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * An employee's shift as two wall-clock times. A start later than the end denotes an overnight shift.
 * Seconds are accepted on input but shifts are resolved with minute precision.
 */
public record ShiftSpec(LocalTime start, LocalTime end) {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("H:mm");
    private static final DateTimeFormatter HH_MM_SS = DateTimeFormatter.ofPattern("H:mm:ss");

    public ShiftSpec {
        if (start == null || end == null) {
            throw PayrollValidationException.of("shift", "Shift start and end are required", ErrorType.MISSING_REQUIRED);
        }
        start = start.truncatedTo(ChronoUnit.MINUTES);
        end = end.truncatedTo(ChronoUnit.MINUTES);
        if (start.equals(end)) {
            throw PayrollValidationException.of("shift", "Shift start and end cannot be the same time (" + start + ")", ErrorType.MALFORMED_TIME);
        }
    }

    /**
     * @param start e.g. "21:00" or "21:00:00"
     * @param end   e.g. "05:00" or "05:00:00"
     */
    public static ShiftSpec parse(String start, String end) {
        return new ShiftSpec(parseTime("shiftStart", start), parseTime("shiftEnd", end));
    }

    public int startMinute() {
        return start.getHour() * 60 + start.getMinute();
    }

    public int endMinute() {
        return end.getHour() * 60 + end.getMinute();
    }

    public boolean isOvernight() {
        return startMinute() > endMinute();
    }

    private static LocalTime parseTime(String field, String value) {
        if (value == null || value.isBlank()) {
            throw PayrollValidationException.of(field, "Time of day is required", ErrorType.MISSING_REQUIRED);
        }
        String trimmed = value.trim();
        try {
            return LocalTime.parse(trimmed, trimmed.length() > 5 ? HH_MM_SS : HH_MM);
        } catch (DateTimeParseException e) {
            throw PayrollValidationException.of(field, "'" + value + "' is not a valid time of day (HH:MM or HH:MM:SS)", ErrorType.MALFORMED_TIME);
        }
    }
}
