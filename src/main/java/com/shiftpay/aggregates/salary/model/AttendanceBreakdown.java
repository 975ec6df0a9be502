package com.shiftpay.aggregates.salary.model;

/**
 * Days with telemetry grouped by attendance status, with what each group earned.
 */
public record AttendanceBreakdown(DayTally onTime, DayTally late, DayTally halfDay, DayTally absent) {
}
