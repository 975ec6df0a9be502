package com.shiftpay.aggregates.attendance.model;

import java.time.LocalDate;

/**
 * @param minutesLate minutes after shift start, 0 for early check-ins
 */
public record CheckInResult(AttendanceStatus status, int minutesLate, LocalDate attendanceDate) {
}
