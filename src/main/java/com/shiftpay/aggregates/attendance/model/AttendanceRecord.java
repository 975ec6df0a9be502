package com.shiftpay.aggregates.attendance.model;

import com.shiftpay.exceptions.PayrollValidationException;
import com.shiftpay.exceptions.PayrollValidationException.ErrorType;

import java.time.LocalDate;

/**
 * Attendance for one attributed date. {@code hrApproved} only ever moves from false to true.
 */
public record AttendanceRecord(LocalDate date, AttendanceStatus status, boolean hrApproved) {

    public AttendanceRecord {
        if (date == null) throw PayrollValidationException.of("date", "Attendance date is required", ErrorType.MISSING_REQUIRED);
        if (status == null) throw PayrollValidationException.of("status", "Attendance status is required", ErrorType.MISSING_REQUIRED);
    }

    public static AttendanceRecord absent(LocalDate date) {
        return new AttendanceRecord(date, AttendanceStatus.ABSENT, false);
    }

    public AttendanceRecord approve() {
        return hrApproved ? this : new AttendanceRecord(date, status, true);
    }
}
