package com.shiftpay.aggregates.attendance.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shiftpay.exceptions.PayrollValidationException;
import com.shiftpay.exceptions.PayrollValidationException.ErrorType;

import java.math.BigDecimal;

/**
 * Attendance of one attributed date and the share of the day's potential it pays.
 * A late day pays in full; lateness beyond the free allowance is deducted once per month.
 */
public enum AttendanceStatus {

    @JsonProperty("on_time")
    ON_TIME("on_time", BigDecimal.ONE),

    @JsonProperty("late")
    LATE("late", BigDecimal.ONE),

    @JsonProperty("half_day")
    HALF_DAY("half_day", new BigDecimal("0.5")),

    @JsonProperty("absent")
    ABSENT("absent", BigDecimal.ZERO);

    private final String code;
    private final BigDecimal multiplier;

    AttendanceStatus(String code, BigDecimal multiplier) {
        this.code = code;
        this.multiplier = multiplier;
    }

    public String getCode() {
        return code;
    }

    public BigDecimal getMultiplier() {
        return multiplier;
    }

    public static AttendanceStatus fromCode(String code) {
        for (AttendanceStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) return status;
        }
        throw PayrollValidationException.of("status", "Unknown attendance status: " + code, ErrorType.INVALID_VALUE);
    }
}
