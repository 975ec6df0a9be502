package com.shiftpay.aggregates.performance.model;

import com.shiftpay.exceptions.PayrollValidationException;
import com.shiftpay.exceptions.PayrollValidationException.ErrorType;
import com.shiftpay.exceptions.PayrollValidationException.ValidationError;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One employee's counters for one attributed date.
 */
public record DailyTelemetry(LocalDate date, int calls, int talkTimeSeconds, int leadsApproved, BigDecimal salesAmount) {

    public DailyTelemetry {
        List<ValidationError> errors = new ArrayList<>();
        if (date == null) errors.add(new ValidationError("date", "Telemetry date is required", ErrorType.MISSING_REQUIRED));
        if (calls < 0) errors.add(new ValidationError("calls", "Calls cannot be negative: " + calls, ErrorType.NEGATIVE_VALUE));
        if (talkTimeSeconds < 0) errors.add(new ValidationError("talkTimeSeconds", "Talk time cannot be negative: " + talkTimeSeconds, ErrorType.NEGATIVE_VALUE));
        if (leadsApproved < 0) errors.add(new ValidationError("leadsApproved", "Approved leads cannot be negative: " + leadsApproved, ErrorType.NEGATIVE_VALUE));
        if (salesAmount == null) salesAmount = BigDecimal.ZERO;
        if (salesAmount.signum() < 0) errors.add(new ValidationError("salesAmount", "Sales amount cannot be negative: " + salesAmount, ErrorType.NEGATIVE_VALUE));
        if (!errors.isEmpty()) throw new PayrollValidationException(errors);
    }

    public DailyTelemetry(LocalDate date, int calls, int talkTimeSeconds, int leadsApproved) {
        this(date, calls, talkTimeSeconds, leadsApproved, BigDecimal.ZERO);
    }
}
