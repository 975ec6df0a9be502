package com.shiftpay.aggregates.salary.model;

import com.shiftpay.aggregates.attendance.model.AttendanceRecord;
import com.shiftpay.aggregates.performance.model.DailyTelemetry;
import com.shiftpay.aggregates.performance.model.EmploymentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Input of one month-to-date salary calculation.
 * {@code referenceDate} is the attributed date of the current shift; past rows must be dated before it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SalaryCalculationRequest {

    private BigDecimal baseSalary;
    private LocalDate systemLaunchDate;
    private LocalDate referenceDate;

    @Builder.Default
    private EmploymentType employmentType = EmploymentType.FULL_TIME;

    @Builder.Default
    private List<DailyTelemetry> pastTelemetry = new ArrayList<>();

    @Builder.Default
    private List<AttendanceRecord> pastAttendance = new ArrayList<>();

    private DailyTelemetry todayTelemetry;
    private AttendanceRecord todayAttendance;
}
