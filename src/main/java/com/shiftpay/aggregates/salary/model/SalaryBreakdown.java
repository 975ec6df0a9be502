package com.shiftpay.aggregates.salary.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Month-to-date earnings of one employee. Produced fresh for every request and never stored.
 * Money fields are rounded half-up to two decimals; scores are in [0, 1].
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"baseSalary", "workingDaysInMonth", "workingDaysElapsed", "workingDaysRemaining", "dailyPotential",
        "ghostDays", "ghostEarnings", "activeDays", "activeEarnings",
        "todayEarnings", "todayPerformanceScore", "todayAttendanceMultiplier",
        "latePolicy", "totalEarnedBeforeDeduction", "totalEarned", "projectedSalary", "percentageEarned",
        "attendanceBreakdown", "performanceSummary"})
public class SalaryBreakdown {

    private BigDecimal baseSalary;
    private int workingDaysInMonth;
    private int workingDaysElapsed;
    private int workingDaysRemaining;
    private BigDecimal dailyPotential;

    // days of the month before the system was launched, paid at full potential
    private int ghostDays;
    private BigDecimal ghostEarnings;

    private int activeDays;
    private BigDecimal activeEarnings;

    private BigDecimal todayEarnings;
    private BigDecimal todayPerformanceScore;
    private BigDecimal todayAttendanceMultiplier;

    private LatePolicySummary latePolicy;

    private BigDecimal totalEarnedBeforeDeduction;
    private BigDecimal totalEarned;
    private BigDecimal projectedSalary;
    private int percentageEarned;

    private AttendanceBreakdown attendanceBreakdown;
    private PerformanceSummary performanceSummary;
}
