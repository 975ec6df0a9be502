package com.shiftpay.aggregates.attendance.services;

import com.shiftpay.aggregates.attendance.model.AttendanceRecord;
import com.shiftpay.aggregates.attendance.model.AttendanceStatus;
import com.shiftpay.aggregates.attendance.model.LatePolicy;
import com.shiftpay.aggregates.attendance.model.LatePolicyResult;
import jakarta.enterprise.context.ApplicationScoped;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Attendance multipliers for a single day and the monthly "free lates" deduction.
 *
 * | status   | multiplier |
 * |----------|------------|
 * | on_time  | 1.0        |
 * | late     | 1.0        |
 * | half_day | 0.5, and once more by the unapproved penalty until HR approves it |
 * | absent   | 0.0        |
 */
@ApplicationScoped
public class AttendancePolicyService {

    /**
     * Multiplier for a day, missing attendance counts as absent.
     */
    public BigDecimal multiplier(AttendanceRecord attendance) {
        return attendance == null ? AttendanceStatus.ABSENT.getMultiplier() : attendance.status().getMultiplier();
    }

    /**
     * dailyPotential * performanceScore * multiplier, then the unapproved half-day penalty if it applies.
     * Unrounded.
     */
    public BigDecimal dailyEarnings(BigDecimal dailyPotential, BigDecimal performanceScore, AttendanceRecord attendance, LatePolicy policy) {
        BigDecimal earnings = dailyPotential.multiply(performanceScore).multiply(multiplier(attendance));
        if (attendance != null && attendance.status() == AttendanceStatus.HALF_DAY && !attendance.hrApproved()) {
            earnings = earnings.multiply(policy.unapprovedHalfDayPenalty());
        }
        return earnings;
    }

    public LatePolicyResult latePolicy(Collection<AttendanceRecord> monthAttendance, BigDecimal dailyPotential, LatePolicy policy) {
        int totalLates = 0;
        int totalHalfDays = 0;
        for (AttendanceRecord record : monthAttendance) {
            if (record.status() == AttendanceStatus.LATE) totalLates++;
            else if (record.status() == AttendanceStatus.HALF_DAY) totalHalfDays++;
        }
        return latePolicy(totalLates, totalHalfDays, dailyPotential, policy);
    }

    /**
     * <pre>
     * freeLatesUsed  = min(totalLates, FREE_LATES)
     * excessLates    = max(0, totalLates - FREE_LATES)
     * deductionDays  = totalHalfDays * halfDayDeduction + excessLates * excessLateDeduction
     * deduction      = deductionDays * dailyPotential
     * </pre>
     */
    public LatePolicyResult latePolicy(int totalLates, int totalHalfDays, BigDecimal dailyPotential, LatePolicy policy) {
        int freeLatesUsed = Math.min(totalLates, policy.freeLates());
        int freeLatesRemaining = policy.freeLates() - freeLatesUsed;
        int excessLates = Math.max(0, totalLates - policy.freeLates());

        BigDecimal deductionDays = policy.halfDayDeductionDays().multiply(BigDecimal.valueOf(totalHalfDays))
                .add(policy.excessLateDeductionDays().multiply(BigDecimal.valueOf(excessLates)));
        BigDecimal deductionAmount = deductionDays.multiply(dailyPotential);

        return new LatePolicyResult(totalLates, totalHalfDays, freeLatesUsed, freeLatesRemaining, excessLates,
                deductionDays, deductionAmount);
    }
}
