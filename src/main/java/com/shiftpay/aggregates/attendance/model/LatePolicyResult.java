package com.shiftpay.aggregates.attendance.model;

import java.math.BigDecimal;

/**
 * Month-level lateness deduction. Amounts are unrounded.
 */
public record LatePolicyResult(int totalLates,
                               int totalHalfDays,
                               int freeLatesUsed,
                               int freeLatesRemaining,
                               int excessLates,
                               BigDecimal deductionDays,
                               BigDecimal deductionAmount) {
}
