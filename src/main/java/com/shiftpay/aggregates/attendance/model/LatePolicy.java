package com.shiftpay.aggregates.attendance.model;

import com.shiftpay.exceptions.PayrollConfigurationException;

import java.math.BigDecimal;

/**
 * "N free lates" policy. The first {@code freeLates} lates of a month cost nothing; every further
 * late and every half day deducts a fraction of a day's potential from the month total.
 *
 * @param unapprovedHalfDayPenalty extra multiplier on the earnings of a half day HR has not approved
 */
public record LatePolicy(int freeLates,
                         BigDecimal excessLateDeductionDays,
                         BigDecimal halfDayDeductionDays,
                         BigDecimal unapprovedHalfDayPenalty) {

    public static final LatePolicy DEFAULT =
            new LatePolicy(3, new BigDecimal("0.5"), new BigDecimal("0.5"), new BigDecimal("0.5"));

    public LatePolicy {
        if (freeLates < 0) throw new PayrollConfigurationException("Free lates cannot be negative: " + freeLates);
        if (excessLateDeductionDays == null || halfDayDeductionDays == null || unapprovedHalfDayPenalty == null) {
            throw new PayrollConfigurationException("Late policy deductions are required");
        }
        if (excessLateDeductionDays.signum() < 0 || halfDayDeductionDays.signum() < 0 || unapprovedHalfDayPenalty.signum() < 0) {
            throw new PayrollConfigurationException("Late policy deductions cannot be negative");
        }
    }
}
