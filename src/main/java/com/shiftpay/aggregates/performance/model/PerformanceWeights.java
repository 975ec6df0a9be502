package com.shiftpay.aggregates.performance.model;

import com.shiftpay.exceptions.PayrollConfigurationException;

import java.math.BigDecimal;

/**
 * Weight of each sub-score. The weights sum to 1, which bounds the total score at 1.
 */
public record PerformanceWeights(BigDecimal calls, BigDecimal talkTime, BigDecimal leads) {

    public static final PerformanceWeights DEFAULT =
            new PerformanceWeights(new BigDecimal("0.40"), new BigDecimal("0.30"), new BigDecimal("0.30"));

    public PerformanceWeights {
        if (calls == null || talkTime == null || leads == null) {
            throw new PayrollConfigurationException("All performance weights are required");
        }
        if (calls.signum() < 0 || talkTime.signum() < 0 || leads.signum() < 0) {
            throw new PayrollConfigurationException("Performance weights cannot be negative");
        }
        BigDecimal sum = calls.add(talkTime).add(leads);
        if (sum.compareTo(BigDecimal.ONE) != 0) {
            throw new PayrollConfigurationException("Performance weights must sum to 1.0 but sum to " + sum.toPlainString());
        }
    }
}
