package com.shiftpay.aggregates.performance.model;

import com.shiftpay.exceptions.PayrollConfigurationException;

/**
 * Daily counts that earn the full weight of each sub-score.
 */
public record PerformanceTargets(int calls, int talkTimeSeconds, int leads) {

    public static final PerformanceTargets FULL_TIME = new PerformanceTargets(150, 3600, 3);
    public static final PerformanceTargets PART_TIME = new PerformanceTargets(75, 1800, 2);

    public PerformanceTargets {
        if (calls <= 0 || talkTimeSeconds <= 0 || leads <= 0) {
            throw new PayrollConfigurationException(String.format(
                    "Performance targets must be positive (calls=%d, talkTimeSeconds=%d, leads=%d)",
                    calls, talkTimeSeconds, leads));
        }
    }
}
