package com.shiftpay.aggregates.salary.model;

import com.shiftpay.aggregates.attendance.model.LatePolicy;
import com.shiftpay.aggregates.performance.model.PerformanceTargets;
import com.shiftpay.aggregates.performance.model.PerformanceWeights;

/**
 * Everything the aggregator needs besides the employee's own data.
 *
 * @param clampNegativeTotal pay a negative month total (deduction larger than earnings) as zero
 */
public record SalaryPolicy(PerformanceTargets targets,
                           PerformanceWeights weights,
                           LatePolicy latePolicy,
                           boolean clampNegativeTotal) {

    public static SalaryPolicy defaults(PerformanceTargets targets) {
        return new SalaryPolicy(targets, PerformanceWeights.DEFAULT, LatePolicy.DEFAULT, true);
    }
}
