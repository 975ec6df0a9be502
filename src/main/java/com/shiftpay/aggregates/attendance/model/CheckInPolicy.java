package com.shiftpay.aggregates.attendance.model;

import com.shiftpay.exceptions.PayrollConfigurationException;

/**
 * Minutes after shift start within which a check-in is on time, and after which it is a half day.
 */
public record CheckInPolicy(int gracePeriodMinutes, int lateThresholdMinutes) {

    public static final CheckInPolicy DEFAULT = new CheckInPolicy(30, 90);

    public CheckInPolicy {
        if (gracePeriodMinutes < 0 || lateThresholdMinutes < gracePeriodMinutes) {
            throw new PayrollConfigurationException(String.format(
                    "Invalid check-in policy: grace period %d, late threshold %d", gracePeriodMinutes, lateThresholdMinutes));
        }
    }
}
