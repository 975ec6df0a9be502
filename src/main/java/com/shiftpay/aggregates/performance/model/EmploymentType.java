package com.shiftpay.aggregates.performance.model;

/**
 * Selects the daily performance targets. Weights are the same for every type.
 */
public enum EmploymentType {
    FULL_TIME,
    PART_TIME
}
