package com.shiftpay.aggregates.salary.model;

import java.math.BigDecimal;

/**
 * @param avgPerformanceScore mean daily score in [0, 1]; 1 when no day has been scored yet
 */
public record PerformanceSummary(long totalCalls, long totalTalkTimeSeconds, long totalLeads, BigDecimal avgPerformanceScore) {
}
