package com.shiftpay.aggregates.salary.model;

import java.math.BigDecimal;

public record LatePolicySummary(int totalLates,
                                int totalHalfDays,
                                int freeLatesUsed,
                                int freeLatesRemaining,
                                int excessLates,
                                BigDecimal deductionDays,
                                BigDecimal deductionAmount) {
}
