package com.shiftpay.aggregates.performance.model;

import java.math.BigDecimal;

/**
 * Weighted sub-scores of one day. Each sub-score is capped at its weight; {@code total} is in [0, 1].
 */
public record PerformanceScore(BigDecimal callScore, BigDecimal talkScore, BigDecimal leadScore, BigDecimal total) {

    public static final PerformanceScore ZERO = new PerformanceScore(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
}
