package com.shiftpay.aggregates.sales.model;

import java.math.BigDecimal;

/**
 * Golden-ticket progress of one shift. {@code targetHit} is evaluated on demand, never stored.
 */
public record SalesProgress(BigDecimal salesTarget,
                            BigDecimal salesAmount,
                            boolean targetHit,
                            BigDecimal remainingToTarget) {
}
