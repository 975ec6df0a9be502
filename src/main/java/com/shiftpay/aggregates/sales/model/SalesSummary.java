package com.shiftpay.aggregates.sales.model;

import java.math.BigDecimal;

public record SalesSummary(int totalSales,
                           BigDecimal totalDealValue,
                           BigDecimal totalCollected,
                           int completedSales,
                           int partialSales,
                           BigDecimal totalCommissionEarned) {
}
