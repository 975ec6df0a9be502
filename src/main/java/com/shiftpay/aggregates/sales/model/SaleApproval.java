package com.shiftpay.aggregates.sales.model;

import java.math.BigDecimal;

/**
 * Outcome of approving a sale.
 *
 * @param credit           the deal value booked on the reviewing shift
 * @param shiftSalesAmount the shift's sales including this deal
 * @param targetHit        golden ticket after this deal
 */
public record SaleApproval(Sale sale, SalesCredit credit, BigDecimal shiftSalesAmount, boolean targetHit) {
}
