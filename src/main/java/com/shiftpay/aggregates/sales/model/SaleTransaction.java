package com.shiftpay.aggregates.sales.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of one ledger operation.
 *
 * @param appliedPayment  the part of the payment actually collected after capping at the remaining balance
 * @param completedNow    true only for the operation that moved the sale to COMPLETED
 * @param commissionEarned commission computed by this operation, zero otherwise
 */
public record SaleTransaction(Sale sale,
                              BigDecimal appliedPayment,
                              boolean completedNow,
                              BigDecimal commissionEarned,
                              List<SalesCredit> credits) {
}
