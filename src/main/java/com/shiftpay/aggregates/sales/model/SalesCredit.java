package com.shiftpay.aggregates.sales.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;

/**
 * An amount to add to an employee's running sales total for a shift.
 * The full deal value is credited when the sale is created; the commission when it completes.
 */
public record SalesCredit(LocalDate attributedDate, BigDecimal amount, Kind kind) {

    public enum Kind {
        DEAL_VALUE,
        COMMISSION
    }

    public static BigDecimal total(Collection<SalesCredit> credits, LocalDate attributedDate) {
        BigDecimal total = BigDecimal.ZERO;
        for (SalesCredit credit : credits) {
            if (credit.attributedDate().equals(attributedDate)) total = total.add(credit.amount());
        }
        return total;
    }
}
