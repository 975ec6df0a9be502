package com.shiftpay.aggregates.sales.services;

import com.shiftpay.aggregates.sales.model.SalesProgress;
import jakarta.enterprise.context.ApplicationScoped;

import java.math.BigDecimal;

/**
 * Golden ticket: a shift whose sales reach a positive target.
 */
@ApplicationScoped
public class SalesTargetService {

    public boolean isTargetHit(BigDecimal salesTarget, BigDecimal cumulativeSales) {
        if (salesTarget == null || cumulativeSales == null) return false;
        return salesTarget.signum() > 0 && cumulativeSales.compareTo(salesTarget) >= 0;
    }

    public SalesProgress progress(BigDecimal salesTarget, BigDecimal cumulativeSales) {
        BigDecimal target = salesTarget != null ? salesTarget : BigDecimal.ZERO;
        BigDecimal sales = cumulativeSales != null ? cumulativeSales : BigDecimal.ZERO;
        BigDecimal remaining = target.subtract(sales).max(BigDecimal.ZERO);
        return new SalesProgress(target, sales, isTargetHit(target, sales), remaining);
    }
}
