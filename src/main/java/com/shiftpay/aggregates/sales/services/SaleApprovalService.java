package com.shiftpay.aggregates.sales.services;

import com.shiftpay.aggregates.sales.model.Sale;
import com.shiftpay.aggregates.sales.model.SaleApproval;
import com.shiftpay.aggregates.sales.model.SaleApprovalStatus;
import com.shiftpay.aggregates.sales.model.SalesCredit;
import com.shiftpay.exceptions.InvalidSaleStateException;
import com.shiftpay.exceptions.PayrollValidationException;
import com.shiftpay.exceptions.PayrollValidationException.ErrorType;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * HR review of sales created while approval is required. Approval credits the deal value to the
 * reviewing shift and re-evaluates its golden ticket. A sale is reviewed once.
 */
@JBossLog
@ApplicationScoped
public class SaleApprovalService {

    @Inject
    SalesTargetService salesTargetService;

    @Inject
    MeterRegistry registry;

    /**
     * @param shiftSalesBefore the shift's approved sales before this deal
     */
    public SaleApproval approve(Sale sale, String reviewer, LocalDate shiftDate, BigDecimal shiftSalesBefore,
                                BigDecimal salesTarget, Instant reviewedAt) {
        if (shiftDate == null) {
            throw PayrollValidationException.of("shiftDate", "Shift date is required", ErrorType.MISSING_REQUIRED);
        }
        synchronized (sale) {
            review(sale, SaleApprovalStatus.APPROVED, reviewer, reviewedAt);
        }

        SalesCredit credit = new SalesCredit(shiftDate, sale.getTotalDealValue(), SalesCredit.Kind.DEAL_VALUE);
        BigDecimal before = shiftSalesBefore != null ? shiftSalesBefore : BigDecimal.ZERO;
        BigDecimal after = before.add(sale.getTotalDealValue());
        boolean targetHit = salesTargetService.isTargetHit(salesTarget, after);

        registry.counter("payroll.sales.reviews", "result", "approved").increment();
        log.infof("Sale %s approved by %s: %s credited to %s, target hit %s",
                sale.getId(), reviewer, sale.getTotalDealValue().toPlainString(), shiftDate, targetHit);
        return new SaleApproval(sale, credit, after, targetHit);
    }

    public Sale reject(Sale sale, String reviewer, Instant reviewedAt) {
        synchronized (sale) {
            review(sale, SaleApprovalStatus.REJECTED, reviewer, reviewedAt);
        }
        registry.counter("payroll.sales.reviews", "result", "rejected").increment();
        log.infof("Sale %s rejected by %s", sale.getId(), reviewer);
        return sale;
    }

    private void review(Sale sale, SaleApprovalStatus outcome, String reviewer, Instant reviewedAt) {
        if (sale.getApprovalStatus() != SaleApprovalStatus.PENDING) {
            registry.counter("payroll.sales.reviews", "result", "refused").increment();
            log.warnf("Review of sale %s refused: already %s", sale.getId(), sale.getApprovalStatus());
            throw new InvalidSaleStateException("Sale " + sale.getId() + " has already been approved/rejected");
        }
        sale.setApprovalStatus(outcome);
        sale.setReviewedBy(reviewer);
        sale.setReviewedAt(reviewedAt);
        sale.setUpdatedAt(reviewedAt);
    }
}
