package com.shiftpay.aggregates.sales.services;

import com.shiftpay.aggregates.sales.model.PaymentStatus;
import com.shiftpay.aggregates.sales.model.PaymentSubmission;
import com.shiftpay.aggregates.sales.model.Sale;
import com.shiftpay.aggregates.sales.model.SaleTransaction;
import com.shiftpay.exceptions.InvalidSaleStateException;
import com.shiftpay.exceptions.PayrollValidationException;
import com.shiftpay.exceptions.PayrollValidationException.ErrorType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * HR review of reported payments.
 *
 * PENDING → APPROVED (applied through the ledger) or PENDING → REJECTED (no ledger effect).
 * Both outcomes are terminal.
 */
@JBossLog
@ApplicationScoped
public class PaymentApprovalService {

    @Inject
    CommissionLedgerService ledger;

    public PaymentSubmission submit(Sale sale, BigDecimal amount, Instant submittedAt) {
        if (amount == null || amount.signum() <= 0) {
            throw PayrollValidationException.of("amount", "Payment must be positive: " + amount, ErrorType.NON_POSITIVE_VALUE);
        }
        if (sale.isCompleted()) {
            log.warnf("Payment submission rejected: sale %s is already completed", sale.getId());
            throw new InvalidSaleStateException("Sale " + sale.getId() + " is already completed");
        }
        PaymentSubmission submission = PaymentSubmission.builder()
                .id(UUID.randomUUID().toString())
                .saleId(sale.getId())
                .amount(amount)
                .status(PaymentStatus.PENDING)
                .submittedAt(submittedAt)
                .build();
        log.debugf("Payment %s of %s submitted for sale %s", submission.getId(), amount.toPlainString(), sale.getId());
        return submission;
    }

    /**
     * Approves the submission and applies its amount to the sale. If the ledger refuses the
     * payment the submission stays pending.
     */
    public SaleTransaction approve(PaymentSubmission submission, Sale sale, String reviewer, LocalDate attributedDate, Instant reviewedAt) {
        if (!submission.getSaleId().equals(sale.getId())) {
            throw PayrollValidationException.of("saleId", "Submission " + submission.getId() + " belongs to sale "
                    + submission.getSaleId() + ", not " + sale.getId(), ErrorType.INVALID_VALUE);
        }
        synchronized (submission) {
            requirePending(submission);
            SaleTransaction transaction = ledger.addPayment(sale, submission.getAmount(), attributedDate);
            submission.setStatus(PaymentStatus.APPROVED);
            submission.setReviewedBy(reviewer);
            submission.setReviewedAt(reviewedAt);
            log.infof("Payment %s approved by %s, applied %s to sale %s", submission.getId(), reviewer,
                    transaction.appliedPayment().toPlainString(), sale.getId());
            return transaction;
        }
    }

    public PaymentSubmission reject(PaymentSubmission submission, String reviewer, Instant reviewedAt) {
        synchronized (submission) {
            requirePending(submission);
            submission.setStatus(PaymentStatus.REJECTED);
            submission.setReviewedBy(reviewer);
            submission.setReviewedAt(reviewedAt);
            log.infof("Payment %s rejected by %s", submission.getId(), reviewer);
            return submission;
        }
    }

    private void requirePending(PaymentSubmission submission) {
        if (submission.getStatus() != PaymentStatus.PENDING) {
            log.warnf("Payment %s already reviewed (%s)", submission.getId(), submission.getStatus());
            throw new InvalidSaleStateException("Payment " + submission.getId() + " is already " + submission.getStatus());
        }
    }
}
