package com.shiftpay.aggregates.sales.services;

import com.shiftpay.aggregates.sales.model.Sale;
import com.shiftpay.aggregates.sales.model.SaleApprovalStatus;
import com.shiftpay.aggregates.sales.model.SaleStatus;
import com.shiftpay.aggregates.sales.model.SaleTransaction;
import com.shiftpay.aggregates.sales.model.SalesCredit;
import com.shiftpay.aggregates.sales.model.SalesSummary;
import com.shiftpay.config.PayrollPolicyProvider;
import com.shiftpay.exceptions.InvalidSaleStateException;
import com.shiftpay.exceptions.PayrollValidationException;
import com.shiftpay.exceptions.PayrollValidationException.ErrorType;
import com.shiftpay.exceptions.PayrollValidationException.ValidationError;
import com.shiftpay.utils.MoneyUtils;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Sale lifecycle and commission ledger.
 *
 * PARTIAL → COMPLETED when the collected amount reaches the deal value. Payments are capped at the
 * remaining balance. The commission is computed on the completing operation only, and every
 * mutation of a sale holds the sale's monitor, so concurrent payments against one sale cannot
 * complete it twice.
 */
@JBossLog
@ApplicationScoped
public class CommissionLedgerService {

    @Inject
    PayrollPolicyProvider policyProvider;

    @Inject
    MeterRegistry registry;

    @Inject
    Clock clock;

    public SaleTransaction createSale(String customerName, BigDecimal totalDealValue, BigDecimal initialPayment, LocalDate attributedDate) {
        BigDecimal initial = initialPayment != null ? initialPayment : BigDecimal.ZERO;
        validateNewSale(customerName, totalDealValue, initial, attributedDate);

        Instant now = clock.instant();
        boolean approvalRequired = policyProvider.requireSaleApproval();
        Sale sale = Sale.builder()
                .id(UUID.randomUUID().toString())
                .customerName(customerName.trim())
                .totalDealValue(totalDealValue)
                .amountCollected(initial)
                .status(SaleStatus.PARTIAL)
                .commissionPaid(false)
                .commissionAmount(BigDecimal.ZERO)
                .approvalStatus(approvalRequired ? SaleApprovalStatus.PENDING : SaleApprovalStatus.APPROVED)
                .attributedDate(attributedDate)
                .createdAt(now)
                .updatedAt(now)
                .build();

        List<SalesCredit> credits = new ArrayList<>();
        if (!approvalRequired) {
            // the full deal value counts towards the shift's sales, whatever has been collected
            credits.add(new SalesCredit(attributedDate, totalDealValue, SalesCredit.Kind.DEAL_VALUE));
        }

        BigDecimal commission = BigDecimal.ZERO;
        boolean completed = false;
        if (initial.compareTo(totalDealValue) >= 0) {
            commission = complete(sale, now);
            completed = true;
            credits.add(new SalesCredit(attributedDate, commission, SalesCredit.Kind.COMMISSION));
        }

        registry.counter("payroll.sales.created", "status", sale.getStatus().name().toLowerCase()).increment();
        log.infof("Sale %s created for %s: deal %s, collected %s, %s, approval %s",
                sale.getId(), sale.getCustomerName(), totalDealValue.toPlainString(), initial.toPlainString(),
                sale.getStatus(), sale.getApprovalStatus());
        return new SaleTransaction(sale, initial, completed, commission, credits);
    }

    /**
     * Applies a payment to a partial sale.
     *
     * @throws InvalidSaleStateException if the sale is already completed or was rejected by HR
     */
    public SaleTransaction addPayment(Sale sale, BigDecimal amount, LocalDate attributedDate) {
        if (sale == null) {
            throw PayrollValidationException.of("sale", "Sale is required", ErrorType.MISSING_REQUIRED);
        }
        if (amount == null || amount.signum() <= 0) {
            throw PayrollValidationException.of("amount", "Payment must be positive: " + amount, ErrorType.NON_POSITIVE_VALUE);
        }
        if (attributedDate == null) {
            throw PayrollValidationException.of("attributedDate", "Attributed date is required", ErrorType.MISSING_REQUIRED);
        }

        synchronized (sale) {
            if (sale.isCompleted()) {
                registry.counter("payroll.sales.payments", "result", "rejected").increment();
                log.warnf("Payment of %s rejected: sale %s is already completed", amount.toPlainString(), sale.getId());
                throw new InvalidSaleStateException("Sale " + sale.getId() + " is already completed");
            }
            if (sale.getApprovalStatus() == SaleApprovalStatus.REJECTED) {
                registry.counter("payroll.sales.payments", "result", "rejected").increment();
                log.warnf("Payment of %s rejected: sale %s was rejected by HR", amount.toPlainString(), sale.getId());
                throw new InvalidSaleStateException("Sale " + sale.getId() + " has been rejected");
            }

            Instant now = clock.instant();
            BigDecimal applied = MoneyUtils.min(amount, sale.getRemainingBalance());
            if (applied.compareTo(amount) < 0) {
                log.debugf("Payment of %s on sale %s capped to remaining balance %s",
                        amount.toPlainString(), sale.getId(), applied.toPlainString());
            }
            sale.setAmountCollected(sale.getAmountCollected().add(applied));
            sale.setUpdatedAt(now);
            registry.counter("payroll.sales.payments", "result", "applied").increment();

            List<SalesCredit> credits = new ArrayList<>();
            BigDecimal commission = BigDecimal.ZERO;
            boolean completed = false;
            if (sale.getAmountCollected().compareTo(sale.getTotalDealValue()) >= 0) {
                commission = complete(sale, now);
                completed = true;
                credits.add(new SalesCredit(attributedDate, commission, SalesCredit.Kind.COMMISSION));
            }
            return new SaleTransaction(sale, applied, completed, commission, credits);
        }
    }

    public SalesSummary summarize(Collection<Sale> sales) {
        BigDecimal totalDealValue = BigDecimal.ZERO;
        BigDecimal totalCollected = BigDecimal.ZERO;
        BigDecimal totalCommission = BigDecimal.ZERO;
        int completed = 0;
        for (Sale sale : sales) {
            totalDealValue = totalDealValue.add(sale.getTotalDealValue());
            totalCollected = totalCollected.add(sale.getAmountCollected());
            if (sale.isCompleted()) {
                completed++;
                totalCommission = totalCommission.add(sale.getCommissionAmount());
            }
        }
        return new SalesSummary(sales.size(), MoneyUtils.round(totalDealValue), MoneyUtils.round(totalCollected),
                completed, sales.size() - completed, MoneyUtils.round(totalCommission));
    }

    public BigDecimal commissionFor(BigDecimal totalDealValue) {
        return MoneyUtils.round(totalDealValue.multiply(policyProvider.commissionRate()));
    }

    // caller holds the sale's monitor, or the sale is not yet shared
    private BigDecimal complete(Sale sale, Instant now) {
        sale.setStatus(SaleStatus.COMPLETED);
        sale.setUpdatedAt(now);
        if (sale.isCommissionPaid()) {
            return BigDecimal.ZERO;
        }
        BigDecimal commission = commissionFor(sale.getTotalDealValue());
        sale.setCommissionAmount(commission);
        sale.setCommissionPaid(true);
        registry.counter("payroll.sales.commissions").increment();
        log.infof("Sale %s completed, commission %s", sale.getId(), commission.toPlainString());
        return commission;
    }

    private void validateNewSale(String customerName, BigDecimal totalDealValue, BigDecimal initialPayment, LocalDate attributedDate) {
        List<ValidationError> errors = new ArrayList<>();
        if (customerName == null || customerName.isBlank()) {
            errors.add(new ValidationError("customerName", "Customer name is required", ErrorType.MISSING_REQUIRED));
        }
        if (totalDealValue == null) {
            errors.add(new ValidationError("totalDealValue", "Deal value is required", ErrorType.MISSING_REQUIRED));
        } else if (totalDealValue.signum() <= 0) {
            errors.add(new ValidationError("totalDealValue", "Deal value must be positive: " + totalDealValue, ErrorType.NON_POSITIVE_VALUE));
        }
        if (initialPayment.signum() < 0) {
            errors.add(new ValidationError("initialPayment", "Initial payment cannot be negative: " + initialPayment, ErrorType.NEGATIVE_VALUE));
        } else if (totalDealValue != null && initialPayment.compareTo(totalDealValue) > 0) {
            errors.add(new ValidationError("initialPayment", "Initial payment " + initialPayment.toPlainString()
                    + " cannot exceed total deal value " + totalDealValue.toPlainString(), ErrorType.INVALID_VALUE));
        }
        if (attributedDate == null) {
            errors.add(new ValidationError("attributedDate", "Attributed date is required", ErrorType.MISSING_REQUIRED));
        }
        if (!errors.isEmpty()) {
            log.warnf("Rejected new sale: %s", errors);
            throw new PayrollValidationException(errors);
        }
    }
}
