package com.shiftpay.aggregates.sales.model;

import com.shiftpay.utils.MoneyUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A deal closed by an employee and the money collected against it so far.
 * Mutated only through {@link com.shiftpay.aggregates.sales.services.CommissionLedgerService}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Sale {

    private String id;
    private String customerName;
    private BigDecimal totalDealValue;
    private BigDecimal amountCollected;
    private SaleStatus status;

    // set exactly once, on the transition to COMPLETED
    private boolean commissionPaid;
    private BigDecimal commissionAmount;

    // PENDING until HR reviews it when sales need approval, otherwise APPROVED on creation
    private SaleApprovalStatus approvalStatus;
    private String reviewedBy;
    private Instant reviewedAt;

    private LocalDate attributedDate;
    private Instant createdAt;
    private Instant updatedAt;

    public BigDecimal getRemainingBalance() {
        return totalDealValue.subtract(amountCollected).max(BigDecimal.ZERO);
    }

    public int getProgressPercent() {
        return MoneyUtils.percentage(amountCollected, totalDealValue);
    }

    public boolean isCompleted() {
        return status == SaleStatus.COMPLETED;
    }
}
