package com.shiftpay.aggregates.sales.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A payment reported by an employee against a sale, waiting for HR review.
 * Only an approved submission reaches the ledger.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentSubmission {

    private String id;
    private String saleId;
    private BigDecimal amount;
    private PaymentStatus status;
    private Instant submittedAt;
    private String reviewedBy;
    private Instant reviewedAt;
}
