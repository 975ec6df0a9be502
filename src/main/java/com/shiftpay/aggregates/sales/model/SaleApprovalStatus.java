package com.shiftpay.aggregates.sales.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * HR review of a sale. PENDING → APPROVED or PENDING → REJECTED, both terminal.
 */
public enum SaleApprovalStatus {
    @JsonProperty("pending")
    PENDING,
    @JsonProperty("approved")
    APPROVED,
    @JsonProperty("rejected")
    REJECTED
}
