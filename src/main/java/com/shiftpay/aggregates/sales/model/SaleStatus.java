package com.shiftpay.aggregates.sales.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * PARTIAL → COMPLETED, never back.
 */
public enum SaleStatus {
    @JsonProperty("partial")
    PARTIAL,
    @JsonProperty("completed")
    COMPLETED
}
