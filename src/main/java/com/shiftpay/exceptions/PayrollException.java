package com.shiftpay.exceptions;

/**
 * Base exception for the payroll engine.
 * Thrown when a calculation or ledger operation cannot be completed.
 */
public class PayrollException extends RuntimeException {

    public PayrollException(String message) {
        super(message);
    }

    public PayrollException(String message, Throwable cause) {
        super(message, cause);
    }
}
