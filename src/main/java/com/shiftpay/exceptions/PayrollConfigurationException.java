package com.shiftpay.exceptions;

/**
 * Exception thrown when payroll configuration is unusable, or when a calculation
 * would otherwise divide by zero. Always fatal for the calculation in progress.
 */
public class PayrollConfigurationException extends PayrollException {

    public PayrollConfigurationException(String message) {
        super(message);
    }

    public PayrollConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
