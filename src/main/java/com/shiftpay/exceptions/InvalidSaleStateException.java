package com.shiftpay.exceptions;

/**
 * Exception thrown when a sale or payment submission is asked to do something
 * its current status does not allow, e.g. paying into a completed sale.
 */
public class InvalidSaleStateException extends PayrollException {

    public InvalidSaleStateException(String message) {
        super(message);
    }
}
