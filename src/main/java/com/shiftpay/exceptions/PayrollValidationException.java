package com.shiftpay.exceptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Exception thrown when engine input fails validation.
 * Carries one {@link ValidationError} per rejected field so callers can report all problems at once.
 */
public class PayrollValidationException extends PayrollException {

    private final List<ValidationError> errors = new ArrayList<>();

    public PayrollValidationException(List<ValidationError> errors) {
        super(buildMessage(errors));
        this.errors.addAll(errors);
    }

    public static PayrollValidationException of(String field, String message, ErrorType type) {
        return new PayrollValidationException(List.of(new ValidationError(field, message, type)));
    }

    public List<ValidationError> getErrors() {
        return new ArrayList<>(errors);
    }

    private static String buildMessage(List<ValidationError> errors) {
        if (errors.isEmpty()) {
            return "Payroll input validation failed";
        }

        StringBuilder message = new StringBuilder("Payroll input validation failed with ")
            .append(errors.size())
            .append(" error(s):\n");

        for (ValidationError error : errors) {
            message.append("- ").append(error.getField()).append(": ").append(error.getMessage()).append("\n");
        }

        return message.toString();
    }

    /**
     * A single rejected field.
     */
    public static class ValidationError {
        private final String field;
        private final String message;
        private final ErrorType type;

        public ValidationError(String field, String message, ErrorType type) {
            this.field = field;
            this.message = message;
            this.type = type;
        }

        public String getField() {
            return field;
        }

        public String getMessage() {
            return message;
        }

        public ErrorType getType() {
            return type;
        }

        @Override
        public String toString() {
            return String.format("%s: %s [%s]", field, message, type.getDescription());
        }
    }

    public enum ErrorType {
        MALFORMED_TIME("Malformed time of day"),
        NEGATIVE_VALUE("Negative value"),
        NON_POSITIVE_VALUE("Value must be positive"),
        MISSING_REQUIRED("Missing required field"),
        DATE_OUT_OF_RANGE("Date outside the allowed range"),
        INVALID_VALUE("Invalid value");

        private final String description;

        ErrorType(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }
}
