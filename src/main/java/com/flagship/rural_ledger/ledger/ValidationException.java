package com.flagship.rural_ledger.ledger;

/**
 * Malformed input or credentials. Reported to the caller and never retried.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
