package com.flagship.rural_ledger.sync;

/**
 * A remote operation failed. Delivered only to the caller that submitted it.
 */
public class RemoteOperationException extends RuntimeException {

    public RemoteOperationException(String message) {
        super(message);
    }

    public RemoteOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
