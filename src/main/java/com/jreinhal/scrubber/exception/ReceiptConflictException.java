package com.jreinhal.scrubber.exception;

/**
 * A receipt already exists for the operation id. Receipts are never overwritten.
 */
public class ReceiptConflictException extends RuntimeException {
    public ReceiptConflictException(String message) {
        super(message);
    }

    public ReceiptConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
