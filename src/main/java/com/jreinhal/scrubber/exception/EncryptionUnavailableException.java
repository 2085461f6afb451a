package com.jreinhal.scrubber.exception;

/**
 * Receipt key missing or unreadable. Fatal for every receipt-bearing operation.
 */
public class EncryptionUnavailableException extends RuntimeException {
    public EncryptionUnavailableException(String message) {
        super(message);
    }

    public EncryptionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
