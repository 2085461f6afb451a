package com.jreinhal.scrubber.exception;

/**
 * The audit hash chain is broken. Further appends are refused until an operator clears the hold.
 */
public class ChainIntegrityException extends RuntimeException {
    private final long position;

    public ChainIntegrityException(String message, long position) {
        super(message);
        this.position = position;
    }

    public ChainIntegrityException(String message, Throwable cause) {
        super(message, cause);
        this.position = -1L;
    }

    public long getPosition() {
        return this.position;
    }
}
