package com.jreinhal.scrubber.exception;

/**
 * Wraps an unexpected failure in the scrub pipeline. Nothing redeemable is left behind.
 */
public class ScrubFailedException extends RuntimeException {
    public ScrubFailedException(String message) {
        super(message);
    }

    public ScrubFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
