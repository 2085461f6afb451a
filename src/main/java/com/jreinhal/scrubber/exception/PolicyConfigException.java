package com.jreinhal.scrubber.exception;

/**
 * Policy manifest for the requested tier is missing or malformed. The operation aborts
 * before any substitution.
 */
public class PolicyConfigException extends RuntimeException {
    public PolicyConfigException(String message) {
        super(message);
    }

    public PolicyConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
