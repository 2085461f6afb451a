package com.jreinhal.scrubber.service;

import com.jreinhal.scrubber.exception.EncryptionUnavailableException;
import java.util.Arrays;

/**
 * Process-scoped secrets fixed at startup: the identifier salt and the receipt key.
 * {@link #toString()} never reveals either.
 */
public final class ScrubberSecrets {
    private final byte[] salt;
    private final byte[] receiptKey;
    private final String keyProblem;

    private ScrubberSecrets(byte[] salt, byte[] receiptKey, String keyProblem) {
        this.salt = salt.clone();
        this.receiptKey = receiptKey == null ? null : receiptKey.clone();
        this.keyProblem = keyProblem;
    }

    public static ScrubberSecrets of(byte[] salt, byte[] receiptKey) {
        return new ScrubberSecrets(salt, receiptKey, receiptKey == null ? "no receipt key configured" : null);
    }

    /**
     * Secrets without a usable receipt key. Receipt-bearing operations will fail with {@code reason}.
     */
    public static ScrubberSecrets withoutKey(byte[] salt, String reason) {
        return new ScrubberSecrets(salt, null, reason);
    }

    byte[] salt() {
        return this.salt;
    }

    public boolean hasReceiptKey() {
        return this.receiptKey != null;
    }

    byte[] requireReceiptKey() {
        if (this.receiptKey == null) {
            throw new EncryptionUnavailableException("Receipt encryption unavailable: " + this.keyProblem);
        }
        return this.receiptKey;
    }

    @Override
    public String toString() {
        return "ScrubberSecrets[salt=" + this.salt.length + " bytes, receiptKey=" + (hasReceiptKey() ? "present" : "absent") + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScrubberSecrets)) {
            return false;
        }
        ScrubberSecrets other = (ScrubberSecrets) o;
        return Arrays.equals(this.salt, other.salt) && Arrays.equals(this.receiptKey, other.receiptKey);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(this.salt) + Arrays.hashCode(this.receiptKey);
    }
}
