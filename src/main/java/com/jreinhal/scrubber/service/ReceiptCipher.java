package com.jreinhal.scrubber.service;

import com.jreinhal.scrubber.exception.EncryptionUnavailableException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

/**
 * AES-256-GCM for receipt entries. Output is Base64(IV || ciphertext+tag). The additional
 * authenticated data binds each ciphertext to its operation and identifier, so an entry
 * copied into another receipt fails to decrypt.
 */
@Component
public class ReceiptCipher {
    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;

    private final ScrubberSecrets secrets;
    private final SecureRandom secureRandom = new SecureRandom();

    public ReceiptCipher(ScrubberSecrets secrets) {
        this.secrets = secrets;
    }

    public boolean isAvailable() {
        return this.secrets.hasReceiptKey();
    }

    void requireAvailable() {
        this.secrets.requireReceiptKey();
    }

    public String encrypt(String plaintext, String operationId, String identifier) {
        byte[] key = this.secrets.requireReceiptKey();
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            this.secureRandom.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(aad(operationId, identifier));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            ByteBuffer buffer = ByteBuffer.allocate(iv.length + ciphertext.length);
            buffer.put(iv);
            buffer.put(ciphertext);
            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new EncryptionUnavailableException("Receipt encryption failed", e);
        }
    }

    public String decrypt(String encoded, String operationId, String identifier) {
        byte[] key = this.secrets.requireReceiptKey();
        try {
            ByteBuffer buffer = ByteBuffer.wrap(Base64.getDecoder().decode(encoded));
            if (buffer.remaining() <= GCM_IV_LENGTH) {
                throw new EncryptionUnavailableException("Receipt entry is truncated");
            }
            byte[] iv = new byte[GCM_IV_LENGTH];
            buffer.get(iv);
            byte[] ciphertext = new byte[buffer.remaining()];
            buffer.get(ciphertext);
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(aad(operationId, identifier));
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new EncryptionUnavailableException("Receipt entry could not be decrypted", e);
        }
    }

    private static byte[] aad(String operationId, String identifier) {
        return (operationId + "|" + identifier).getBytes(StandardCharsets.UTF_8);
    }
}
