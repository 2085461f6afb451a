package com.jreinhal.scrubber.service;

import com.jreinhal.scrubber.exception.EncryptionUnavailableException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Component;

/**
 * Resolves key material from a source string:
 * {@code base64:<key>}, {@code env:<VARIABLE>} or {@code file:<path>}.
 * Environment and file contents are themselves base64, optionally with the {@code base64:} prefix.
 */
@Component
public class KeyMaterialLoader {
    static final int AES_256_KEY_BYTES = 32;

    private final UnaryOperator<String> environment;

    public KeyMaterialLoader() {
        this(System::getenv);
    }

    KeyMaterialLoader(UnaryOperator<String> environment) {
        this.environment = environment;
    }

    /**
     * @return the 256-bit key, or {@code null} when no source is configured
     * @throws EncryptionUnavailableException when the source is configured but unusable
     */
    public byte[] loadAesKey(String source) {
        if (source == null || source.isBlank()) {
            return null;
        }
        String trimmed = source.trim();
        String encoded;
        if (trimmed.startsWith("env:")) {
            String variable = trimmed.substring("env:".length()).trim();
            encoded = this.environment.apply(variable);
            if (encoded == null || encoded.isBlank()) {
                throw new EncryptionUnavailableException("Environment variable " + variable + " holding the receipt key is not set");
            }
        } else if (trimmed.startsWith("file:")) {
            Path path = Path.of(trimmed.substring("file:".length()).trim());
            try {
                encoded = Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new EncryptionUnavailableException("Receipt key file is unreadable", e);
            }
        } else {
            encoded = trimmed;
        }
        byte[] key = decodeBase64(encoded.trim());
        if (key.length != AES_256_KEY_BYTES) {
            throw new EncryptionUnavailableException("Receipt key must be 256 bits, got " + key.length * 8);
        }
        return key;
    }

    private static byte[] decodeBase64(String value) {
        String body = value.startsWith("base64:") ? value.substring("base64:".length()) : value;
        try {
            return Base64.getDecoder().decode(body);
        } catch (IllegalArgumentException e) {
            throw new EncryptionUnavailableException("Receipt key is not valid base64", e);
        }
    }
}
