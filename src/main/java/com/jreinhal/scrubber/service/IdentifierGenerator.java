package com.jreinhal.scrubber.service;

import com.jreinhal.scrubber.model.SensitivityTier;
import com.jreinhal.scrubber.util.Digests;
import java.nio.charset.StandardCharsets;
import org.springframework.stereotype.Component;

/**
 * Produces placeholder identifiers {@code {tier}::{label}::{10 hex}} from a salted SHA-256
 * of the raw value. Same salt and value always give the same identifier, across operations
 * and processes.
 *
 * Ten hex characters are 40 bits: enough to link occurrences, not a uniqueness guarantee.
 */
@Component
public class IdentifierGenerator {
    static final int DIGEST_CHARS = 10;

    private final ScrubberSecrets secrets;

    public IdentifierGenerator(ScrubberSecrets secrets) {
        this.secrets = secrets;
    }

    public String generate(SensitivityTier tier, String label, String rawValue) {
        String digest = Digests.sha256Hex(this.secrets.salt(), rawValue.getBytes(StandardCharsets.UTF_8));
        return tier.name() + "::" + label + "::" + digest.substring(0, DIGEST_CHARS);
    }
}
