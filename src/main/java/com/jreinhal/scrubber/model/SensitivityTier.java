package com.jreinhal.scrubber.model;

import java.util.Locale;

/**
 * Ordered sensitivity tiers, lowest to highest.
 *
 * C1 -> Public
 * C2 -> Internal
 * C3 -> Confidential
 * C4 -> Secret (payment data, national identifiers, credentials)
 */
public enum SensitivityTier {
    C1(1),
    C2(2),
    C3(3),
    C4(4);

    private final int level;

    SensitivityTier(int level) {
        this.level = level;
    }

    /**
     * Check if a holder of this tier may see data classified at the required tier.
     */
    public boolean canAccess(SensitivityTier required) {
        return this.level >= required.level;
    }

    public static SensitivityTier max(SensitivityTier a, SensitivityTier b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.level >= b.level ? a : b;
    }

    public static SensitivityTier parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Sensitivity tier is required");
        }
        try {
            return SensitivityTier.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown sensitivity tier: " + value);
        }
    }
}
