package com.jreinhal.scrubber.controller;

import com.jreinhal.scrubber.exception.ValidationException;
import com.jreinhal.scrubber.model.SensitivityTier;

final class Tiers {

    private Tiers() {
    }

    static SensitivityTier parse(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        try {
            return SensitivityTier.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown " + field + ": expected C1, C2, C3 or C4");
        }
    }
}
