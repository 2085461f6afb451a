package com.jreinhal.scrubber.model;

import java.util.Locale;

public enum PolicyAction {
    ALLOW,
    MASK,
    REDACT;

    public boolean altersContent() {
        return this != ALLOW;
    }

    public static PolicyAction parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return PolicyAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
