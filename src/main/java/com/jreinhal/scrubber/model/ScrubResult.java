package com.jreinhal.scrubber.model;

import java.util.List;

public record ScrubResult(List<ContentUnit> redactedUnits, ScrubOperation operation) {

    public ScrubResult {
        redactedUnits = List.copyOf(redactedUnits);
    }

    /**
     * Redacted text of a flat (single unit) payload.
     */
    public String redactedContent() {
        if (redactedUnits.size() != 1 || redactedUnits.get(0).isStructural()) {
            throw new IllegalStateException("Structural payload has no single redacted content; use redactedUnits()");
        }
        return redactedUnits.get(0).text();
    }
}
