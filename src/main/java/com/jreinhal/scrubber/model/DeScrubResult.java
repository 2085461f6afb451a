package com.jreinhal.scrubber.model;

import java.util.List;

/**
 * Outcome of a reversal. Denied results carry no content.
 */
public record DeScrubResult(
        String operationId,
        AuditEntry.Outcome outcome,
        List<ContentUnit> restoredUnits,
        List<String> restoredIdentifiers,
        SensitivityTier requiredTier,
        String reason,
        long auditSequence
) {

    public DeScrubResult {
        restoredUnits = restoredUnits == null ? List.of() : List.copyOf(restoredUnits);
        restoredIdentifiers = restoredIdentifiers == null ? List.of() : List.copyOf(restoredIdentifiers);
    }

    public boolean isGranted() {
        return outcome == AuditEntry.Outcome.GRANTED;
    }

    public String restoredContent() {
        if (!isGranted()) {
            return null;
        }
        if (restoredUnits.size() != 1 || restoredUnits.get(0).isStructural()) {
            throw new IllegalStateException("Structural receipt has no single content; use restoredUnits()");
        }
        return restoredUnits.get(0).text();
    }
}
