package com.jreinhal.scrubber.model;

import java.util.Set;

/**
 * Request to restore original values from a receipt. An empty identifier set selects everything.
 */
public record DeScrubRequest(
        String operationId,
        String actor,
        String sessionId,
        String role,
        SensitivityTier clearance,
        String justification,
        Set<String> identifiers
) {

    public DeScrubRequest {
        identifiers = identifiers == null ? Set.of() : Set.copyOf(identifiers);
    }

    public static DeScrubRequest full(String operationId, String actor, String role, SensitivityTier clearance, String justification) {
        return new DeScrubRequest(operationId, actor, null, role, clearance, justification, Set.of());
    }

    public boolean isFull() {
        return identifiers.isEmpty();
    }
}
