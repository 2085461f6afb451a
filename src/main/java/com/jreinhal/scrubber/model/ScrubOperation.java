package com.jreinhal.scrubber.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable record of one completed scrub.
 */
public record ScrubOperation(
        String operationId,
        Instant timestamp,
        String actor,
        String sessionId,
        SensitivityTier requestedTier,
        String originalHash,
        String scrubbedHash,
        List<ScrubbedEntity> entities,
        String manifestVersion,
        ExternalModelStatus externalModelStatus,
        ReceiptMode receiptMode,
        long auditSequence
) {

    public ScrubOperation {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    public boolean isDetectionDegraded() {
        return externalModelStatus == ExternalModelStatus.DEGRADED;
    }
}
