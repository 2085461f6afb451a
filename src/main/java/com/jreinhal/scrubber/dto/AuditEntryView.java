package com.jreinhal.scrubber.dto;

import com.jreinhal.scrubber.model.AuditEntry;
import java.util.List;

public record AuditEntryView(
        long sequence,
        String timestamp,
        String eventType,
        String operationId,
        String actor,
        String sessionId,
        String originalHash,
        String scrubbedHash,
        List<String> actions,
        List<AuditEntry.AuditedEntity> entities,
        String justification,
        String outcome,
        String outcomeReason,
        String receiptMode,
        String manifestVersion,
        boolean detectionDegraded,
        String prevHash,
        String currHash
) {

    public static AuditEntryView from(AuditEntry e) {
        return new AuditEntryView(e.getSequence(), String.valueOf(e.getTimestamp()), String.valueOf(e.getEventType()), e.getOperationId(),
                e.getActor(), e.getSessionId(), e.getOriginalHash(), e.getScrubbedHash(), e.getActions(), e.getEntities(),
                e.getJustification(), String.valueOf(e.getOutcome()), e.getOutcomeReason(),
                e.getReceiptMode() == null ? null : e.getReceiptMode().name(), e.getManifestVersion(), e.isDetectionDegraded(),
                e.getPrevHash(), e.getCurrHash());
    }
}
