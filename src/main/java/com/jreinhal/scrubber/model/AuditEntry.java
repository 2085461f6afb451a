package com.jreinhal.scrubber.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * One link of the audit hash chain. Carries identifiers, hashes and confidences only,
 * never raw sensitive values.
 */
@Document(collection="audit_ledger")
public class AuditEntry {
    @Id
    private long sequence;
    private Instant timestamp;
    @Indexed
    private EventType eventType;
    @Indexed
    private String operationId;
    private String actor;
    private String sessionId;
    private String originalHash;
    private String scrubbedHash;
    private List<String> actions = new ArrayList<String>();
    private List<AuditedEntity> entities = new ArrayList<AuditedEntity>();
    private String justification;
    @Indexed
    private Outcome outcome;
    private String outcomeReason;
    private ReceiptMode receiptMode;
    private String manifestVersion;
    private boolean detectionDegraded;
    private String prevHash;
    private String currHash;

    public AuditEntry() {
        this.timestamp = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    public static AuditEntry create(EventType type, String operationId, String actor) {
        AuditEntry entry = new AuditEntry();
        entry.eventType = type;
        entry.operationId = operationId;
        entry.actor = actor;
        entry.outcome = type == EventType.SCRUB ? Outcome.SUCCESS : Outcome.GRANTED;
        return entry;
    }

    public AuditEntry withSession(String sessionId) {
        this.sessionId = sessionId;
        return this;
    }

    public AuditEntry withHashes(String originalHash, String scrubbedHash) {
        this.originalHash = originalHash;
        this.scrubbedHash = scrubbedHash;
        return this;
    }

    public AuditEntry withEntities(List<ScrubbedEntity> scrubbed) {
        this.entities = new ArrayList<AuditedEntity>();
        this.actions = new ArrayList<String>();
        for (ScrubbedEntity e : scrubbed) {
            this.entities.add(new AuditedEntity(e.identifier(), e.label(), e.tier().name(), e.confidence(), e.action().name()));
            this.actions.add(e.action().name());
        }
        return this;
    }

    public AuditEntry withAuditedEntities(List<AuditedEntity> audited) {
        this.entities = new ArrayList<AuditedEntity>(audited);
        this.actions = new ArrayList<String>();
        for (AuditedEntity e : audited) {
            this.actions.add(e.action());
        }
        return this;
    }

    public AuditEntry withJustification(String justification) {
        this.justification = justification;
        return this;
    }

    public AuditEntry withOutcome(Outcome outcome, String reason) {
        this.outcome = outcome;
        this.outcomeReason = reason;
        return this;
    }

    public AuditEntry withReceiptMode(ReceiptMode receiptMode) {
        this.receiptMode = receiptMode;
        return this;
    }

    public AuditEntry withManifestVersion(String manifestVersion) {
        this.manifestVersion = manifestVersion;
        return this;
    }

    public AuditEntry withDetectionDegraded(boolean degraded) {
        this.detectionDegraded = degraded;
        return this;
    }

    /**
     * Binds this entry into the chain. Called by the ledger under its append lock.
     */
    public AuditEntry chain(long sequence, String prevHash, String currHash) {
        this.sequence = sequence;
        this.prevHash = prevHash;
        this.currHash = currHash;
        return this;
    }

    /**
     * Fields covered by {@code currHash}, keyed for canonical serialization.
     */
    public Map<String, Object> hashedFields() {
        Map<String, Object> fields = new LinkedHashMap<String, Object>();
        fields.put("sequence", this.sequence);
        fields.put("ts", this.timestamp == null ? null : this.timestamp.toString());
        fields.put("eventType", this.eventType == null ? null : this.eventType.name());
        fields.put("operationId", this.operationId);
        fields.put("actor", this.actor);
        fields.put("sessionId", this.sessionId);
        fields.put("originalHash", this.originalHash);
        fields.put("scrubbedHash", this.scrubbedHash);
        fields.put("actions", this.actions);
        List<Map<String, Object>> entityFields = new ArrayList<Map<String, Object>>();
        List<Double> confidences = new ArrayList<Double>();
        for (AuditedEntity e : this.entities) {
            Map<String, Object> m = new LinkedHashMap<String, Object>();
            m.put("identifier", e.identifier());
            m.put("label", e.label());
            m.put("tier", e.tier());
            m.put("action", e.action());
            entityFields.add(m);
            confidences.add(e.confidence());
        }
        fields.put("entities", entityFields);
        fields.put("confidences", confidences);
        fields.put("justification", this.justification);
        fields.put("outcome", this.outcome == null ? null : this.outcome.name());
        fields.put("outcomeReason", this.outcomeReason);
        fields.put("receiptMode", this.receiptMode == null ? null : this.receiptMode.name());
        fields.put("manifestVersion", this.manifestVersion);
        fields.put("detectionDegraded", this.detectionDegraded);
        return fields;
    }

    public AuditEntry copy() {
        AuditEntry copy = new AuditEntry();
        copy.sequence = this.sequence;
        copy.timestamp = this.timestamp;
        copy.eventType = this.eventType;
        copy.operationId = this.operationId;
        copy.actor = this.actor;
        copy.sessionId = this.sessionId;
        copy.originalHash = this.originalHash;
        copy.scrubbedHash = this.scrubbedHash;
        copy.actions = new ArrayList<String>(this.actions);
        copy.entities = new ArrayList<AuditedEntity>(this.entities);
        copy.justification = this.justification;
        copy.outcome = this.outcome;
        copy.outcomeReason = this.outcomeReason;
        copy.receiptMode = this.receiptMode;
        copy.manifestVersion = this.manifestVersion;
        copy.detectionDegraded = this.detectionDegraded;
        copy.prevHash = this.prevHash;
        copy.currHash = this.currHash;
        return copy;
    }

    public long getSequence() {
        return this.sequence;
    }

    public Instant getTimestamp() {
        return this.timestamp;
    }

    public EventType getEventType() {
        return this.eventType;
    }

    public String getOperationId() {
        return this.operationId;
    }

    public String getActor() {
        return this.actor;
    }

    public String getSessionId() {
        return this.sessionId;
    }

    public String getOriginalHash() {
        return this.originalHash;
    }

    public String getScrubbedHash() {
        return this.scrubbedHash;
    }

    public List<String> getActions() {
        return this.actions;
    }

    public List<AuditedEntity> getEntities() {
        return this.entities;
    }

    public String getJustification() {
        return this.justification;
    }

    public Outcome getOutcome() {
        return this.outcome;
    }

    public String getOutcomeReason() {
        return this.outcomeReason;
    }

    public ReceiptMode getReceiptMode() {
        return this.receiptMode;
    }

    public String getManifestVersion() {
        return this.manifestVersion;
    }

    public boolean isDetectionDegraded() {
        return this.detectionDegraded;
    }

    public String getPrevHash() {
        return this.prevHash;
    }

    public String getCurrHash() {
        return this.currHash;
    }

    public record AuditedEntity(String identifier, String label, String tier, double confidence, String action) {
    }

    public static enum EventType {
        SCRUB,
        DESCRUB;

    }

    public static enum Outcome {
        SUCCESS,
        GRANTED,
        DENIED,
        FAILED;

    }
}
