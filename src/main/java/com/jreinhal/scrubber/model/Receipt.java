package com.jreinhal.scrubber.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Write-once reversal material for one scrub operation.
 *
 * Original values are stored only as AES-256-GCM ciphertext, one entry per redacted or
 * masked occurrence. Positions are kept twice: against the original content (for the
 * explainability record) and against the redacted content (for splicing originals back).
 * The only field that may change after insert is {@link #status}.
 */
@Document(collection="scrub_receipts")
public class Receipt {
    @Id
    private String operationId;
    private Instant createdAt;
    private Status status;
    private String statusReason;
    private SensitivityTier requestedTier;
    private String manifestVersion;
    private List<ContentUnit> redactedUnits;
    private List<Entry> entries;
    private Map<String, String> placeholderMap;
    private String originalHash;
    private String scrubbedHash;

    public Receipt() {
    }

    public Receipt(String operationId, SensitivityTier requestedTier, String manifestVersion, List<ContentUnit> redactedUnits, List<Entry> entries, String originalHash, String scrubbedHash) {
        this.operationId = operationId;
        this.createdAt = Instant.now();
        this.status = Status.VALID;
        this.requestedTier = requestedTier;
        this.manifestVersion = manifestVersion;
        this.redactedUnits = new ArrayList<ContentUnit>(redactedUnits);
        this.entries = new ArrayList<Entry>(entries);
        this.placeholderMap = new LinkedHashMap<String, String>();
        for (Entry entry : entries) {
            this.placeholderMap.putIfAbsent(entry.identifier(), entry.placeholder());
        }
        this.originalHash = originalHash;
        this.scrubbedHash = scrubbedHash;
    }

    public String getOperationId() {
        return this.operationId;
    }

    public Instant getCreatedAt() {
        return this.createdAt;
    }

    public Status getStatus() {
        return this.status;
    }

    public String getStatusReason() {
        return this.statusReason;
    }

    public SensitivityTier getRequestedTier() {
        return this.requestedTier;
    }

    public String getManifestVersion() {
        return this.manifestVersion;
    }

    public List<ContentUnit> getRedactedUnits() {
        return this.redactedUnits == null ? List.of() : List.copyOf(this.redactedUnits);
    }

    public List<Entry> getEntries() {
        return this.entries == null ? List.of() : List.copyOf(this.entries);
    }

    public Map<String, String> getPlaceholderMap() {
        return this.placeholderMap == null ? Map.of() : Map.copyOf(this.placeholderMap);
    }

    public String getOriginalHash() {
        return this.originalHash;
    }

    public String getScrubbedHash() {
        return this.scrubbedHash;
    }

    public boolean isRedeemable() {
        return this.status == Status.VALID;
    }

    /**
     * One protected occurrence.
     *
     * @param originalStart start offset in the original unit
     * @param outputStart start offset of the placeholder in the redacted unit
     */
    public record Entry(
            String identifier,
            String label,
            SensitivityTier tier,
            PolicyAction action,
            double confidence,
            String coordinate,
            int originalStart,
            int originalEnd,
            int outputStart,
            int outputEnd,
            String placeholder,
            String ciphertext
    ) {
    }

    public static enum Status {
        VALID,
        INVALID;

    }
}
