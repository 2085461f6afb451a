package com.jreinhal.scrubber.service;

import com.jreinhal.scrubber.exception.EncryptionUnavailableException;
import com.jreinhal.scrubber.exception.ReceiptNotFoundException;
import com.jreinhal.scrubber.exception.ValidationException;
import com.jreinhal.scrubber.model.AuditEntry;
import com.jreinhal.scrubber.model.ContentUnit;
import com.jreinhal.scrubber.model.DeScrubRequest;
import com.jreinhal.scrubber.model.DeScrubResult;
import com.jreinhal.scrubber.model.Receipt;
import com.jreinhal.scrubber.model.SensitivityTier;
import com.jreinhal.scrubber.util.LogSanitizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Restores original values from a receipt for an authorized caller.
 *
 * Every authorization decision produces exactly one audit entry, and the audit entry is
 * written before any restored content leaves this service. A granted request whose receipt
 * cannot be decrypted is recorded as {@code FAILED} before the error propagates. Persisted
 * receipts and redacted units are never modified.
 */
@Service
public class DeScrubService {
    private static final Logger log = LoggerFactory.getLogger(DeScrubService.class);

    private final ReceiptStore receiptStore;
    private final AuditLedger auditLedger;
    private final Set<String> allowedRoles;

    public DeScrubService(ReceiptStore receiptStore, AuditLedger auditLedger,
                          @Value("${scrubber.descrub.allowed-roles:admin,auditor}") String allowedRoles) {
        this.receiptStore = receiptStore;
        this.auditLedger = auditLedger;
        this.allowedRoles = Arrays.stream(allowedRoles.split(","))
                .map(r -> r.trim().toLowerCase(Locale.ROOT))
                .filter(r -> !r.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public DeScrubResult descrub(DeScrubRequest request) {
        if (request == null || request.operationId() == null || request.operationId().isBlank()) {
            throw new ValidationException("Operation id is required");
        }
        if (request.actor() == null || request.actor().isBlank()) {
            throw new ValidationException("Actor is required");
        }
        if (request.justification() == null || request.justification().isBlank()) {
            throw new ValidationException("Justification is required for de-scrub");
        }
        Receipt receipt = this.receiptStore.findRedeemable(request.operationId())
                .orElseThrow(() -> new ReceiptNotFoundException("No redeemable receipt for operation " + request.operationId()));

        List<Receipt.Entry> selected = select(receipt, request);
        SensitivityTier requiredTier = SensitivityTier.C1;
        for (Receipt.Entry entry : selected) {
            requiredTier = SensitivityTier.max(requiredTier, entry.tier());
        }
        List<AuditEntry.AuditedEntity> audited = audited(selected);

        String denial = denialReason(request, requiredTier);
        if (denial != null) {
            AuditEntry appended = this.auditLedger.append(baseEntry(request, receipt, audited)
                    .withOutcome(AuditEntry.Outcome.DENIED, denial));
            log.warn("De-scrub of {} denied for {}: {}", request.operationId(), LogSanitizer.sanitize(request.actor()), denial);
            return new DeScrubResult(request.operationId(), AuditEntry.Outcome.DENIED, List.of(), List.of(), requiredTier,
                    denial, appended.getSequence());
        }

        List<ContentUnit> restored;
        try {
            restored = restore(receipt, selected);
        } catch (EncryptionUnavailableException e) {
            this.auditLedger.append(baseEntry(request, receipt, audited)
                    .withOutcome(AuditEntry.Outcome.FAILED, "receipt could not be decrypted"));
            log.error("De-scrub of {} for {} failed: {}", request.operationId(), LogSanitizer.sanitize(request.actor()), e.getMessage());
            throw e;
        }
        List<String> identifiers = selected.stream().map(Receipt.Entry::identifier).distinct().collect(Collectors.toList());
        AuditEntry appended = this.auditLedger.append(baseEntry(request, receipt, audited)
                .withOutcome(AuditEntry.Outcome.GRANTED, null));
        log.info("De-scrub of {} granted to {} ({} occurrence(s), required tier {})", request.operationId(),
                LogSanitizer.sanitize(request.actor()), selected.size(), requiredTier);
        return new DeScrubResult(request.operationId(), AuditEntry.Outcome.GRANTED, restored, identifiers, requiredTier,
                null, appended.getSequence());
    }

    private static List<Receipt.Entry> select(Receipt receipt, DeScrubRequest request) {
        List<Receipt.Entry> entries = receipt.getEntries();
        if (request.isFull()) {
            return entries;
        }
        Set<String> known = receipt.getPlaceholderMap().keySet();
        Set<String> unknown = new TreeSet<String>();
        for (String identifier : request.identifiers()) {
            if (!known.contains(identifier)) {
                unknown.add(identifier);
            }
        }
        if (!unknown.isEmpty()) {
            throw new ValidationException("Identifiers not present in receipt: " + unknown.size());
        }
        List<Receipt.Entry> selected = new ArrayList<Receipt.Entry>();
        for (Receipt.Entry entry : entries) {
            if (request.identifiers().contains(entry.identifier())) {
                selected.add(entry);
            }
        }
        return selected;
    }

    private String denialReason(DeScrubRequest request, SensitivityTier requiredTier) {
        String role = request.role() == null ? "" : request.role().trim().toLowerCase(Locale.ROOT);
        if (!this.allowedRoles.contains(role)) {
            return "role not permitted to de-scrub";
        }
        if (request.clearance() == null || !request.clearance().canAccess(requiredTier)) {
            return "clearance below required tier " + requiredTier;
        }
        return null;
    }

    /**
     * Splices originals into copies of the stored redacted units. Within a unit, replacements
     * run right to left so earlier output offsets stay valid.
     */
    private List<ContentUnit> restore(Receipt receipt, List<Receipt.Entry> selected) {
        List<ContentUnit> restored = new ArrayList<ContentUnit>();
        for (ContentUnit unit : receipt.getRedactedUnits()) {
            List<Receipt.Entry> inUnit = new ArrayList<Receipt.Entry>();
            for (Receipt.Entry entry : selected) {
                if (Objects.equals(entry.coordinate(), unit.coordinate())) {
                    inUnit.add(entry);
                }
            }
            inUnit.sort(Comparator.comparingInt(Receipt.Entry::outputStart).reversed());
            StringBuilder text = new StringBuilder(unit.text());
            for (Receipt.Entry entry : inUnit) {
                text.replace(entry.outputStart(), entry.outputEnd(), this.receiptStore.open(receipt, entry));
            }
            restored.add(new ContentUnit(unit.coordinate(), text.toString()));
        }
        return restored;
    }

    private static List<AuditEntry.AuditedEntity> audited(List<Receipt.Entry> selected) {
        List<AuditEntry.AuditedEntity> audited = new ArrayList<AuditEntry.AuditedEntity>();
        for (Receipt.Entry entry : selected) {
            audited.add(new AuditEntry.AuditedEntity(entry.identifier(), entry.label(), entry.tier().name(), entry.confidence(),
                    entry.action().name()));
        }
        return audited;
    }

    private static AuditEntry baseEntry(DeScrubRequest request, Receipt receipt, List<AuditEntry.AuditedEntity> audited) {
        return AuditEntry.create(AuditEntry.EventType.DESCRUB, request.operationId(), request.actor())
                .withSession(request.sessionId())
                .withHashes(receipt.getOriginalHash(), receipt.getScrubbedHash())
                .withAuditedEntities(audited)
                .withJustification(request.justification())
                .withManifestVersion(receipt.getManifestVersion());
    }
}
