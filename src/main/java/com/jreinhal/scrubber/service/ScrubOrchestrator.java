package com.jreinhal.scrubber.service;

import com.jreinhal.scrubber.detection.DetectorRegistry;
import com.jreinhal.scrubber.exception.ChainIntegrityException;
import com.jreinhal.scrubber.exception.ScrubFailedException;
import com.jreinhal.scrubber.exception.ValidationException;
import com.jreinhal.scrubber.fusion.FusionEngine;
import com.jreinhal.scrubber.fusion.RecognitionGateway;
import com.jreinhal.scrubber.model.AuditEntry;
import com.jreinhal.scrubber.model.CandidateEntity;
import com.jreinhal.scrubber.model.ContentUnit;
import com.jreinhal.scrubber.model.ExternalModelStatus;
import com.jreinhal.scrubber.model.FusedEntity;
import com.jreinhal.scrubber.model.PolicyAction;
import com.jreinhal.scrubber.model.Receipt;
import com.jreinhal.scrubber.model.ReceiptMode;
import com.jreinhal.scrubber.model.ScrubOperation;
import com.jreinhal.scrubber.model.ScrubRequest;
import com.jreinhal.scrubber.model.ScrubResult;
import com.jreinhal.scrubber.model.ScrubState;
import com.jreinhal.scrubber.model.ScrubbedEntity;
import com.jreinhal.scrubber.policy.MaskFormatter;
import com.jreinhal.scrubber.policy.PolicyEngine;
import com.jreinhal.scrubber.policy.PolicySet;
import com.jreinhal.scrubber.util.Digests;
import com.jreinhal.scrubber.util.LogSanitizer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs one payload through detection, fusion, policy and substitution, then persists the
 * receipt and appends the audit entry.
 *
 * State order: RECEIVED, DETECTING, FUSING, POLICY_APPLYING, SUBSTITUTING, PERSISTING, LOGGED.
 * Nothing is persisted before PERSISTING, so a failure or cancellation earlier leaves no trace.
 * The receipt is written before the audit entry; if the append fails the receipt is invalidated.
 */
@Service
public class ScrubOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ScrubOrchestrator.class);

    private final DetectorRegistry detectorRegistry;
    private final RecognitionGateway recognitionGateway;
    private final FusionEngine fusionEngine;
    private final PolicyEngine policyEngine;
    private final IdentifierGenerator identifierGenerator;
    private final ReceiptStore receiptStore;
    private final AuditLedger auditLedger;

    @Value("${scrubber.scrub.max-content-length:1000000}")
    private int maxContentLength;

    @Value("${scrubber.receipts.allow-receiptless:false}")
    private boolean allowReceiptless;

    public ScrubOrchestrator(DetectorRegistry detectorRegistry, RecognitionGateway recognitionGateway, FusionEngine fusionEngine,
                             PolicyEngine policyEngine, IdentifierGenerator identifierGenerator, ReceiptStore receiptStore,
                             AuditLedger auditLedger) {
        this.detectorRegistry = detectorRegistry;
        this.recognitionGateway = recognitionGateway;
        this.fusionEngine = fusionEngine;
        this.policyEngine = policyEngine;
        this.identifierGenerator = identifierGenerator;
        this.receiptStore = receiptStore;
        this.auditLedger = auditLedger;
    }

    public ScrubResult scrub(ScrubRequest request) {
        validate(request);
        Run run = new Run();
        try {
            return execute(request, run);
        } catch (RuntimeException e) {
            log.warn("Scrub failed in state {} for actor {}: {}", run.state, LogSanitizer.sanitize(request.actor()),
                    LogSanitizer.sanitize(e.getMessage()));
            run.state = ScrubState.FAILED;
            throw e;
        }
    }

    private ScrubResult execute(ScrubRequest request, Run run) {
        // captured once; a concurrent reload does not affect this operation
        PolicySet policy = this.policyEngine.snapshot();
        policy.require(request.requestedTier());
        if (!request.receiptless()) {
            this.receiptStore.requireEncryption();
        }
        List<ContentUnit> units = request.units();
        log.info("Scrub received from {}: {} unit(s) {}", LogSanitizer.sanitize(request.actor()), units.size(),
                units.size() == 1 ? LogSanitizer.contentSummary(units.get(0).text()) : "");

        run.advance(ScrubState.DETECTING);
        List<List<CandidateEntity>> candidates = new ArrayList<List<CandidateEntity>>();
        List<RecognitionGateway.Outcome> recognized = new ArrayList<RecognitionGateway.Outcome>();
        ExternalModelStatus externalStatus = ExternalModelStatus.DISABLED;
        for (ContentUnit unit : units) {
            candidates.add(this.detectorRegistry.detect(unit));
            RecognitionGateway.Outcome outcome = this.recognitionGateway.recognize(unit.text());
            recognized.add(outcome);
            externalStatus = RecognitionGateway.Outcome.combine(externalStatus, outcome.status());
            checkCancelled(run);
        }

        run.advance(ScrubState.FUSING);
        List<List<FusedEntity>> fused = new ArrayList<List<FusedEntity>>();
        for (int i = 0; i < units.size(); i++) {
            ContentUnit unit = units.get(i);
            fused.add(this.fusionEngine.fuse(candidates.get(i), recognized.get(i).candidates(), unit.text().length(), unit.coordinate(),
                    request.requestedTier()));
        }
        checkCancelled(run);

        run.advance(ScrubState.POLICY_APPLYING);
        List<List<ScrubbedEntity>> decided = new ArrayList<List<ScrubbedEntity>>();
        for (int i = 0; i < units.size(); i++) {
            String text = units.get(i).text();
            List<ScrubbedEntity> unitEntities = new ArrayList<ScrubbedEntity>();
            for (FusedEntity entity : fused.get(i)) {
                String raw = text.substring(entity.span().start(), entity.span().end());
                PolicyAction action = policy.actionFor(entity.label(), entity.tier());
                String identifier = this.identifierGenerator.generate(entity.tier(), entity.label(), raw);
                unitEntities.add(ScrubbedEntity.of(entity, identifier, action));
            }
            decided.add(unitEntities);
        }
        checkCancelled(run);

        run.advance(ScrubState.SUBSTITUTING);
        List<ContentUnit> redactedUnits = new ArrayList<ContentUnit>();
        List<PendingEntry> pending = new ArrayList<PendingEntry>();
        List<ScrubbedEntity> allEntities = new ArrayList<ScrubbedEntity>();
        for (int i = 0; i < units.size(); i++) {
            ContentUnit unit = units.get(i);
            redactedUnits.add(new ContentUnit(unit.coordinate(), substitute(unit.text(), decided.get(i), pending)));
            allEntities.addAll(decided.get(i));
        }
        checkCancelled(run);

        run.advance(ScrubState.PERSISTING);
        boolean receiptless = request.receiptless();
        ReceiptMode receiptMode = receiptless ? ReceiptMode.NONE : ReceiptMode.ENCRYPTED;
        String operationId = UUID.randomUUID().toString();
        String originalHash = hashUnits(units);
        String scrubbedHash = hashUnits(redactedUnits);
        if (!receiptless) {
            List<Receipt.Entry> entries = new ArrayList<Receipt.Entry>();
            for (PendingEntry p : pending) {
                entries.add(p.seal(operationId, this.receiptStore));
            }
            this.receiptStore.save(new Receipt(operationId, request.requestedTier(), policy.version(), redactedUnits, entries, originalHash, scrubbedHash));
        }
        AuditEntry entry = AuditEntry.create(AuditEntry.EventType.SCRUB, operationId, request.actor())
                .withSession(request.sessionId())
                .withHashes(originalHash, scrubbedHash)
                .withEntities(allEntities)
                .withReceiptMode(receiptMode)
                .withManifestVersion(policy.version())
                .withDetectionDegraded(externalStatus == ExternalModelStatus.DEGRADED);
        AuditEntry appended;
        try {
            appended = this.auditLedger.append(entry);
        } catch (RuntimeException e) {
            if (!receiptless) {
                invalidateOrphan(operationId, e);
            }
            if (e instanceof ChainIntegrityException) {
                throw e;
            }
            throw new ScrubFailedException("Audit append failed for operation " + operationId, e);
        }

        run.advance(ScrubState.LOGGED);
        ScrubOperation operation = new ScrubOperation(operationId, appended.getTimestamp(), request.actor(), request.sessionId(),
                request.requestedTier(), originalHash, scrubbedHash, allEntities, policy.version(), externalStatus, receiptMode,
                appended.getSequence());
        log.info("Scrub {} logged at sequence {}: {} entities, external model {}", operationId, appended.getSequence(),
                allEntities.size(), externalStatus);
        return new ScrubResult(redactedUnits, operation);
    }

    /**
     * Rebuilds {@code text} left to right against original offsets. Entities never overlap,
     * so each is applied exactly once.
     */
    static String substitute(String text, List<ScrubbedEntity> entities, List<PendingEntry> pending) {
        StringBuilder out = new StringBuilder(text.length());
        int cursor = 0;
        for (ScrubbedEntity entity : entities) {
            int start = entity.span().start();
            int end = entity.span().end();
            out.append(text, cursor, start);
            String raw = text.substring(start, end);
            String replacement;
            switch (entity.action()) {
                case MASK:
                    replacement = MaskFormatter.mask(raw);
                    break;
                case REDACT:
                    replacement = entity.identifier();
                    break;
                case ALLOW:
                default:
                    replacement = raw;
                    break;
            }
            int outputStart = out.length();
            out.append(replacement);
            if (entity.action().altersContent()) {
                pending.add(new PendingEntry(entity, raw, replacement, outputStart, out.length()));
            }
            cursor = end;
        }
        out.append(text, cursor, text.length());
        return out.toString();
    }

    private void validate(ScrubRequest request) {
        if (request == null || request.units() == null) {
            throw new ValidationException("Content is required");
        }
        if (request.actor() == null || request.actor().isBlank()) {
            throw new ValidationException("Actor is required");
        }
        if (request.requestedTier() == null) {
            throw new ValidationException("Requested tier is required");
        }
        if (request.units().isEmpty()) {
            throw new ValidationException("At least one content unit is required");
        }
        if (request.receiptless() && !this.allowReceiptless) {
            throw new ValidationException("Receipt-less operation is not enabled");
        }
        long total = 0L;
        Set<String> coordinates = new HashSet<String>();
        for (ContentUnit unit : request.units()) {
            if (unit == null || unit.text() == null) {
                throw new ValidationException("Content is required");
            }
            if (request.units().size() > 1 && !unit.isStructural()) {
                throw new ValidationException("Every unit of a structural payload needs a coordinate");
            }
            if (unit.isStructural() && (unit.coordinate().isBlank() || !coordinates.add(unit.coordinate()))) {
                throw new ValidationException("Duplicate or blank coordinate: " + LogSanitizer.sanitize(unit.coordinate()));
            }
            total += unit.text().length();
        }
        if (total > this.maxContentLength) {
            throw new ValidationException("Content exceeds maximum length of " + this.maxContentLength);
        }
    }

    private void invalidateOrphan(String operationId, RuntimeException cause) {
        try {
            this.receiptStore.invalidate(operationId, "audit append failed");
        } catch (RuntimeException invalidationFailure) {
            log.error("Receipt {} could not be invalidated after audit failure", operationId, invalidationFailure);
            cause.addSuppressed(invalidationFailure);
        }
    }

    private static void checkCancelled(Run run) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Scrub cancelled during " + run.state);
        }
    }

    static String hashUnits(List<ContentUnit> units) {
        if (units.size() == 1 && !units.get(0).isStructural()) {
            return Digests.sha256Hex(units.get(0).text());
        }
        List<byte[]> parts = new ArrayList<byte[]>();
        for (ContentUnit unit : units) {
            parts.add((unit.coordinate() + "\u001f" + unit.text() + "\u001e").getBytes(StandardCharsets.UTF_8));
        }
        return Digests.sha256Hex(parts.toArray(new byte[0][]));
    }

    private static final class Run {
        private ScrubState state = ScrubState.RECEIVED;

        void advance(ScrubState next) {
            log.debug("Scrub state {} -> {}", this.state, next);
            this.state = next;
        }
    }

    /**
     * A substituted occurrence waiting to be sealed into the receipt once the operation id is known.
     */
    record PendingEntry(ScrubbedEntity entity, String original, String placeholder, int outputStart, int outputEnd) {

        Receipt.Entry seal(String operationId, ReceiptStore store) {
            return new Receipt.Entry(entity.identifier(), entity.label(), entity.tier(), entity.action(), entity.confidence(),
                    entity.coordinate(), entity.span().start(), entity.span().end(), outputStart, outputEnd, placeholder,
                    store.seal(operationId, entity.identifier(), original));
        }
    }
}
