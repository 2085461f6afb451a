package com.jreinhal.scrubber.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.jreinhal.scrubber.exception.ChainIntegrityException;
import com.jreinhal.scrubber.model.AuditEntry;
import com.jreinhal.scrubber.repository.LedgerRepository;
import com.jreinhal.scrubber.util.Digests;
import jakarta.annotation.PostConstruct;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Append-only, hash-chained audit log.
 *
 * Each entry's hash is {@code sha256(prevHash + "\n" + canonicalJson(fields))}, canonical
 * meaning Jackson output with map keys sorted. The first entry links to {@link #GENESIS_HASH}.
 * Appends are serialized by a single lock, which also guards the cached tail. Once
 * verification finds a break the ledger is on hold and refuses appends until an operator
 * clears the hold after a clean re-verification.
 */
@Service
public class AuditLedger {
    private static final Logger log = LoggerFactory.getLogger(AuditLedger.class);
    public static final String GENESIS_HASH = "0000000000000000000000000000000000000000000000000000000000000000";
    static final int MAX_TAIL = 1000;

    private final LedgerRepository repository;
    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .build();
    private final ReentrantLock appendLock = new ReentrantLock();
    private long lastSequence = 0L;
    private String lastHash = GENESIS_HASH;
    private volatile boolean integrityHold = false;
    private volatile VerificationReport lastReport;

    @Value("${scrubber.audit.verify-on-startup:true}")
    private boolean verifyOnStartup;

    public AuditLedger(LedgerRepository repository) {
        this.repository = repository;
    }

    @PostConstruct
    public void init() {
        this.appendLock.lock();
        try {
            Optional<AuditEntry> last = this.repository.findLast();
            this.lastSequence = last.map(AuditEntry::getSequence).orElse(0L);
            this.lastHash = last.map(AuditEntry::getCurrHash).orElse(GENESIS_HASH);
        } finally {
            this.appendLock.unlock();
        }
        log.info("Audit ledger restored at sequence {}", this.lastSequence);
        if (this.verifyOnStartup) {
            VerificationReport report = verify();
            if (!report.valid()) {
                log.error("!!! AUDIT LEDGER INTEGRITY FAILURE at position {}: {}. Appends are on hold. !!!",
                        report.firstBadPosition(), report.reason());
            }
        }
    }

    /**
     * Chains and persists {@code entry}. Returns the stored entry with sequence and hashes set.
     *
     * @throws ChainIntegrityException if the ledger is on integrity hold
     */
    public AuditEntry append(AuditEntry entry) {
        this.appendLock.lock();
        try {
            if (this.integrityHold) {
                throw new ChainIntegrityException("Audit ledger is on integrity hold; appends refused",
                        this.lastReport == null ? -1L : this.lastReport.firstBadPosition());
            }
            long sequence = this.lastSequence + 1;
            AuditEntry chained = entry.copy().chain(sequence, this.lastHash, null);
            String currHash = computeHash(this.lastHash, chained);
            chained.chain(sequence, this.lastHash, currHash);
            this.repository.append(chained);
            this.lastSequence = sequence;
            this.lastHash = currHash;
            log.debug("Audit entry {} appended for operation {} ({})", sequence, chained.getOperationId(), chained.getEventType());
            return chained.copy();
        } finally {
            this.appendLock.unlock();
        }
    }

    /**
     * Replays the whole chain. The first broken entry is reported by 1-based position and puts
     * the ledger on hold.
     */
    public VerificationReport verify() {
        VerificationReport report;
        try (Stream<AuditEntry> entries = this.repository.streamAll()) {
            report = replay(entries.iterator());
        }
        this.lastReport = report;
        if (!report.valid()) {
            this.integrityHold = true;
            log.error("Audit chain broken at position {}: {}", report.firstBadPosition(), report.reason());
        } else {
            log.info("Audit chain verified: {} entries", report.entriesChecked());
        }
        return report;
    }

    private VerificationReport replay(Iterator<AuditEntry> entries) {
        String expectedPrev = GENESIS_HASH;
        long position = 0L;
        while (entries.hasNext()) {
            AuditEntry entry = entries.next();
            position++;
            if (entry.getSequence() != position) {
                return VerificationReport.broken(position - 1, position, "sequence gap: expected " + position + " but found " + entry.getSequence());
            }
            if (!expectedPrev.equals(entry.getPrevHash())) {
                return VerificationReport.broken(position - 1, position, "prevHash does not link to the preceding entry");
            }
            String recomputed = computeHash(entry.getPrevHash(), entry);
            if (!recomputed.equals(entry.getCurrHash())) {
                return VerificationReport.broken(position - 1, position, "stored hash does not match entry contents");
            }
            expectedPrev = entry.getCurrHash();
        }
        return VerificationReport.intact(position);
    }

    /**
     * Lifts the integrity hold if, and only if, a fresh verification passes.
     */
    public VerificationReport clearIntegrityHold(String operator) {
        this.appendLock.lock();
        try {
            VerificationReport report = verify();
            if (!report.valid()) {
                throw new ChainIntegrityException("Chain still broken at position " + report.firstBadPosition(), report.firstBadPosition());
            }
            Optional<AuditEntry> last = this.repository.findLast();
            this.lastSequence = last.map(AuditEntry::getSequence).orElse(0L);
            this.lastHash = last.map(AuditEntry::getCurrHash).orElse(GENESIS_HASH);
            this.integrityHold = false;
            log.warn("Audit integrity hold cleared by {}", operator);
            return report;
        } finally {
            this.appendLock.unlock();
        }
    }

    public boolean isOnIntegrityHold() {
        return this.integrityHold;
    }

    public List<AuditEntry> tail(int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_TAIL));
        return this.repository.findLatest(bounded);
    }

    public List<AuditEntry> findByOperation(String operationId) {
        return this.repository.findByOperationId(operationId);
    }

    /**
     * Counts over the whole ledger: entries by event type and outcome, entities by label,
     * action and tier.
     */
    public Statistics statistics() {
        Map<String, Long> byEventType = new TreeMap<String, Long>();
        Map<String, Long> byOutcome = new TreeMap<String, Long>();
        Map<String, Long> byLabel = new TreeMap<String, Long>();
        Map<String, Long> byAction = new TreeMap<String, Long>();
        Map<String, Long> byTier = new TreeMap<String, Long>();
        long total = 0L;
        try (Stream<AuditEntry> entries = this.repository.streamAll()) {
            Iterator<AuditEntry> it = entries.iterator();
            while (it.hasNext()) {
                AuditEntry entry = it.next();
                total++;
                byEventType.merge(String.valueOf(entry.getEventType()), 1L, Long::sum);
                byOutcome.merge(String.valueOf(entry.getOutcome()), 1L, Long::sum);
                if (entry.getEventType() != AuditEntry.EventType.SCRUB) {
                    continue;
                }
                for (AuditEntry.AuditedEntity entity : entry.getEntities()) {
                    byLabel.merge(entity.label(), 1L, Long::sum);
                    byAction.merge(entity.action(), 1L, Long::sum);
                    byTier.merge(entity.tier(), 1L, Long::sum);
                }
            }
        }
        return new Statistics(total, byEventType, byOutcome, byLabel, byAction, byTier);
    }

    String computeHash(String prevHash, AuditEntry entry) {
        try {
            String canonical = this.canonicalMapper.writeValueAsString(entry.hashedFields());
            return Digests.sha256Hex(prevHash + "\n" + canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit entry could not be serialized for hashing", e);
        }
    }

    public record VerificationReport(boolean valid, long entriesChecked, long firstBadPosition, String reason) {

        static VerificationReport intact(long entriesChecked) {
            return new VerificationReport(true, entriesChecked, -1L, null);
        }

        static VerificationReport broken(long entriesChecked, long position, String reason) {
            return new VerificationReport(false, entriesChecked, position, reason);
        }
    }

    public record Statistics(
            long totalEntries,
            Map<String, Long> byEventType,
            Map<String, Long> byOutcome,
            Map<String, Long> byLabel,
            Map<String, Long> byAction,
            Map<String, Long> byTier
    ) {

        public Statistics {
            byEventType = Map.copyOf(byEventType);
            byOutcome = Map.copyOf(byOutcome);
            byLabel = Map.copyOf(byLabel);
            byAction = Map.copyOf(byAction);
            byTier = Map.copyOf(byTier);
        }
    }
}
