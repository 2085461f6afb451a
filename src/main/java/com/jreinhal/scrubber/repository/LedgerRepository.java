package com.jreinhal.scrubber.repository;

import com.jreinhal.scrubber.model.AuditEntry;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Append-only store for audit entries, read back in sequence order.
 */
public interface LedgerRepository {

    void append(AuditEntry entry);

    Optional<AuditEntry> findLast();

    /**
     * All entries in ascending sequence order. Callers must close the stream.
     */
    Stream<AuditEntry> streamAll();

    /**
     * The newest {@code limit} entries, newest first.
     */
    List<AuditEntry> findLatest(int limit);

    List<AuditEntry> findByOperationId(String operationId);

    long count();
}
