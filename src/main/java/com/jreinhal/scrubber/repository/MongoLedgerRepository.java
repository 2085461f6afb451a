package com.jreinhal.scrubber.repository;

import com.jreinhal.scrubber.exception.ChainIntegrityException;
import com.jreinhal.scrubber.model.AuditEntry;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

@Repository
public class MongoLedgerRepository implements LedgerRepository {
    private final MongoTemplate mongoTemplate;

    public MongoLedgerRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void append(AuditEntry entry) {
        try {
            this.mongoTemplate.insert(entry);
        } catch (DuplicateKeyException e) {
            // another writer took this sequence number
            throw new ChainIntegrityException("Ledger sequence " + entry.getSequence() + " already taken", e);
        }
    }

    @Override
    public Optional<AuditEntry> findLast() {
        Query query = new Query().with(Sort.by(Sort.Direction.DESC, "_id")).limit(1);
        return Optional.ofNullable(this.mongoTemplate.findOne(query, AuditEntry.class));
    }

    @Override
    public Stream<AuditEntry> streamAll() {
        Query query = new Query().with(Sort.by(Sort.Direction.ASC, "_id"));
        return this.mongoTemplate.stream(query, AuditEntry.class);
    }

    @Override
    public List<AuditEntry> findLatest(int limit) {
        Query query = new Query().with(Sort.by(Sort.Direction.DESC, "_id")).limit(limit);
        return this.mongoTemplate.find(query, AuditEntry.class);
    }

    @Override
    public List<AuditEntry> findByOperationId(String operationId) {
        Query query = new Query(Criteria.where("operationId").is(operationId)).with(Sort.by(Sort.Direction.ASC, "_id"));
        return this.mongoTemplate.find(query, AuditEntry.class);
    }

    @Override
    public long count() {
        return this.mongoTemplate.count(new Query(), AuditEntry.class);
    }
}
