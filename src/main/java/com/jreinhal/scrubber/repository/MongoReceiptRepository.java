package com.jreinhal.scrubber.repository;

import com.jreinhal.scrubber.exception.ReceiptConflictException;
import com.jreinhal.scrubber.model.Receipt;
import java.util.Optional;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

@Repository
public class MongoReceiptRepository implements ReceiptRepository {
    private final MongoTemplate mongoTemplate;

    public MongoReceiptRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void insert(Receipt receipt) {
        try {
            // insert, not save: save would silently overwrite an existing receipt
            this.mongoTemplate.insert(receipt);
        } catch (DuplicateKeyException e) {
            throw new ReceiptConflictException("Receipt already exists for operation " + receipt.getOperationId(), e);
        }
    }

    @Override
    public Optional<Receipt> findById(String operationId) {
        return Optional.ofNullable(this.mongoTemplate.findById(operationId, Receipt.class));
    }

    @Override
    public void markInvalid(String operationId, String reason) {
        Query query = new Query(Criteria.where("_id").is(operationId));
        Update update = new Update().set("status", Receipt.Status.INVALID).set("statusReason", reason);
        this.mongoTemplate.updateFirst(query, update, Receipt.class);
    }
}
