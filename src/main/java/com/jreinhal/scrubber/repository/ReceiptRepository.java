package com.jreinhal.scrubber.repository;

import com.jreinhal.scrubber.exception.ReceiptConflictException;
import com.jreinhal.scrubber.model.Receipt;
import java.util.Optional;

/**
 * Durable, write-once receipt storage keyed by operation id.
 */
public interface ReceiptRepository {

    /**
     * @throws ReceiptConflictException if a receipt already exists for the operation
     */
    void insert(Receipt receipt);

    Optional<Receipt> findById(String operationId);

    /**
     * Marks a receipt as never redeemable. The only permitted change after insert.
     */
    void markInvalid(String operationId, String reason);
}
