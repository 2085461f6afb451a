package com.jreinhal.scrubber.service;

import com.jreinhal.scrubber.model.Receipt;
import com.jreinhal.scrubber.repository.ReceiptRepository;
import com.jreinhal.scrubber.util.LogSanitizer;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sole owner of receipt persistence and decryption.
 */
@Service
public class ReceiptStore {
    private static final Logger log = LoggerFactory.getLogger(ReceiptStore.class);

    private final ReceiptRepository repository;
    private final ReceiptCipher cipher;

    public ReceiptStore(ReceiptRepository repository, ReceiptCipher cipher) {
        this.repository = repository;
        this.cipher = cipher;
    }

    /**
     * @throws com.jreinhal.scrubber.exception.EncryptionUnavailableException when no receipt key is usable
     */
    public void requireEncryption() {
        this.cipher.requireAvailable();
    }

    public String seal(String operationId, String identifier, String originalValue) {
        return this.cipher.encrypt(originalValue, operationId, identifier);
    }

    public void save(Receipt receipt) {
        this.repository.insert(receipt);
        log.debug("Receipt stored for operation {} ({} entries)", receipt.getOperationId(), receipt.getEntries().size());
    }

    /**
     * Receipts marked invalid are reported as absent.
     */
    public Optional<Receipt> findRedeemable(String operationId) {
        return this.repository.findById(operationId).filter(Receipt::isRedeemable);
    }

    public String open(Receipt receipt, Receipt.Entry entry) {
        return this.cipher.decrypt(entry.ciphertext(), receipt.getOperationId(), entry.identifier());
    }

    public void invalidate(String operationId, String reason) {
        this.repository.markInvalid(operationId, reason);
        log.warn("Receipt for operation {} invalidated: {}", operationId, LogSanitizer.sanitize(reason));
    }
}
