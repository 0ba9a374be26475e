package com.freeeemulator.receipts;

import com.freeeemulator.common.exception.RecordNotFoundException;
import com.freeeemulator.common.exception.StorageException;
import com.freeeemulator.storage.StorageCollections;
import com.freeeemulator.storage.StorageEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Service for uploaded receipts.
 *
 * Upload flow:
 * 1. Write the file under a temporary name
 * 2. Store the receipt record with its final path {@code <id>.pdf}
 * 3. After the record commits, rename the temporary file to that path
 *
 * If the transaction rolls back the temporary file is removed and no
 * {@code <id>.pdf} is ever written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReceiptService {

    private static final String ENTITY_NAME = "Receipt";

    private final StorageEngine storage;
    private final ReceiptFileStore fileStore;
    private final Clock clock;

    @Transactional
    public Receipt createReceipt(long companyId, LocalDate issueDate, String description,
                                 String fileName, InputStream content) {
        Path temporary = fileStore.saveTemporary(companyId, fileName, content);

        Receipt receipt;
        try {
            Instant now = clock.instant();
            receipt = storage.insert(StorageCollections.RECEIPTS, id -> Receipt.builder()
                .id(id)
                .companyId(companyId)
                .issueDate(issueDate)
                .description(description)
                .status(ReceiptStatus.UNCONFIRMED)
                .fileName(fileName)
                .filePath(fileStore.pathFor(companyId, id).toString())
                .createdAt(now)
                .updatedAt(now)
                .build());
        } catch (RuntimeException e) {
            fileStore.discard(temporary);
            throw e;
        }

        TransactionSynchronizationManager.registerSynchronization(
            new PromoteOnCommit(temporary, companyId, receipt.getId()));

        log.info("Stored receipt {} for company {}", receipt.getId(), companyId);
        return receipt;
    }

    @Transactional(readOnly = true)
    public Receipt getReceipt(long id) {
        return storage.find(StorageCollections.RECEIPTS, id, Receipt.class)
            .orElseThrow(() -> new RecordNotFoundException(ENTITY_NAME, id));
    }

    @Transactional(readOnly = true)
    public List<Receipt> listReceipts(Long companyId) {
        return storage.scan(StorageCollections.RECEIPTS, Receipt.class, receipt ->
            companyId == null || receipt.getCompanyId() == companyId);
    }

    /**
     * Remove the record, then try to remove its file. A file that cannot be
     * removed is logged and left behind.
     */
    @Transactional
    public void deleteReceipt(long id) {
        Receipt receipt = getReceipt(id);
        storage.delete(StorageCollections.RECEIPTS, id);

        if (receipt.getFilePath() != null && !fileStore.discard(Paths.get(receipt.getFilePath()))) {
            log.warn("Receipt {} deleted but its file remains at {}", id, receipt.getFilePath());
        }
        log.info("Deleted receipt {}", id);
    }

    /**
     * Moves the uploaded file into place once the receipt record is committed.
     */
    private class PromoteOnCommit implements TransactionSynchronization {

        private final Path temporary;
        private final long companyId;
        private final long receiptId;

        PromoteOnCommit(Path temporary, long companyId, long receiptId) {
            this.temporary = temporary;
            this.companyId = companyId;
            this.receiptId = receiptId;
        }

        @Override
        public void afterCommit() {
            try {
                Path stored = fileStore.promote(temporary, companyId, receiptId);
                log.debug("Moved receipt {} file to {}", receiptId, stored);
            } catch (StorageException e) {
                log.error("Receipt {} committed but its file could not be moved into place", receiptId, e);
                fileStore.discard(temporary);
                throw e;
            }
        }

        @Override
        public void afterCompletion(int status) {
            if (status != STATUS_COMMITTED) {
                fileStore.discard(temporary);
                log.info("Discarded upload for receipt {} after rollback", receiptId);
            }
        }
    }
}
