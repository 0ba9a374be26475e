package com.freeeemulator.wallettxns;

import com.freeeemulator.common.exception.RecordNotFoundException;
import com.freeeemulator.storage.StorageCollections;
import com.freeeemulator.storage.StorageEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Service for wallet transaction records.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletTxnService {

    private static final String ENTITY_NAME = "Wallet transaction";

    private final StorageEngine storage;
    private final Clock clock;

    /**
     * Store a new transaction. The id, status and timestamps of the draft are ignored.
     */
    @Transactional
    public WalletTxn createWalletTxn(WalletTxn draft) {
        Instant now = clock.instant();

        WalletTxn created = storage.insert(StorageCollections.WALLET_TXNS, id -> WalletTxn.builder()
            .id(id)
            .companyId(draft.getCompanyId())
            .date(draft.getDate())
            .amount(draft.getAmount())
            .entrySide(draft.getEntrySide() != null
                ? draft.getEntrySide()
                : EntrySide.ofAmount(draft.getAmount()))
            .walletableType(draft.getWalletableType())
            .walletableId(draft.getWalletableId())
            .description(draft.getDescription())
            .status(WalletTxnStatus.UNBOOKED)
            .createdAt(now)
            .updatedAt(now)
            .build());

        log.info("Created wallet transaction {} for company {}: {} {} on {}",
            created.getId(), created.getCompanyId(), created.getWalletableType().getCode(),
            created.getAmount(), created.getDate());
        return created;
    }

    @Transactional(readOnly = true)
    public WalletTxn getWalletTxn(long id) {
        return storage.find(StorageCollections.WALLET_TXNS, id, WalletTxn.class)
            .orElseThrow(() -> new RecordNotFoundException(ENTITY_NAME, id));
    }

    /**
     * @param companyId null for every company
     * @param status null for every status
     */
    @Transactional(readOnly = true)
    public List<WalletTxn> listWalletTxns(Long companyId, WalletTxnStatus status) {
        return storage.scan(StorageCollections.WALLET_TXNS, WalletTxn.class, txn ->
            (companyId == null || txn.getCompanyId() == companyId)
                && (status == null || txn.getStatus() == status));
    }

    @Transactional
    public WalletTxn updateWalletTxn(long id, WalletTxnUpdate update) {
        WalletTxn txn = storage.getForUpdate(StorageCollections.WALLET_TXNS, id, WalletTxn.class)
            .orElseThrow(() -> new RecordNotFoundException(ENTITY_NAME, id));

        Instant now = clock.instant();
        if (update.getStatus() != null) {
            txn.changeStatus(update.getStatus(), now);
        }
        if (update.getDealId() != null) {
            txn.setDealId(update.getDealId());
        }
        if (update.getDescription() != null) {
            txn.setDescription(update.getDescription());
        }
        txn.setUpdatedAt(now);

        storage.put(StorageCollections.WALLET_TXNS, id, txn);
        log.info("Updated wallet transaction {}, status {}", id, txn.getStatus().getCode());
        return txn;
    }

    @Transactional
    public void deleteWalletTxn(long id) {
        if (storage.find(StorageCollections.WALLET_TXNS, id, WalletTxn.class).isEmpty()) {
            throw new RecordNotFoundException(ENTITY_NAME, id);
        }
        storage.delete(StorageCollections.WALLET_TXNS, id);
        log.info("Deleted wallet transaction {}", id);
    }
}
