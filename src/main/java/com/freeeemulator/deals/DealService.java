package com.freeeemulator.deals;

import com.freeeemulator.accountitems.AccountItemCatalog;
import com.freeeemulator.common.exception.RecordNotFoundException;
import com.freeeemulator.settlement.SettlementResult;
import com.freeeemulator.settlement.SettlementService;
import com.freeeemulator.storage.StorageCollections;
import com.freeeemulator.storage.StorageEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Service for deals.
 *
 * Creation flow:
 * 1. Number the detail and payment lines and compute VAT
 * 2. Store the deal under a new id
 * 3. Settle matching unbooked wallet transactions
 *
 * All three steps commit or roll back together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DealService {

    private static final String ENTITY_NAME = "Deal";

    private final StorageEngine storage;
    private final AccountItemCatalog accountItemCatalog;
    private final SettlementService settlementService;
    private final Clock clock;

    /**
     * Store a new deal built from the draft's header, detail and payment lines.
     * Ids, VAT, amounts and timestamps of the draft are ignored.
     */
    @Transactional
    public Deal createDeal(Deal draft) {
        Instant now = clock.instant();

        List<DealDetail> details = numberDetails(draft.getDetails());
        List<DealPayment> payments = numberPayments(draft.getPayments());

        Deal deal = storage.insert(StorageCollections.DEALS, id -> Deal.builder()
            .id(id)
            .companyId(draft.getCompanyId())
            .issueDate(draft.getIssueDate())
            .dueDate(draft.getDueDate())
            .type(draft.getType())
            .details(details)
            .payments(payments)
            .amount(totalOf(details))
            .refNumber(draft.getRefNumber())
            .partnerId(draft.getPartnerId())
            .createdAt(now)
            .updatedAt(now)
            .build());

        log.info("Created {} deal {} for company {} amount {}",
            deal.getType().getCode(), deal.getId(), deal.getCompanyId(), deal.getAmount());

        SettlementResult settlement = settlementService.settle(deal);
        if (!settlement.getSettledWalletTxnIds().isEmpty()) {
            log.info("Deal {} settled wallet transactions {}", deal.getId(), settlement.getSettledWalletTxnIds());
        }

        return deal;
    }

    @Transactional(readOnly = true)
    public Deal getDeal(long id) {
        return storage.find(StorageCollections.DEALS, id, Deal.class)
            .orElseThrow(() -> new RecordNotFoundException(ENTITY_NAME, id));
    }

    /**
     * @param companyId null for every company
     */
    @Transactional(readOnly = true)
    public List<Deal> listDeals(Long companyId) {
        return storage.scan(StorageCollections.DEALS, Deal.class, deal ->
            companyId == null || deal.getCompanyId() == companyId);
    }

    @Transactional
    public Deal updateDeal(long id, DealUpdate update) {
        Deal deal = storage.getForUpdate(StorageCollections.DEALS, id, Deal.class)
            .orElseThrow(() -> new RecordNotFoundException(ENTITY_NAME, id));

        if (update.getIssueDate() != null) {
            deal.setIssueDate(update.getIssueDate());
        }
        if (update.getDueDate() != null) {
            deal.setDueDate(update.getDueDate());
        }
        if (update.getRefNumber() != null) {
            deal.setRefNumber(update.getRefNumber());
        }
        if (update.getPartnerId() != null) {
            deal.setPartnerId(update.getPartnerId());
        }
        if (update.getDetails() != null && !update.getDetails().isEmpty()) {
            List<DealDetail> details = numberDetails(update.getDetails());
            deal.setDetails(details);
            deal.setAmount(totalOf(details));
        }
        deal.setUpdatedAt(clock.instant());

        storage.put(StorageCollections.DEALS, id, deal);
        log.info("Updated deal {}", id);
        return deal;
    }

    /**
     * Remove a deal. Wallet transactions it settled stay settled.
     */
    @Transactional
    public void deleteDeal(long id) {
        if (storage.find(StorageCollections.DEALS, id, Deal.class).isEmpty()) {
            throw new RecordNotFoundException(ENTITY_NAME, id);
        }
        storage.delete(StorageCollections.DEALS, id);
        log.info("Deleted deal {}", id);
    }

    private List<DealDetail> numberDetails(List<DealDetail> lines) {
        return lines.stream()
            .map(line -> DealDetail.builder()
                .id(storage.nextId(StorageCollections.DEAL_DETAILS))
                .accountItemId(line.getAccountItemId())
                .accountItemName(accountItemName(line.getAccountItemId()))
                .taxCode(line.getTaxCode())
                .amount(line.getAmount())
                .vat(TaxCalculator.vatOf(line.getTaxCode(), line.getAmount()))
                .description(line.getDescription())
                .build())
            .collect(Collectors.toList());
    }

    private List<DealPayment> numberPayments(List<DealPayment> lines) {
        if (lines == null || lines.isEmpty()) {
            return null;
        }
        return lines.stream()
            .map(line -> DealPayment.builder()
                .id(storage.nextId(StorageCollections.DEAL_PAYMENTS))
                .date(line.getDate())
                .amount(line.getAmount())
                .fromWalletableType(line.getFromWalletableType())
                .fromWalletableId(line.getFromWalletableId())
                .build())
            .collect(Collectors.toList());
    }

    private String accountItemName(long accountItemId) {
        String name = accountItemCatalog.nameOf(accountItemId);
        return name != null ? name : "Account Item " + accountItemId;
    }

    private static long totalOf(List<DealDetail> details) {
        return details.stream()
            .mapToLong(detail -> detail.getAmount() + detail.getVat())
            .sum();
    }
}
