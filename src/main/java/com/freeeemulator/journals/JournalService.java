package com.freeeemulator.journals;

import com.freeeemulator.accountitems.AccountItemCatalog;
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
import java.util.stream.Collectors;

/**
 * Service for journal entries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalService {

    private final StorageEngine storage;
    private final AccountItemCatalog accountItemCatalog;
    private final Clock clock;

    @Transactional
    public Journal createJournal(Journal draft) {
        Instant now = clock.instant();

        List<JournalDetail> details = draft.getDetails().stream()
            .map(line -> JournalDetail.builder()
                .id(storage.nextId(StorageCollections.JOURNAL_DETAILS))
                .entryType(line.getEntryType())
                .accountItemId(line.getAccountItemId())
                .accountItemName(accountItemName(line.getAccountItemId()))
                .taxCode(line.getTaxCode())
                .partnerId(line.getPartnerId())
                .amount(line.getAmount())
                .vat(line.getVat())
                .description(line.getDescription())
                .build())
            .collect(Collectors.toList());

        Journal journal = storage.insert(StorageCollections.JOURNALS, id -> Journal.builder()
            .id(id)
            .companyId(draft.getCompanyId())
            .issueDate(draft.getIssueDate())
            .details(details)
            .createdAt(now)
            .updatedAt(now)
            .build());

        if (!journal.isBalanced()) {
            log.warn("Journal {} is unbalanced: debit {} credit {}",
                journal.getId(), journal.totalOf(EntryType.DEBIT), journal.totalOf(EntryType.CREDIT));
        }
        log.info("Created journal {} for company {} with {} lines",
            journal.getId(), journal.getCompanyId(), details.size());
        return journal;
    }

    @Transactional(readOnly = true)
    public Journal getJournal(long id) {
        return storage.find(StorageCollections.JOURNALS, id, Journal.class)
            .orElseThrow(() -> new RecordNotFoundException("Journal", id));
    }

    @Transactional(readOnly = true)
    public List<Journal> listJournals(Long companyId) {
        return storage.scan(StorageCollections.JOURNALS, Journal.class, journal ->
            companyId == null || journal.getCompanyId() == companyId);
    }

    private String accountItemName(long accountItemId) {
        String name = accountItemCatalog.nameOf(accountItemId);
        return name != null ? name : "Account Item " + accountItemId;
    }
}
