package com.freeeemulator.storage;

import com.freeeemulator.common.exception.RecordNotFoundException;
import com.freeeemulator.journals.Journal;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the embedded store.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class StorageEngineTest {

    @Autowired
    private StorageEngine storage;

    @Test
    void testNextId_StrictlyIncreasingAcrossDeletes() {
        long first = storage.nextId(StorageCollections.JOURNALS);
        storage.put(StorageCollections.JOURNALS, first, journal(first, 7001));

        long second = storage.nextId(StorageCollections.JOURNALS);
        storage.put(StorageCollections.JOURNALS, second, journal(second, 7001));

        storage.delete(StorageCollections.JOURNALS, second);
        long third = storage.nextId(StorageCollections.JOURNALS);

        assertTrue(second > first);
        assertTrue(third > second, "Deleted keys must never be reissued");
    }

    @Test
    void testNextId_IndependentPerCollection() {
        long journalId = storage.nextId(StorageCollections.JOURNALS);
        long receiptId = storage.nextId(StorageCollections.RECEIPTS);
        long nextJournalId = storage.nextId(StorageCollections.JOURNALS);

        assertEquals(journalId + 1, nextJournalId);
        assertTrue(receiptId >= 1);
    }

    @Test
    void testInsertThenGet() {
        Journal stored = storage.insert(StorageCollections.JOURNALS, id -> journal(id, 7002));

        Journal loaded = storage.get(StorageCollections.JOURNALS, stored.getId(), Journal.class);

        assertEquals(stored.getId(), loaded.getId());
        assertEquals(7002, loaded.getCompanyId());
        assertEquals(LocalDate.of(2024, 11, 20), loaded.getIssueDate());
    }

    @Test
    void testGet_MissingKeyThrows() {
        assertThrows(RecordNotFoundException.class,
            () -> storage.get(StorageCollections.JOURNALS, Long.MAX_VALUE, Journal.class));
        assertTrue(storage.find(StorageCollections.JOURNALS, Long.MAX_VALUE, Journal.class).isEmpty());
    }

    @Test
    void testDelete_MissingKeyThrows() {
        assertThrows(RecordNotFoundException.class,
            () -> storage.delete(StorageCollections.JOURNALS, Long.MAX_VALUE));
    }

    @Test
    void testPut_OverwritesExistingRecord() {
        Journal stored = storage.insert(StorageCollections.JOURNALS, id -> journal(id, 7003));
        stored.setIssueDate(LocalDate.of(2025, 1, 1));

        storage.put(StorageCollections.JOURNALS, stored.getId(), stored);

        assertEquals(LocalDate.of(2025, 1, 1),
            storage.get(StorageCollections.JOURNALS, stored.getId(), Journal.class).getIssueDate());
    }

    @Test
    void testScan_FiltersAndOrdersByKey() {
        Journal a = storage.insert(StorageCollections.JOURNALS, id -> journal(id, 7004));
        storage.insert(StorageCollections.JOURNALS, id -> journal(id, 7005));
        Journal c = storage.insert(StorageCollections.JOURNALS, id -> journal(id, 7004));

        List<Journal> result = storage.scan(StorageCollections.JOURNALS, Journal.class,
            journal -> journal.getCompanyId() == 7004);

        assertEquals(2, result.size());
        assertEquals(a.getId(), result.get(0).getId());
        assertEquals(c.getId(), result.get(1).getId());
    }

    @Test
    void testGetForUpdate_ReturnsCurrentValue() {
        Journal stored = storage.insert(StorageCollections.JOURNALS, id -> journal(id, 7006));

        Optional<Journal> locked = storage.getForUpdate(StorageCollections.JOURNALS, stored.getId(), Journal.class);

        assertTrue(locked.isPresent());
        assertEquals(7006, locked.get().getCompanyId());
        assertTrue(storage.getForUpdate(StorageCollections.JOURNALS, Long.MAX_VALUE, Journal.class).isEmpty());
    }

    @Test
    void testGetForUpdate_SeesWriteOfSameTransaction() {
        Journal stored = storage.insert(StorageCollections.JOURNALS, id -> journal(id, 7007));
        stored.setIssueDate(LocalDate.of(2025, 1, 31));
        storage.put(StorageCollections.JOURNALS, stored.getId(), stored);

        Journal locked = storage.getForUpdate(StorageCollections.JOURNALS, stored.getId(), Journal.class)
            .orElseThrow();

        assertEquals(LocalDate.of(2025, 1, 31), locked.getIssueDate());
        assertEquals(stored.getId(), storage.get(StorageCollections.JOURNALS, stored.getId(), Journal.class).getId());
    }

    @Test
    void testStringKeys() {
        storage.putString(StorageCollections.ACCESS_TOKENS, "token-a", "42");

        assertEquals(Optional.of("42"), storage.getString(StorageCollections.ACCESS_TOKENS, "token-a"));
        assertTrue(storage.getString(StorageCollections.REFRESH_TOKENS, "token-a").isEmpty());

        storage.deleteString(StorageCollections.ACCESS_TOKENS, "token-a");
        storage.deleteString(StorageCollections.ACCESS_TOKENS, "token-a");

        assertTrue(storage.getString(StorageCollections.ACCESS_TOKENS, "token-a").isEmpty());
    }

    @Test
    void testUndeclaredCollectionRejected() {
        assertThrows(UndeclaredCollectionException.class, () -> storage.nextId("partners"));
        assertThrows(UndeclaredCollectionException.class, () -> storage.getString("partners", "x"));
    }

    private static Journal journal(long id, long companyId) {
        return Journal.builder()
            .id(id)
            .companyId(companyId)
            .issueDate(LocalDate.of(2024, 11, 20))
            .details(List.of())
            .build();
    }
}
