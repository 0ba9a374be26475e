package com.freeeemulator.storage;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for string-keyed entries.
 */
@Repository
public interface StoredEntryRepository extends JpaRepository<StoredEntry, StoredEntryKey> {
}
