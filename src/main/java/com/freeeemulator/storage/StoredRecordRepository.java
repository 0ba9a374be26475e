package com.freeeemulator.storage;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for integer-keyed records.
 */
@Repository
public interface StoredRecordRepository extends JpaRepository<StoredRecord, StoredRecordKey> {

    @Query("select r from StoredRecord r where r.id.collection = :collection order by r.id.recordKey asc")
    List<StoredRecord> findAllInCollection(@Param("collection") String collection);

    /**
     * Load a record holding a write lock until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from StoredRecord r where r.id = :id")
    Optional<StoredRecord> findForUpdate(@Param("id") StoredRecordKey id);
}
