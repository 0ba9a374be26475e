package com.freeeemulator.storage;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for collection sequences.
 */
@Repository
public interface CollectionSequenceRepository extends JpaRepository<CollectionSequence, String> {

    /**
     * Load a sequence row holding a write lock until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from CollectionSequence s where s.name = :name")
    Optional<CollectionSequence> findForUpdate(@Param("name") String name);
}
