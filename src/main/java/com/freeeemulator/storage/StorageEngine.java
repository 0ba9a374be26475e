package com.freeeemulator.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.freeeemulator.common.exception.RecordNotFoundException;
import com.freeeemulator.common.exception.StorageException;
import jakarta.annotation.PostConstruct;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongFunction;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Embedded key-value store with named collections.
 *
 * Values are stored as JSON documents in a single-file H2 database. Each
 * collection has its own monotonically increasing integer key sequence and
 * a string-keyed sibling keyspace for opaque keys such as tokens.
 *
 * All operations are transactional: they join the caller's transaction when
 * one is active, so a service can group id allocation, reads and writes into
 * one atomic unit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StorageEngine {

    private final StoredRecordRepository recordRepository;
    private final StoredEntryRepository entryRepository;
    private final CollectionSequenceRepository sequenceRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @PersistenceContext
    private EntityManager entityManager;

    private final Set<String> declaredCollections = ConcurrentHashMap.newKeySet();

    /**
     * Declare every application collection, creating its sequence if absent.
     * Fails application startup when the database cannot be reached.
     */
    @PostConstruct
    public void open() {
        for (String collection : StorageCollections.ALL) {
            declare(collection);
        }
        log.info("Storage engine opened with {} collections", declaredCollections.size());
    }

    /**
     * Declare a collection (idempotent).
     */
    public void declare(String collection) {
        if (!sequenceRepository.existsById(collection)) {
            sequenceRepository.save(new CollectionSequence(collection));
            log.debug("Created collection {}", collection);
        }
        declaredCollections.add(collection);
    }

    /**
     * Allocate the next integer key of a collection.
     * Concurrent callers serialize on the sequence row and never receive the same key.
     */
    @Transactional
    public long nextId(String collection) {
        requireDeclared(collection);

        CollectionSequence sequence = sequenceRepository.findForUpdate(collection)
            .orElseThrow(() -> new UndeclaredCollectionException(collection));

        long id = sequence.advance();
        sequenceRepository.save(sequence);
        return id;
    }

    /**
     * Allocate a key and store the value built for it, in one transaction.
     */
    @Transactional
    public <T> T insert(String collection, LongFunction<T> factory) {
        long id = nextId(collection);
        T value = factory.apply(id);
        put(collection, id, value);
        return value;
    }

    @Transactional
    public void put(String collection, long key, Object value) {
        requireDeclared(collection);

        StoredRecordKey id = new StoredRecordKey(collection, key);
        StoredRecord record = recordRepository.findById(id)
            .orElseGet(() -> new StoredRecord(id));

        record.setPayload(write(value));
        record.setWrittenAt(clock.instant());
        recordRepository.save(record);
    }

    @Transactional(readOnly = true)
    public <T> Optional<T> find(String collection, long key, Class<T> type) {
        requireDeclared(collection);

        return recordRepository.findById(new StoredRecordKey(collection, key))
            .map(record -> read(record.getPayload(), type));
    }

    @Transactional(readOnly = true)
    public <T> T get(String collection, long key, Class<T> type) {
        return find(collection, key, type)
            .orElseThrow(() -> new RecordNotFoundException("Record in " + collection, key));
    }

    /**
     * Re-read a record from the database holding a write lock until the
     * surrounding transaction ends. Used for read-then-write sequences that
     * must not interleave with another writer of the same record.
     * Sees writes made earlier in the same transaction.
     */
    @Transactional
    public <T> Optional<T> getForUpdate(String collection, long key, Class<T> type) {
        requireDeclared(collection);

        Optional<StoredRecord> locked = recordRepository.findForUpdate(new StoredRecordKey(collection, key));
        if (locked.isEmpty()) {
            return Optional.empty();
        }

        // An instance loaded earlier in this transaction keeps its old state through the query
        StoredRecord record = locked.get();
        entityManager.refresh(record);
        return Optional.of(read(record.getPayload(), type));
    }

    @Transactional
    public void delete(String collection, long key) {
        requireDeclared(collection);

        StoredRecordKey id = new StoredRecordKey(collection, key);
        if (!recordRepository.existsById(id)) {
            throw new RecordNotFoundException("Record in " + collection, key);
        }
        recordRepository.deleteById(id);
    }

    /**
     * Return the values of a collection accepted by the filter, in key order.
     */
    @Transactional(readOnly = true)
    public <T> List<T> scan(String collection, Class<T> type, Predicate<? super T> filter) {
        requireDeclared(collection);

        return recordRepository.findAllInCollection(collection).stream()
            .map(record -> read(record.getPayload(), type))
            .filter(filter)
            .collect(Collectors.toList());
    }

    @Transactional
    public void putString(String collection, String key, String value) {
        requireDeclared(collection);

        StoredEntryKey id = new StoredEntryKey(collection, key);
        StoredEntry entry = entryRepository.findById(id)
            .orElseGet(() -> new StoredEntry(id));

        entry.setValue(value);
        entry.setWrittenAt(clock.instant());
        entryRepository.save(entry);
    }

    @Transactional(readOnly = true)
    public Optional<String> getString(String collection, String key) {
        requireDeclared(collection);

        return entryRepository.findById(new StoredEntryKey(collection, key))
            .map(StoredEntry::getValue);
    }

    /**
     * Remove a string-keyed entry. Removing an absent key is a no-op.
     */
    @Transactional
    public void deleteString(String collection, String key) {
        requireDeclared(collection);

        StoredEntryKey id = new StoredEntryKey(collection, key);
        if (entryRepository.existsById(id)) {
            entryRepository.deleteById(id);
        }
    }

    private void requireDeclared(String collection) {
        if (!declaredCollections.contains(collection)) {
            throw new UndeclaredCollectionException(collection);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
