package com.freeeemulator.storage;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A JSON-serialized value stored under an integer key in a named collection.
 */
@Entity
@Table(name = "stored_records")
@Data
@NoArgsConstructor
public class StoredRecord {

    @EmbeddedId
    private StoredRecordKey id;

    /**
     * JSON document of the stored value.
     */
    @Lob
    @Column(name = "payload", nullable = false)
    private String payload;

    @Column(name = "written_at")
    private Instant writtenAt;

    public StoredRecord(StoredRecordKey id) {
        this.id = id;
    }
}
