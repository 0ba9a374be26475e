package com.freeeemulator.storage;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A string value stored under an opaque string key (tokens, login sessions).
 */
@Entity
@Table(name = "stored_entries")
@Data
@NoArgsConstructor
public class StoredEntry {

    @EmbeddedId
    private StoredEntryKey id;

    @Column(name = "entry_value", nullable = false, length = 4000)
    private String value;

    @Column(name = "written_at")
    private Instant writtenAt;

    public StoredEntry(StoredEntryKey id) {
        this.id = id;
    }
}
