package com.freeeemulator.storage;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite key of a string-keyed entry: collection name plus opaque string key.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StoredEntryKey implements Serializable {

    @Column(name = "collection_name", nullable = false, length = 64)
    private String collection;

    @Column(name = "entry_key", nullable = false, length = 255)
    private String entryKey;
}
