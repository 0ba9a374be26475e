package com.freeeemulator.storage;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite key of a stored record: collection name plus integer key.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StoredRecordKey implements Serializable {

    @Column(name = "collection_name", nullable = false, length = 64)
    private String collection;

    @Column(name = "record_key", nullable = false)
    private long recordKey;
}
