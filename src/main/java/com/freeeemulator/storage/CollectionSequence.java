package com.freeeemulator.storage;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Declared collection together with the last integer key issued for it.
 *
 * Keys are never reused: deleting a record does not move the sequence back.
 */
@Entity
@Table(name = "collection_sequences")
@Data
@NoArgsConstructor
public class CollectionSequence {

    @Id
    @Column(name = "collection_name", length = 64)
    private String name;

    @Column(name = "last_id", nullable = false)
    private long lastId;

    public CollectionSequence(String name) {
        this.name = name;
        this.lastId = 0L;
    }

    public long advance() {
        this.lastId = lastId + 1;
        return lastId;
    }
}
