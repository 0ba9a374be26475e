package com.freeeemulator.storage;

/**
 * Thrown when code references a collection that was never declared.
 * This is a programming error, not a per-request condition.
 */
public class UndeclaredCollectionException extends IllegalStateException {

    public UndeclaredCollectionException(String collection) {
        super("Collection is not declared: " + collection);
    }
}
