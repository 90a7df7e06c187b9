package com.indexedpq.core;

import java.util.NoSuchElementException;

/**
 * Thrown when an operation needs a key the queue does not hold.
 */
public class KeyNotFoundException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    private final transient Object key;

    public KeyNotFoundException(Object key) {
        super("Key not found: " + key);
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
