package com.indexedpq.core;

/**
 * Thrown when an operation needs a key to be absent but the queue already
 * holds it, including duplicate keys in bulk construction input.
 */
public class KeyAlreadyExistsException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final transient Object key;

    public KeyAlreadyExistsException(Object key) {
        super(key + " is already in the queue");
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
