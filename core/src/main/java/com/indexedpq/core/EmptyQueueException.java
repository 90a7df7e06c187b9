package com.indexedpq.core;

import java.util.NoSuchElementException;

public class EmptyQueueException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    public EmptyQueueException() {
        super("Queue is empty");
    }
}
