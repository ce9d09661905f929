package com.catalog.reclassification.core;

/**
 * Base runtime exception for reclassification failures.
 */
public class ReclassificationException extends RuntimeException {

    public ReclassificationException(String message) {
        super(message);
    }

    public ReclassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
