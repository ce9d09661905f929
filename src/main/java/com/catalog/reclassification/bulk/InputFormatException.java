package com.catalog.reclassification.bulk;

import com.catalog.reclassification.core.ReclassificationException;

/**
 * Runtime exception thrown when an input table lacks a required column after
 * header-alias resolution.
 */
public class InputFormatException extends ReclassificationException {

    public InputFormatException(String message) {
        super(message);
    }

    public InputFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
