package com.catalog.reclassification.catalog;

import com.catalog.reclassification.core.ReclassificationException;

/**
 * Runtime exception thrown when a catalog table cannot be interpreted:
 * required columns missing after header-alias resolution, or a required cell left blank.
 */
public class CatalogFormatException extends ReclassificationException {

    public CatalogFormatException(String message) {
        super(message);
    }

    public CatalogFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
