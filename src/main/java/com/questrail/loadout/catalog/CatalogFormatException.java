package com.questrail.loadout.catalog;

/**
 * Indicates that a catalog document is well-formed JSON but does not describe
 * a valid node list (missing id, unknown section, duplicate ids, ...).
 */
public final class CatalogFormatException extends RuntimeException
{
    public CatalogFormatException(String message) {
        super(message);
    }

    public CatalogFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
