package com.di.suitesplit.catalog;

/**
 * Thrown by a {@link DurationCatalog} when historical data cannot be retrieved at all.
 * The partitioner catches it and degrades to the round-robin split.
 */
public class DurationCatalogUnavailableException extends RuntimeException {

    public DurationCatalogUnavailableException(String message) {
        super(message);
    }

    public DurationCatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
