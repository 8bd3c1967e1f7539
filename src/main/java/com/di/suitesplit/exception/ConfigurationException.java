package com.di.suitesplit.exception;

/**
 * Thrown when a split configuration violates its contract (non-positive caps or target time).
 *
 * <p>Caught by {@link GlobalExceptionHandler} and returned as a 400 Bad Request.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
