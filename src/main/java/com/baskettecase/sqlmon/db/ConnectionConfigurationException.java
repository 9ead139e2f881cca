package com.baskettecase.sqlmon.db;

/**
 * Raised for malformed connection strings and for options configured more than
 * once or for the wrong connector. Never retried.
 */
public class ConnectionConfigurationException extends RuntimeException {

    public ConnectionConfigurationException(String message) {
        super(message);
    }
}
