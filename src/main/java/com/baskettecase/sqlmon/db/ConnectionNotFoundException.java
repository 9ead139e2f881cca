package com.baskettecase.sqlmon.db;

/**
 * No connection is cached for the requested database. Carries the host only.
 */
public class ConnectionNotFoundException extends SqlServerConnectionException {

    private static final String CONNECTION_DOES_NOT_EXIST = "08003";

    public ConnectionNotFoundException(String host) {
        super("Cannot find an opened connection for host: " + host, CONNECTION_DOES_NOT_EXIST);
    }
}
