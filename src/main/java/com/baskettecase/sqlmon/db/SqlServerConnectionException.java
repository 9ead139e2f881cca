package com.baskettecase.sqlmon.db;

import java.sql.SQLException;

/**
 * Connection failure towards a SQL Server instance.
 *
 * The message is always the masked diagnostic; the driver exception is not
 * attached as cause so that its text cannot leak credentials.
 */
public class SqlServerConnectionException extends SQLException {

    private static final String UNABLE_TO_CONNECT = "08001";

    public SqlServerConnectionException(String message) {
        this(message, UNABLE_TO_CONNECT);
    }

    protected SqlServerConnectionException(String message, String sqlState) {
        super(message, sqlState);
    }
}
