package com.baskettecase.sqlmon.db;

/**
 * Options handed to a {@link DriverConnector} on connect.
 *
 * @param timeoutSeconds login and command timeout
 * @param autocommit     true disables implicit transactions
 */
public record ConnectOptions(int timeoutSeconds, boolean autocommit) {
}
