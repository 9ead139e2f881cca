package com.baskettecase.sqlmon.db;

/**
 * Cache key of a live connection. Two identities are equal iff all seven components are.
 *
 * Holds the password in clear text, so it must never be logged or put into a message.
 */
public record ConnectionIdentity(
    String keyPrefix,
    String dsn,
    String host,
    String username,
    String password,
    String database,
    String driver
) {
    public static ConnectionIdentity of(String keyPrefix, AccessInfo info) {
        return new ConnectionIdentity(
            keyPrefix == null ? "" : keyPrefix,
            info.dsn(),
            info.host(),
            info.username(),
            info.password(),
            info.database(),
            info.driver());
    }

    @Override
    public String toString() {
        return "ConnectionIdentity(keyPrefix=" + keyPrefix + ", host=" + host + ", database=" + database + ")";
    }
}
