package com.baskettecase.sqlmon.db;

/**
 * Resolved connection parameters for one database of the monitored instance.
 * Without a DSN, {@code host}, {@code database} and {@code driver} are always set;
 * with a DSN every field may be null and the DSN supplies what is missing.
 */
public record AccessInfo(
    String dsn,
    String host,
    String username,
    String password,
    String database,
    String driver
) {
    @Override
    public String toString() {
        return "AccessInfo(dsn=" + dsn + ", host=" + host + ", username=" + username
            + ", password=" + (password == null ? null : "******")
            + ", database=" + database + ", driver=" + driver + ")";
    }
}
