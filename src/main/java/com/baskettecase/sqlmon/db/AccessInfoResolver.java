package com.baskettecase.sqlmon.db;

import com.baskettecase.sqlmon.config.SqlMonitorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the {@link AccessInfo} of a database from the instance configuration.
 *
 * When no DSN is configured, missing host, database and driver fall back to
 * {@code 127.0.0.1,1433}, {@value #DEFAULT_DATABASE} and {@value #DEFAULT_DRIVER}.
 */
@Slf4j
@RequiredArgsConstructor
public class AccessInfoResolver {

    public static final String DEFAULT_DATABASE = "master";
    public static final String DEFAULT_DRIVER = "SQL Server";
    public static final String DEFAULT_HOST = "127.0.0.1," + HostPortResolver.DEFAULT_PORT;

    private final SqlMonitorProperties.Instance instance;

    /**
     * @param dbKey  configuration entry naming the database, may be null
     * @param dbName explicit database, takes precedence over {@code dbKey}
     */
    public AccessInfo resolve(DatabaseKey dbKey, String dbName) {
        String dsn = instance.getDsn();
        String username = instance.getUsername();
        String password = instance.getPassword();
        String database = dbName != null ? dbName : (dbKey == null ? null : dbKey.lookup(instance));
        String driver = instance.getDriver();
        String host = getHostWithPort();

        if (isBlank(dsn)) {
            if (isBlank(host)) {
                log.debug("No host provided, falling back to defaults: host=127.0.0.1, port=1433");
                host = DEFAULT_HOST;
            }
            if (isBlank(database)) {
                log.debug("No database provided, falling back to default: {}", DEFAULT_DATABASE);
                database = DEFAULT_DATABASE;
            }
            if (isBlank(driver)) {
                log.debug("No driver provided, falling back to default: {}", DEFAULT_DRIVER);
                driver = DEFAULT_DRIVER;
            }
        }
        return new AccessInfo(dsn, host, username, password, database, driver);
    }

    /**
     * Configured host as {@code host,port}, or null when no host is configured
     */
    public String getHostWithPort() {
        return HostPortResolver.resolveHostWithPort(instance.getHost(), instance.getPort());
    }

    static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}
