package com.baskettecase.sqlmon.db;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Checks whether the configured database exists, honouring the collation of each
 * database: case-insensitive databases match by lowercased name, case-sensitive
 * ones only by exact name.
 *
 * The list of databases is read once and kept until {@link #invalidate()}.
 */
@Slf4j
@RequiredArgsConstructor
public class DatabaseExistenceChecker {

    static final String DATABASE_EXISTS_QUERY = "select name, collation_name from sys.databases;";
    static final String CASE_INSENSITIVE_MARKER = "CI";

    private final ConnectionCacheManager connectionManager;

    private Map<String, ExistingDatabase> existingDatabases;

    record ExistingDatabase(boolean caseInsensitive, String name) {
    }

    /**
     * Check the configured database over a managed connection to {@code master}.
     *
     * @throws SqlServerConnectionException when {@code master} cannot be reached
     */
    public DatabaseCheckResult checkDatabase() throws SQLException {
        try (ConnectionCacheManager.ManagedConnection ignored = connectionManager.openManagedDefaultDatabase()) {
            return checkDbExists();
        }
    }

    /**
     * Check the configured database against the cached index, building it over the
     * already open {@code master} connection when needed. A failing catalog query
     * counts as "does not exist".
     */
    public synchronized DatabaseCheckResult checkDbExists() throws SQLException {
        AccessInfo info = connectionManager.getAccessInfo(DatabaseKey.DATABASE, null);
        String database = info.database();
        String context = info.host() + " - " + database;
        if (database == null) {
            // a DSN without a configured database names no database to look up
            log.warn("No database configured to check for {}", context);
            return new DatabaseCheckResult(false, context);
        }

        if (existingDatabases == null) {
            Statement cursor = connectionManager.getCursor(null, AccessInfoResolver.DEFAULT_DATABASE, null);
            try {
                existingDatabases = loadExistingDatabases(cursor);
            } catch (SQLException | RuntimeException e) {
                log.error("Failed to check if database {} exists: {}", database, e.toString());
                return new DatabaseCheckResult(false, context);
            } finally {
                connectionManager.closeCursor(cursor);
            }
        }

        ExistingDatabase existing = existingDatabases.get(database.toLowerCase(Locale.ROOT));
        boolean exists = existing != null && (existing.caseInsensitive() || database.equals(existing.name()));
        return new DatabaseCheckResult(exists, context);
    }

    /**
     * Forget the database index, the next check reads the catalog again
     */
    public synchronized void invalidate() {
        existingDatabases = null;
    }

    private static Map<String, ExistingDatabase> loadExistingDatabases(Statement cursor) throws SQLException {
        Map<String, ExistingDatabase> databases = new HashMap<>();
        try (ResultSet rs = cursor.executeQuery(DATABASE_EXISTS_QUERY)) {
            while (rs.next()) {
                String name = rs.getString("name");
                String collation = rs.getString("collation_name");
                // collation_name is NULL while a database is offline, treat it as case-insensitive
                boolean caseInsensitive = collation == null || collation.isEmpty()
                    || collation.contains(CASE_INSENSITIVE_MARKER);
                databases.put(name.toLowerCase(Locale.ROOT), new ExistingDatabase(caseInsensitive, name));
            }
        }
        log.debug("Found {} databases on the instance", databases.size());
        return databases;
    }
}
