package com.baskettecase.sqlmon.db;

import com.baskettecase.sqlmon.check.ServiceCheckReporter;
import com.baskettecase.sqlmon.check.ServiceCheckStatus;
import com.baskettecase.sqlmon.config.SqlMonitorProperties;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Connection Cache Manager
 *
 * Opens, caches and closes the connections to the monitored SQL Server instance,
 * one per {@link ConnectionIdentity}. Connections are opened and closed explicitly:
 * an open connection keeps locks on the database, which for instance prevents the
 * SQL Server Agent from stopping.
 *
 * Only this class holds connections. Callers borrow a cursor and close it.
 */
@Slf4j
public class ConnectionCacheManager {

    static final String SETUP_STATEMENT = "SET TRANSACTION ISOLATION LEVEL READ UNCOMMITTED";

    private final ConnectionSettings settings;
    private final SqlMonitorProperties.Instance instance;
    private final DriverConnector driverConnector;
    private final ServiceCheckReporter serviceCheckReporter;
    private final AccessInfoResolver accessInfoResolver;
    private final ConnectionOptionsValidator optionsValidator;
    private final ConnectionStringBuilder connectionStringBuilder;
    private final FailureClassifier failureClassifier;

    // guarded by itself
    private final Map<ConnectionIdentity, Connection> connections = new HashMap<>();

    public ConnectionCacheManager(ConnectionSettings settings,
                                  SqlMonitorProperties.Instance instance,
                                  DriverConnector driverConnector,
                                  ServiceCheckReporter serviceCheckReporter,
                                  ReachabilityProbe reachabilityProbe) {
        this.settings = settings;
        this.instance = instance;
        this.driverConnector = driverConnector;
        this.serviceCheckReporter = serviceCheckReporter;
        this.accessInfoResolver = new AccessInfoResolver(instance);
        this.optionsValidator = new ConnectionOptionsValidator(instance, settings.connector());
        this.connectionStringBuilder = new ConnectionStringBuilder(settings);
        this.failureClassifier = new FailureClassifier(reachabilityProbe, instance.getPassword());
        log.debug("Connection manager initialized for {} connector", settings.connector());
    }

    /**
     * Open a connection and cache it, replacing (and closing) any connection cached
     * under the same identity.
     *
     * The outcome is always reported to the service check reporter. A failure is
     * rethrown only for the default database so that a scan over several databases
     * goes on when one of them cannot be reached.
     *
     * @param dbKey     configuration entry naming the database, may be null
     * @param dbName    explicit database, takes precedence over {@code dbKey}
     * @param keyPrefix distinguishes connections to the same database, may be null
     * @param isDefault whether this is the instance's default database
     * @throws ConnectionConfigurationException when the connection options are inconsistent
     * @throws SqlServerConnectionException     when the connect fails for the default database
     */
    public void open(DatabaseKey dbKey, String dbName, String keyPrefix, boolean isDefault)
            throws SqlServerConnectionException {
        AccessInfo info = accessInfoResolver.resolve(dbKey, dbName);
        ConnectionIdentity identity = ConnectionIdentity.of(keyPrefix, info);

        optionsValidator.validate(dbKey, dbName);

        String cs = instance.getConnectionString() == null || instance.getConnectionString().isEmpty()
            ? "" : instance.getConnectionString() + ";";
        cs += connectionStringBuilder.build(info);

        Connection rawConnection = null;
        try {
            rawConnection = driverConnector.connect(cs, new ConnectOptions(settings.commandTimeout(), true));
            setupNewConnection(rawConnection);
        } catch (SQLException | RuntimeException e) {
            if (rawConnection != null) {
                closeQuietly(rawConnection);
            }
            String message = failureClassifier.describe(e, info.host(), info.database());
            serviceCheckReporter.report(ServiceCheckStatus.CRITICAL, info.host(), info.database(), message, isDefault);
            if (isDefault) {
                throw new SqlServerConnectionException(message);
            }
            log.debug("Connection to non-default database {} failed, continuing", info.database());
            return;
        }

        serviceCheckReporter.report(ServiceCheckStatus.OK, info.host(), info.database(), null, isDefault);

        Connection previous;
        synchronized (connections) {
            previous = connections.put(identity, rawConnection);
        }
        if (previous != null) {
            // avoid leaking the replaced connection
            closeQuietly(previous);
        }
    }

    /**
     * Ensure the monitor's reads never block updates to the tables it reads from
     */
    private void setupNewConnection(Connection rawConnection) throws SQLException {
        try (Statement statement = rawConnection.createStatement()) {
            statement.execute(SETUP_STATEMENT);
        }
    }

    /**
     * New cursor on a cached connection. The caller must close it with {@link #closeCursor}.
     *
     * @throws ConnectionNotFoundException when no connection is cached for the database
     */
    public Statement getCursor(DatabaseKey dbKey, String dbName, String keyPrefix) throws SQLException {
        ConnectionIdentity identity = identity(dbKey, dbName, keyPrefix);
        Connection connection;
        synchronized (connections) {
            connection = connections.get(identity);
        }
        if (connection == null) {
            // the identity holds credentials, report the host only
            throw new ConnectionNotFoundException(instance.getHost());
        }
        Statement statement = connection.createStatement();
        try {
            statement.setQueryTimeout(settings.commandTimeout());
        } catch (SQLException | RuntimeException e) {
            closeCursor(statement);
            throw e;
        }
        return statement;
    }

    /**
     * Close a cursor explicitly. Closing an already closed cursor is not an error.
     */
    public void closeCursor(Statement cursor) {
        try {
            cursor.close();
        } catch (SQLException | RuntimeException e) {
            log.warn("Could not close cursor\n{}", e.toString());
        }
    }

    /**
     * Close and forget the cached connection. No-op when none is cached.
     */
    public void close(DatabaseKey dbKey, String dbName, String keyPrefix) {
        ConnectionIdentity identity = identity(dbKey, dbName, keyPrefix);
        Connection connection;
        synchronized (connections) {
            connection = connections.remove(identity);
        }
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException | RuntimeException e) {
            log.warn("Could not close db connection\n{}", e.toString());
        }
    }

    /**
     * Open a connection that is closed when the returned handle is closed.
     */
    public ManagedConnection openManaged(DatabaseKey dbKey, String dbName, String keyPrefix)
            throws SqlServerConnectionException {
        open(dbKey, dbName, keyPrefix, true);
        return () -> close(dbKey, dbName, keyPrefix);
    }

    public ManagedConnection openManagedDefaultConnection(String keyPrefix) throws SqlServerConnectionException {
        return openManaged(DatabaseKey.DATABASE, null, keyPrefix);
    }

    public ManagedConnection openManagedDefaultDatabase() throws SqlServerConnectionException {
        return openManaged(null, AccessInfoResolver.DEFAULT_DATABASE, null);
    }

    /**
     * Run a callback with a cursor on the default database connection, closing the cursor afterwards.
     */
    public <T> T withManagedCursor(String keyPrefix, CursorCallback<T> action) throws SQLException {
        Statement cursor = getCursor(DatabaseKey.DATABASE, null, keyPrefix);
        try {
            return action.doWithCursor(cursor);
        } finally {
            closeCursor(cursor);
        }
    }

    /**
     * Check that a non-default database accepts connections. The outcome goes to the
     * service check reporter only.
     */
    public void checkDatabaseConnections(String dbName) throws SqlServerConnectionException {
        open(null, dbName, null, false);
        close(null, dbName, null);
    }

    /**
     * Close every cached connection
     */
    public void closeAll() {
        List<Connection> open;
        synchronized (connections) {
            open = new ArrayList<>(connections.values());
            connections.clear();
        }
        log.info("🔌 Closing {} database connections", open.size());
        open.forEach(this::closeQuietly);
    }

    public int getOpenConnectionCount() {
        synchronized (connections) {
            return connections.size();
        }
    }

    public AccessInfo getAccessInfo(DatabaseKey dbKey, String dbName) {
        return accessInfoResolver.resolve(dbKey, dbName);
    }

    private ConnectionIdentity identity(DatabaseKey dbKey, String dbName, String keyPrefix) {
        return ConnectionIdentity.of(keyPrefix, accessInfoResolver.resolve(dbKey, dbName));
    }

    private void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException | RuntimeException e) {
            log.info("Could not close db connection\n{}", e.toString());
        }
    }

    /**
     * Handle of a connection opened by {@link #openManaged}. Closing never throws.
     */
    @FunctionalInterface
    public interface ManagedConnection extends AutoCloseable {
        @Override
        void close();
    }

    @FunctionalInterface
    public interface CursorCallback<T> {
        T doWithCursor(Statement cursor) throws SQLException;
    }
}
