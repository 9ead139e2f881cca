package com.baskettecase.sqlmon.config;

import com.baskettecase.sqlmon.db.ConnectionSettings;
import com.baskettecase.sqlmon.db.ConnectorFamily;
import com.baskettecase.sqlmon.db.JdbcDriverConnector;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SqlMonitorConfig
 */
class SqlMonitorConfigTest {

    private final SqlMonitorConfig config = new SqlMonitorConfig();

    @Test
    void testBothConnectorsAreAvailable() {
        var connectors = config.driverConnectors(new SqlMonitorProperties());

        assertEquals(2, connectors.size());
        assertEquals(ConnectorFamily.ODBC, ((JdbcDriverConnector) connectors.get(ConnectorFamily.ODBC)).getFamily());
    }

    @Test
    void testSettingsFromProperties() {
        SqlMonitorProperties properties = new SqlMonitorProperties();
        properties.setConnector("adodbapi");
        properties.getInstance().setConnector("odbc");
        properties.getInstance().setAdoprovider("MSOLEDBSQL");
        properties.getInstance().setCommandTimeout(10);
        properties.getInstance().setServerVersion(2012);

        ConnectionSettings settings = config.connectionSettings(properties);

        assertEquals(new ConnectionSettings(ConnectorFamily.ODBC, "MSOLEDBSQL", 10, 2012), settings);
        assertFalse(settings.supportsConnectRetry());
    }

    @Test
    void testDefaultSettings() {
        ConnectionSettings settings = config.connectionSettings(new SqlMonitorProperties());

        assertEquals(ConnectorFamily.ADODBAPI, settings.connector());
        assertEquals("SQLOLEDB", settings.adoProvider());
        assertEquals(5, settings.commandTimeout());
        assertTrue(settings.supportsConnectRetry());
    }
}
