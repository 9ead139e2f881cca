package com.baskettecase.sqlmon.db;

import com.baskettecase.sqlmon.config.SqlMonitorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConnectionOptionsValidator
 */
@ExtendWith(OutputCaptureExtension.class)
class ConnectionOptionsValidatorTest {

    private SqlMonitorProperties.Instance instance;

    @BeforeEach
    void setUp() {
        instance = new SqlMonitorProperties.Instance();
        instance.setHost("dbhost,1500");
    }

    private void validate(ConnectorFamily connector) {
        new ConnectionOptionsValidator(instance, connector).validate(DatabaseKey.DATABASE, null);
    }

    @Test
    void testNoConnectionStringPasses() {
        instance.setUsername("sa");
        instance.setPassword("secret");

        assertDoesNotThrow(() -> validate(ConnectorFamily.ODBC));
        assertDoesNotThrow(() -> validate(ConnectorFamily.ADODBAPI));
    }

    @Test
    void testOptionOfOtherConnectorWarns(CapturedOutput output) {
        instance.setAdoprovider("MSOLEDBSQL");

        assertDoesNotThrow(() -> validate(ConnectorFamily.ODBC));
        assertTrue(output.getOut().contains("adoprovider option will be ignored since odbc connection is used"));
    }

    @Test
    void testHostInBothPlacesFails() {
        instance.setConnectionString("Server=otherhost");

        ConnectionConfigurationException e = assertThrows(ConnectionConfigurationException.class,
            () -> validate(ConnectorFamily.ODBC));

        assertTrue(e.getMessage().contains("SERVER has been provided both in the connection string"));
        assertTrue(e.getMessage().contains("(host)"));
    }

    @Test
    void testUsernameInBothPlacesFailsForAdo() {
        instance.setUsername("sa");
        instance.setConnectionString("user id=monitor");

        ConnectionConfigurationException e = assertThrows(ConnectionConfigurationException.class,
            () -> validate(ConnectorFamily.ADODBAPI));

        assertTrue(e.getMessage().contains("User ID"));
        assertTrue(e.getMessage().contains("(username)"));
    }

    @Test
    void testDatabaseInBothPlacesFails() {
        instance.setDatabase("db1");
        instance.setConnectionString("Database=db2");

        assertThrows(ConnectionConfigurationException.class, () -> validate(ConnectorFamily.ODBC));
    }

    @Test
    void testExplicitDatabaseDoesNotConflict() {
        instance.setDatabase("db1");
        instance.setConnectionString("Database=db2");
        ConnectionOptionsValidator validator = new ConnectionOptionsValidator(instance, ConnectorFamily.ODBC);

        assertDoesNotThrow(() -> validator.validate(null, "db3"));
    }

    @Test
    void testOptionOfOtherConnectorInConnectionStringFails() {
        instance.setHost(null);
        instance.setConnectionString("Data Source=dbhost");

        ConnectionConfigurationException e = assertThrows(ConnectionConfigurationException.class,
            () -> validate(ConnectorFamily.ODBC));

        assertEquals("Data Source has been provided in the connection string. This option is only available "
            + "for adodbapi connections, however odbc has been selected", e.getMessage());
    }

    @Test
    void testTrustedConnectionWithCredentialsWarns(CapturedOutput output) {
        instance.setUsername("sa");
        instance.setConnectionString("Trusted_Connection=yes");

        assertDoesNotThrow(() -> validate(ConnectorFamily.ODBC));
        assertTrue(output.getOut().contains("Username and password are ignored when using Windows authentication"));
    }

    @Test
    void testUnrelatedOptionsPass() {
        instance.setConnectionString("ApplicationIntent=ReadOnly;Encrypt={yes}");

        assertDoesNotThrow(() -> validate(ConnectorFamily.ODBC));
    }

    @Test
    void testMalformedConnectionStringFails() {
        instance.setConnectionString("Encrypt={yes");

        assertThrows(ConnectionConfigurationException.class, () -> validate(ConnectorFamily.ADODBAPI));
    }
}
