package com.baskettecase.sqlmon.db;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Properties;

/**
 * {@link DriverConnector} backed by a JDBC driver registered with the
 * {@link java.sql.DriverManager}. The driver is picked by the URL prefix that is
 * put in front of the connection string.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcDriverConnector implements DriverConnector {

    private final ConnectorFamily family;
    private final String urlPrefix;

    @Override
    public Connection connect(String connectionString, ConnectOptions options) throws SQLException {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(urlPrefix + connectionString);

        Properties properties = new Properties();
        properties.setProperty("loginTimeout", String.valueOf(options.timeoutSeconds()));
        properties.setProperty("timeout", String.valueOf(options.timeoutSeconds()));
        dataSource.setConnectionProperties(properties);

        log.debug("Connecting through {} driver ({})", family, urlPrefix);
        Connection connection = dataSource.getConnection();
        try {
            connection.setAutoCommit(options.autocommit());
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
        return connection;
    }

    public ConnectorFamily getFamily() {
        return family;
    }
}
