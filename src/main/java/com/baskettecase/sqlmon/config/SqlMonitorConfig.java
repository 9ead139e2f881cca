package com.baskettecase.sqlmon.config;

import com.baskettecase.sqlmon.check.ServiceCheckReporter;
import com.baskettecase.sqlmon.db.ConnectionCacheManager;
import com.baskettecase.sqlmon.db.ConnectionSettings;
import com.baskettecase.sqlmon.db.ConnectorFamily;
import com.baskettecase.sqlmon.db.DatabaseExistenceChecker;
import com.baskettecase.sqlmon.db.DriverConnector;
import com.baskettecase.sqlmon.db.JdbcDriverConnector;
import com.baskettecase.sqlmon.db.ReachabilityProbe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

/**
 * Wires the connection layer. The connector is resolved once here and stays fixed.
 */
@Slf4j
@Configuration
public class SqlMonitorConfig {

    @Bean
    public Map<ConnectorFamily, DriverConnector> driverConnectors(SqlMonitorProperties properties) {
        Map<ConnectorFamily, DriverConnector> connectors = new EnumMap<>(ConnectorFamily.class);
        connectors.put(ConnectorFamily.ADODBAPI,
            new JdbcDriverConnector(ConnectorFamily.ADODBAPI, properties.getAdodbapiUrlPrefix()));
        connectors.put(ConnectorFamily.ODBC,
            new JdbcDriverConnector(ConnectorFamily.ODBC, properties.getOdbcUrlPrefix()));
        return connectors;
    }

    @Bean
    public ConnectionSettings connectionSettings(SqlMonitorProperties properties) {
        SqlMonitorProperties.Instance instance = properties.getInstance();
        ConnectorFamily connector = ConnectorResolver.resolveConnector(
            properties.getConnector(), instance.getConnector(), driverConnectors(properties).keySet());
        String adoProvider = ConnectorResolver.resolveAdoProvider(
            properties.getAdoprovider(), instance.getAdoprovider());

        ConnectionSettings settings = new ConnectionSettings(
            connector, adoProvider, instance.getCommandTimeout(), instance.getServerVersion());
        log.info("🔗 Using {} connector (command timeout {}s)", connector, settings.commandTimeout());
        return settings;
    }

    @Bean
    public ReachabilityProbe reachabilityProbe(SqlMonitorProperties properties) {
        SqlMonitorProperties.Instance instance = properties.getInstance();
        return new ReachabilityProbe(instance.getHost(), instance.getPort(), instance.getCommandTimeout());
    }

    @Bean(destroyMethod = "closeAll")
    public ConnectionCacheManager connectionCacheManager(ConnectionSettings settings,
                                                         SqlMonitorProperties properties,
                                                         ServiceCheckReporter serviceCheckReporter,
                                                         ReachabilityProbe reachabilityProbe) {
        return new ConnectionCacheManager(settings, properties.getInstance(),
            driverConnectors(properties).get(settings.connector()), serviceCheckReporter, reachabilityProbe);
    }

    @Bean
    public DatabaseExistenceChecker databaseExistenceChecker(ConnectionCacheManager connectionCacheManager) {
        return new DatabaseExistenceChecker(connectionCacheManager);
    }
}
