package com.baskettecase.sqlmon.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Monitor configuration bound from {@code sqlmon.*}.
 *
 * Top level values are the global (init) defaults; the {@link Instance} block
 * describes the monitored SQL Server instance and may override the connector
 * and ADO provider for that instance.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "sqlmon")
public class SqlMonitorProperties {

    /** Global connector family: adodbapi or odbc */
    private String connector;

    /** Global ADO provider, validated against the provider allow-list */
    private String adoprovider;

    /** Run one check cycle when the application starts */
    private boolean checkOnStartup = false;

    /** JDBC URL prefix prepended to the synthesized ADO style connection string */
    private String adodbapiUrlPrefix = "jdbc:adodb:";

    /** JDBC URL prefix prepended to the synthesized ODBC style connection string */
    private String odbcUrlPrefix = "jdbc:odbc:";

    private Instance instance = new Instance();

    @Data
    public static class Instance {
        private String host;
        private String port;
        private String username;
        private String password;
        private String database;
        private String procOnlyIfDatabase;
        private String driver;
        private String dsn;
        private String connectionString;
        private int commandTimeout = 5;
        private int serverVersion = 1_000_000_000;
        private String connector;
        private String adoprovider;
        private List<String> extraDatabases = new ArrayList<>();

        @Override
        public String toString() {
            // credentials stay out of any rendering of the config
            return "Instance(host=" + host + ", port=" + port + ", database=" + database
                + ", driver=" + driver + ", dsn=" + dsn + ", connector=" + connector + ")";
        }
    }
}
