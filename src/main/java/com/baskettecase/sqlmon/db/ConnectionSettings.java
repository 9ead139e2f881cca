package com.baskettecase.sqlmon.db;

/**
 * Connector settings fixed when the monitor starts.
 *
 * @param connector      active driver family
 * @param adoProvider    OLE DB provider used by the ADO family
 * @param commandTimeout seconds, applies to connect, cursors and the TCP probe
 * @param serverVersion  major release year of the monitored server
 */
public record ConnectionSettings(
    ConnectorFamily connector,
    String adoProvider,
    int commandTimeout,
    int serverVersion
) {
    public static final int SQLSERVER_2014 = 2014;

    /**
     * Connection resiliency is available from SQL Server 2014 and on Azure SQL Database
     */
    public boolean supportsConnectRetry() {
        return serverVersion >= SQLSERVER_2014;
    }
}
