package com.baskettecase.sqlmon.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Native driver of one connector family.
 *
 * ADO family implementations must surface OLE DB provider failures as a
 * {@link java.sql.SQLException} whose cause is a {@link ProviderComException}
 * carrying the outer HRESULT, the provider message and the provider HRESULT.
 * {@link FailureClassifier} reads them to replace the provider's misleading
 * "Invalid connection string attribute" message.
 */
public interface DriverConnector {

    /**
     * Open a connection. Blocks for at most the timeout given in the options.
     *
     * @param connectionString full connection string, including credentials
     */
    Connection connect(String connectionString, ConnectOptions options) throws SQLException;
}
