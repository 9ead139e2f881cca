package com.baskettecase.sqlmon.db;

import com.baskettecase.sqlmon.config.SqlMonitorProperties;

/**
 * Instance configuration entries that name a database to connect to.
 */
public enum DatabaseKey {
    DATABASE("database"),
    PROC_ONLY_IF_DATABASE("proc_only_if_database");

    private final String configName;

    DatabaseKey(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Database configured under this key, or null
     */
    public String lookup(SqlMonitorProperties.Instance instance) {
        return this == DATABASE ? instance.getDatabase() : instance.getProcOnlyIfDatabase();
    }
}
