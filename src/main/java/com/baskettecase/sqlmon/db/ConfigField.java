package com.baskettecase.sqlmon.db;

/**
 * Discrete instance configuration fields that have a connection string counterpart.
 */
public enum ConfigField {
    ADOPROVIDER("adoprovider"),
    DSN("dsn"),
    DRIVER("driver"),
    HOST("host"),
    DATABASE("database"),
    USERNAME("username"),
    PASSWORD("password");

    private final String configName;

    ConfigField(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }
}
