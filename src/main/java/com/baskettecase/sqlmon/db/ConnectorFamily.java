package com.baskettecase.sqlmon.db;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Driver families the monitor can connect through.
 *
 * Each family owns the table of connection string options that it understands,
 * mapped to the configuration field carrying the same setting.
 */
public enum ConnectorFamily {

    ADODBAPI("adodbapi", options(
        "PROVIDER", ConfigField.ADOPROVIDER,
        "Data Source", ConfigField.HOST,
        "Initial Catalog", ConfigField.DATABASE,
        "User ID", ConfigField.USERNAME,
        "Password", ConfigField.PASSWORD)),

    ODBC("odbc", options(
        "DSN", ConfigField.DSN,
        "DRIVER", ConfigField.DRIVER,
        "SERVER", ConfigField.HOST,
        "DATABASE", ConfigField.DATABASE,
        "UID", ConfigField.USERNAME,
        "PWD", ConfigField.PASSWORD));

    private final String configName;
    private final Map<String, ConfigField> options;

    ConnectorFamily(String configName, Map<String, ConfigField> options) {
        this.configName = configName;
        this.options = options;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Connection string option name to configuration field, in declaration order
     */
    public Map<String, ConfigField> getOptions() {
        return options;
    }

    public ConnectorFamily other() {
        return this == ADODBAPI ? ODBC : ADODBAPI;
    }

    public static Optional<ConnectorFamily> fromConfigName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(family -> family.configName.equalsIgnoreCase(name.trim()))
            .findFirst();
    }

    @Override
    public String toString() {
        return configName;
    }

    private static Map<String, ConfigField> options(Object... pairs) {
        Map<String, ConfigField> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (ConfigField) pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
