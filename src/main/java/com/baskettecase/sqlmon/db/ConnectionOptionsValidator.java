package com.baskettecase.sqlmon.db;

import com.baskettecase.sqlmon.config.SqlMonitorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks that each connection setting is given exactly once, through either a
 * configuration field or the raw connection string, and only with options the
 * active connector understands.
 */
@Slf4j
@RequiredArgsConstructor
public class ConnectionOptionsValidator {

    private static final Set<String> TRUTHY = Set.of("yes", "true");

    private final SqlMonitorProperties.Instance instance;
    private final ConnectorFamily connector;

    /**
     * @throws ConnectionConfigurationException when an option is duplicated or belongs to the other connector
     */
    public void validate(DatabaseKey dbKey, String dbName) {
        ConnectorFamily otherConnector = connector.other();
        Map<String, ConfigField> connectorOptions = connector.getOptions();
        Map<String, ConfigField> otherConnectorOptions = otherConnector.getOptions();

        Set<ConfigField> ignored = new LinkedHashSet<>(otherConnectorOptions.values());
        ignored.removeAll(connectorOptions.values());
        for (ConfigField field : ignored) {
            if (valueOf(field, dbKey, dbName) != null) {
                log.warn("{} option will be ignored since {} connection is used", field.getConfigName(), connector);
            }
        }

        String cs = instance.getConnectionString();
        if (cs == null) {
            return;
        }

        Map<String, String> parsed = ConnectionStringParser.parse(cs).entrySet().stream()
            .collect(Collectors.toMap(
                e -> e.getKey().toLowerCase(Locale.ROOT),
                Map.Entry::getValue,
                (first, second) -> second));

        String trusted = parsed.getOrDefault("trusted_connection", "false").toLowerCase(Locale.ROOT);
        if (TRUTHY.contains(trusted) && (instance.getUsername() != null || instance.getPassword() != null)) {
            log.warn("Username and password are ignored when using Windows authentication");
        }

        for (Map.Entry<String, ConfigField> option : connectorOptions.entrySet()) {
            if (containsKey(parsed.keySet(), option.getKey()) && valueOf(option.getValue(), dbKey, dbName) != null) {
                throw new ConnectionConfigurationException(String.format(
                    "%s has been provided both in the connection string and as a configuration option (%s), "
                        + "please specify it only once", option.getKey(), option.getValue().getConfigName()));
            }
        }
        for (String option : otherConnectorOptions.keySet()) {
            if (containsKey(parsed.keySet(), option)) {
                throw new ConnectionConfigurationException(String.format(
                    "%s has been provided in the connection string. This option is only available for %s "
                        + "connections, however %s has been selected", option, otherConnector, connector));
            }
        }
    }

    private static boolean containsKey(Collection<String> lowercasedKeys, String option) {
        return lowercasedKeys.contains(option.toLowerCase(Locale.ROOT));
    }

    /**
     * Configured value of a field. The database field only counts when it comes
     * from the configuration entry, not from an explicitly requested database.
     */
    private String valueOf(ConfigField field, DatabaseKey dbKey, String dbName) {
        switch (field) {
            case ADOPROVIDER:
                return instance.getAdoprovider();
            case DSN:
                return instance.getDsn();
            case DRIVER:
                return instance.getDriver();
            case HOST:
                return instance.getHost();
            case DATABASE:
                return dbName == null && dbKey != null ? dbKey.lookup(instance) : null;
            case USERNAME:
                return instance.getUsername();
            case PASSWORD:
                return instance.getPassword();
            default:
                throw new IllegalArgumentException("Unknown field: " + field);
        }
    }
}
