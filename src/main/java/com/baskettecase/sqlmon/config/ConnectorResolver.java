package com.baskettecase.sqlmon.config;

import com.baskettecase.sqlmon.db.ConnectorFamily;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Resolves connector and ADO provider from the global defaults and the instance overrides.
 * Invalid values never fail: they are logged and replaced by the default.
 */
@Slf4j
public final class ConnectorResolver {

    public static final ConnectorFamily DEFAULT_CONNECTOR = ConnectorFamily.ADODBAPI;
    public static final List<String> VALID_ADO_PROVIDERS = List.of("SQLOLEDB", "MSOLEDBSQL", "MSOLEDBSQL19", "SQLNCLI11");
    public static final String DEFAULT_ADO_PROVIDER = VALID_ADO_PROVIDERS.get(0);

    private ConnectorResolver() {
    }

    /**
     * @param available connectors that have a driver
     */
    public static ConnectorFamily resolveConnector(String globalConnector, String instanceConnector,
                                                   Set<ConnectorFamily> available) {
        ConnectorFamily defaultConnector;
        if (globalConnector == null) {
            log.debug("`connector` config value was not set, defaulting to {}", DEFAULT_CONNECTOR);
            defaultConnector = DEFAULT_CONNECTOR;
        } else {
            defaultConnector = ConnectorFamily.fromConfigName(globalConnector)
                .filter(available::contains)
                .orElse(null);
            if (defaultConnector == null) {
                log.error("Invalid database connector {}, defaulting to {}", globalConnector, DEFAULT_CONNECTOR);
                defaultConnector = DEFAULT_CONNECTOR;
            }
        }

        if (instanceConnector == null || instanceConnector.equals(defaultConnector.getConfigName())) {
            return defaultConnector;
        }
        ConnectorFamily connector = ConnectorFamily.fromConfigName(instanceConnector)
            .filter(available::contains)
            .orElse(null);
        if (connector == null) {
            log.warn("Invalid database connector {} using default {}", instanceConnector, defaultConnector);
            return defaultConnector;
        }
        log.debug("Overriding default connector with {}", connector);
        return connector;
    }

    public static String resolveAdoProvider(String globalProvider, String instanceProvider) {
        String defaultProvider = globalProvider == null ? DEFAULT_ADO_PROVIDER : globalProvider;
        if (!isValidAdoProvider(defaultProvider)) {
            log.error("Invalid ADODB provider string {}, defaulting to {}", defaultProvider, DEFAULT_ADO_PROVIDER);
            defaultProvider = DEFAULT_ADO_PROVIDER;
        }

        if (instanceProvider == null || instanceProvider.equals(defaultProvider)) {
            return defaultProvider;
        }
        if (!isValidAdoProvider(instanceProvider)) {
            log.warn("Invalid ADO provider {} using default {}", instanceProvider, defaultProvider);
            return defaultProvider;
        }
        log.debug("Overriding default ADO provider with {}", instanceProvider);
        return instanceProvider;
    }

    private static boolean isValidAdoProvider(String provider) {
        return VALID_ADO_PROVIDERS.contains(provider.toUpperCase(Locale.ROOT));
    }
}
