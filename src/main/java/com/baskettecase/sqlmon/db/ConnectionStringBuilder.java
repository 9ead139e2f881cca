package com.baskettecase.sqlmon.db;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Synthesizes the connection string of the active connector from resolved access info.
 *
 * Fields are written in the connector's fixed order, and only when present. The
 * password always comes last so that the string can be logged before it is added.
 */
@Slf4j
@RequiredArgsConstructor
public class ConnectionStringBuilder {

    static final String CONNECT_RETRY = "ConnectRetryCount=2;";
    static final String INTEGRATED_SECURITY = "Integrated Security=SSPI;";

    private record Fragment(String option, BiFunction<AccessInfo, ConnectionSettings, String> value) {
    }

    private static final Map<ConnectorFamily, List<Fragment>> FIELD_ORDER = Map.of(
        ConnectorFamily.ODBC, List.of(
            new Fragment("DSN", (info, settings) -> info.dsn()),
            new Fragment("DRIVER", (info, settings) -> info.driver()),
            new Fragment("Server", (info, settings) -> info.host()),
            new Fragment("Database", (info, settings) -> info.database()),
            new Fragment("UID", (info, settings) -> info.username())),
        ConnectorFamily.ADODBAPI, List.of(
            new Fragment("Provider", (info, settings) -> settings.adoProvider()),
            new Fragment("Data Source", (info, settings) -> info.host()),
            new Fragment("Initial Catalog", (info, settings) -> info.database()),
            new Fragment("User ID", (info, settings) -> info.username())));

    private static final Map<ConnectorFamily, String> PASSWORD_OPTION = Map.of(
        ConnectorFamily.ODBC, "PWD",
        ConnectorFamily.ADODBAPI, "Password");

    private final ConnectionSettings settings;

    public String build(AccessInfo info) {
        ConnectorFamily connector = settings.connector();
        StringBuilder cs = new StringBuilder();
        if (settings.supportsConnectRetry()) {
            cs.append(CONNECT_RETRY);
        }
        for (Fragment fragment : FIELD_ORDER.get(connector)) {
            append(cs, fragment.option(), fragment.value().apply(info, settings));
        }
        log.debug("Connection string (before password) {}", cs);

        append(cs, PASSWORD_OPTION.get(connector), info.password());
        if (connector == ConnectorFamily.ADODBAPI && isEmpty(info.username()) && isEmpty(info.password())) {
            cs.append(INTEGRATED_SECURITY);
        }
        return cs.toString();
    }

    private static void append(StringBuilder cs, String option, String value) {
        if (!isEmpty(value)) {
            cs.append(option).append('=').append(value).append(';');
        }
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
