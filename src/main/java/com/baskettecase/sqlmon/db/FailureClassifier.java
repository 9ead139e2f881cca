package com.baskettecase.sqlmon.db;

import lombok.RequiredArgsConstructor;

import java.sql.SQLException;
import java.util.Map;

/**
 * Builds the diagnostic reported after a failed connect: TCP reachability of the
 * host plus a readable version of the driver error, with the password masked.
 */
@RequiredArgsConstructor
public class FailureClassifier {

    static final String PASSWORD_MASK = "******";
    static final String MISLEADING_PROVIDER_MESSAGE = "Invalid connection string attribute";

    static final Map<Integer, String> KNOWN_HRESULT_CODES = Map.of(
        -2147352567, "unable to connect",
        -2147217843, "login failed for user",
        // may also be a failed TCP connection, which the TCP status already covers
        -2147467259, "could not open database requested by login");

    private final ReachabilityProbe reachabilityProbe;
    private final String password;

    /**
     * Diagnostic message for a failed connect. Runs the reachability probe, so it may block.
     */
    public String describe(Exception e, String host, String database) {
        String tcpError = reachabilityProbe.probe();
        String message = String.format(
            "Unable to connect to SQL Server (host=%s database=%s). TCP-connection(%s). Exception: %s",
            host, database, tcpError != null ? tcpError : "OK", formatConnectionException(e));
        return mask(message);
    }

    String mask(String message) {
        if (password == null || password.isEmpty()) {
            return message;
        }
        return message.replace(password, PASSWORD_MASK);
    }

    /**
     * OLE DB providers report most failures as "Invalid connection string attribute";
     * when both HRESULTs are known the message is rebuilt from them instead.
     */
    static String formatConnectionException(Exception e) {
        if (e instanceof SQLException && e.getCause() instanceof ProviderComException) {
            ProviderComException comError = (ProviderComException) e.getCause();
            if (MISLEADING_PROVIDER_MESSAGE.equals(comError.getProviderMessage())) {
                String baseMessage = KNOWN_HRESULT_CODES.get(comError.getHresult());
                String subMessage = comError.getSubHresult() == null ? null
                    : KNOWN_HRESULT_CODES.get(comError.getSubHresult());
                if (baseMessage != null && subMessage != null) {
                    return baseMessage + ": " + subMessage;
                }
            }
        }
        return e.toString();
    }
}
