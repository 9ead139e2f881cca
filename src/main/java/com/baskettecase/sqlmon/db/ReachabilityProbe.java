package com.baskettecase.sqlmon.db;

import lombok.RequiredArgsConstructor;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * Tests plain TCP reachability of the configured host, used to tell network
 * problems apart from protocol or login problems after a failed connect.
 */
@RequiredArgsConstructor
public class ReachabilityProbe {

    static final String FALLBACK_HOST = "127.0.0.1";

    private final String host;
    private final String port;
    private final int timeoutSeconds;

    /**
     * Try to open a TCP connection to the database host. Blocks up to the timeout.
     *
     * @return description of the error, or null when the host accepted the connection
     */
    public String probe() {
        HostPortResolver.HostPort split = HostPortResolver.split(host);
        String targetHost = split.host() == null || split.host().isEmpty() ? FALLBACK_HOST : split.host();
        String targetPort = split.port();
        if (targetPort == null) {
            targetPort = port != null ? port : String.valueOf(HostPortResolver.DEFAULT_PORT);
        }

        int portNumber;
        try {
            portNumber = Integer.parseInt(targetPort.trim());
        } catch (NumberFormatException e) {
            return "ERROR: invalid port: " + e;
        }

        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(targetHost, portNumber), timeoutSeconds * 1000);
        } catch (IOException | IllegalArgumentException e) {
            return "ERROR: " + (e.getMessage() != null ? e.getMessage() : e.toString());
        }
        return null;
    }
}
