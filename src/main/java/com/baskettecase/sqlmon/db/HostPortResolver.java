package com.baskettecase.sqlmon.db;

import lombok.extern.slf4j.Slf4j;

/**
 * Resolves SQL Server {@code host[,port]} strings.
 */
@Slf4j
public final class HostPortResolver {

    public static final int DEFAULT_PORT = 1433;

    private HostPortResolver() {
    }

    /**
     * Host and optional port segment of a {@code host[,port]} string
     */
    public record HostPort(String host, String port) {
    }

    /**
     * Split a host string on commas. Only the first two segments are kept.
     *
     * @param host host string, may be null
     * @return host and port segment; port is null when the string has no comma
     */
    public static HostPort split(String host) {
        if (host == null || host.isEmpty()) {
            return new HostPort(host, null);
        }
        String[] segments = host.split(",", -1);
        if (segments.length == 1) {
            return new HostPort(segments[0].trim(), null);
        }
        String splitHost = segments[0].trim();
        String splitPort = segments[1].trim();
        if (segments.length > 2) {
            log.warn("Invalid sqlserver host string has more than one comma: {}. Using only 1st two items: host:{}, port:{}",
                host, splitHost, splitPort);
        }
        return new HostPort(splitHost, splitPort);
    }

    /**
     * Render host as {@code host,port}.
     *
     * The port is taken from the host string, then from the separate port option,
     * then the default. A port that is not an integer is replaced by the default.
     *
     * @return {@code host,port}, or null when no host is configured
     */
    public static String resolveHostWithPort(String host, String configPort) {
        if (host == null || host.isEmpty()) {
            return null;
        }
        HostPort split = split(host);
        String port = String.valueOf(DEFAULT_PORT);
        if (split.port() != null) {
            port = split.port();
        } else if (configPort != null) {
            port = configPort;
        }
        try {
            Integer.parseInt(port);
        } catch (NumberFormatException e) {
            log.warn("Invalid port {}; falling back to default {}", port, DEFAULT_PORT);
            port = String.valueOf(DEFAULT_PORT);
        }
        return split.host() + "," + port;
    }
}
