package com.baskettecase.sqlmon.db;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReachabilityProbe
 */
class ReachabilityProbeTest {

    @Test
    void testListeningPortIsReachable() throws IOException {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            ReachabilityProbe probe = new ReachabilityProbe("127.0.0.1," + server.getLocalPort(), null, 2);

            assertNull(probe.probe());
        }
    }

    @Test
    void testPortOptionIsUsedWithoutPortSegment() throws IOException {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            ReachabilityProbe probe = new ReachabilityProbe("127.0.0.1", String.valueOf(server.getLocalPort()), 2);

            assertNull(probe.probe());
        }
    }

    @Test
    void testClosedPortReportsError() throws IOException {
        int port;
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = server.getLocalPort();
        }
        ReachabilityProbe probe = new ReachabilityProbe("127.0.0.1," + port, null, 2);

        String error = probe.probe();

        assertNotNull(error);
        assertTrue(error.startsWith("ERROR: "));
    }

    @Test
    void testInvalidPortIsReportedWithoutConnecting() {
        ReachabilityProbe probe = new ReachabilityProbe("127.0.0.1,notaport", null, 2);

        String error = probe.probe();

        assertTrue(error.startsWith("ERROR: invalid port: java.lang.NumberFormatException"));
    }

    @Test
    void testOutOfRangePortReportsError() {
        ReachabilityProbe probe = new ReachabilityProbe("127.0.0.1", "70000", 2);

        assertTrue(probe.probe().startsWith("ERROR: "));
    }
}
