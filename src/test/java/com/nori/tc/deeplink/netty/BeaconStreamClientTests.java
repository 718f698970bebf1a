package com.nori.tc.deeplink.netty;

import com.nori.tc.deeplink.beacon.BeaconCategory;
import com.nori.tc.deeplink.beacon.BeaconStreamMonitor;
import com.nori.tc.deeplink.error.ConnectionException;
import com.nori.tc.deeplink.runtime.HostPort;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * loopback ServerSocket을 디바이스 이벤트 스트림 대역으로 사용한다.
 */
class BeaconStreamClientTests {

    @Test
    void receives_lines_and_reports_device_close() throws Exception {
        BeaconStreamMonitor monitor = new BeaconStreamMonitor();

        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
             BeaconStreamClient client = new BeaconStreamClient(
                     new HostPort("127.0.0.1", server.getLocalPort()), monitor, 2_000)) {

            client.connect();
            assertTrue(client.isConnected());

            try (Socket device = server.accept()) {
                OutputStream out = device.getOutputStream();
                out.write("AppLaunchComplete Duration(1200 ms)\r\n".getBytes(StandardCharsets.UTF_8));
                out.flush();

                awaitTrue(() -> monitor.contains(BeaconCategory.APP_LAUNCH_COMPLETE));
            }

            // 디바이스 쪽에서 닫음
            awaitTrue(() -> monitor.connectionFailure() != null);
            assertTrue(monitor.connectionFailure().contains("closed by device"));
        }
    }

    @Test
    void explicit_close_is_not_reported_as_lost() throws Exception {
        BeaconStreamMonitor monitor = new BeaconStreamMonitor();

        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            BeaconStreamClient client = new BeaconStreamClient(
                    new HostPort("127.0.0.1", server.getLocalPort()), monitor, 2_000);
            client.connect();
            try (Socket ignored = server.accept()) {
                client.close();
                client.close();
            }
            assertFalse(client.isConnected());
            assertNull(monitor.connectionFailure());
        }
    }

    @Test
    void refused_connection_raises_connection_exception() throws Exception {
        int port;
        try (ServerSocket s = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = s.getLocalPort();
        }

        try (BeaconStreamClient client = new BeaconStreamClient(
                new HostPort("127.0.0.1", port), new BeaconStreamMonitor(), 2_000)) {
            ConnectionException e = assertThrows(ConnectionException.class, client::connect);
            assertTrue(e.getMessage().startsWith("Telnet connection failed"));
        }
    }

    private static void awaitTrue(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(20);
        }
    }
}
