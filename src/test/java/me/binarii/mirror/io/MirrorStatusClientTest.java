package me.binarii.mirror.io;

import com.sun.net.httpserver.HttpServer;
import me.binarii.mirror.model.Mirror;
import me.binarii.mirror.model.MirrorList;
import me.binarii.mirror.model.Protocol;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Instant;

import static java.nio.charset.StandardCharsets.UTF_8;
import static me.binarii.mirror.MirrorFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class MirrorStatusClientTest {

    @Nested
    @DisplayName("Decoding")
    class DecodeTests {

        @Test
        @DisplayName("Should decode every field of the status document")
        void testDecode() throws Exception {
            MirrorList list = MirrorStatusClient.decode(statusJson(), "https://example.org/status");

            assertEquals(4, list.size());
            assertEquals("https://example.org/status", list.getSource());

            Mirror rutgers = list.getMirrors().get(0);
            assertEquals(RUTGERS, rutgers.getUrl());
            assertEquals(Protocol.HTTPS, rutgers.getProtocol());
            assertNull(rutgers.getLastSync());
            assertNull(rutgers.getScore());
            assertNull(rutgers.getDelay());
            assertEquals("US", rutgers.getCountryCode());
            assertEquals(Boolean.FALSE, rutgers.getIpv6());
            assertFalse(rutgers.hasDownloadRate());

            Mirror ntua = list.getMirrors().get(1);
            assertEquals(Protocol.HTTP, ntua.getProtocol());
            assertEquals(Instant.parse("2024-05-01T14:25:08Z"), ntua.getLastSync());
            assertEquals(6354.0, ntua.getDelay());
            assertEquals(2.852143826997215, ntua.getScore());
            assertEquals("Greece", ntua.getCountry());
            assertEquals("https://archlinux.org/mirrors/ntua.gr/333/", ntua.getDetails());
        }

        @Test
        @DisplayName("Should default a missing protocol to https")
        void testDefaultProtocol() throws Exception {
            MirrorList list = MirrorStatusClient.decode(
                    "{\"urls\":[{\"url\":\"a\"},{\"url\":\"b\",\"protocol\":null},{\"url\":\"c\",\"protocol\":\"rsync\"}]}",
                    null);

            assertEquals(Protocol.HTTPS, list.getMirrors().get(0).getProtocol());
            assertEquals(Protocol.HTTPS, list.getMirrors().get(1).getProtocol());
            assertEquals(Protocol.RSYNC, list.getMirrors().get(2).getProtocol());
            assertNull(list.getSource());
        }

        @Test
        @DisplayName("Should fail on malformed input")
        void testMalformed() {
            assertThrows(MirrorStatusException.class, () -> MirrorStatusClient.decode("{\"urls\": [", null));
            assertThrows(MirrorStatusException.class, () -> MirrorStatusClient.decode("{}", null));
            assertThrows(MirrorStatusException.class, () -> MirrorStatusClient.decode("", null));
            assertThrows(MirrorStatusException.class,
                    () -> MirrorStatusClient.decode("{\"urls\":[{\"protocol\":\"http\"}]}", null));
        }

        @Test
        @DisplayName("Should fail on an unknown protocol or timestamp")
        void testBadValues() {
            assertThrows(MirrorStatusException.class,
                    () -> MirrorStatusClient.decode("{\"urls\":[{\"url\":\"a\",\"protocol\":\"gopher\"}]}", null));
            assertThrows(MirrorStatusException.class,
                    () -> MirrorStatusClient.decode("{\"urls\":[{\"url\":\"a\",\"last_sync\":\"yesterday\"}]}", null));
        }

    }

    @Nested
    @DisplayName("Fetching")
    class FetchTests {

        private HttpServer start(int status, String body) throws Exception {
            HttpServer httpServer = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
            httpServer.createContext("/mirrors/status/json", httpExchange -> {
                byte[] responseData = body.getBytes(UTF_8);
                httpExchange.getResponseHeaders().set("Content-Type", "application/json;charset=utf-8");
                httpExchange.sendResponseHeaders(status, responseData.length);
                try (OutputStream out = httpExchange.getResponseBody()) {
                    out.write(responseData);
                }
                httpExchange.close();
            });
            httpServer.start();
            return httpServer;
        }

        private String url(HttpServer httpServer) {
            return "http://127.0.0.1:" + httpServer.getAddress().getPort() + "/mirrors/status/json";
        }

        @Test
        @DisplayName("Should fetch and record the source url")
        void testFetch() throws Exception {
            HttpServer httpServer = start(200, statusJson());
            try (MirrorStatusClient client = new MirrorStatusClient()) {
                MirrorList list = client.fetch(url(httpServer));
                assertEquals(4, list.size());
                assertEquals(url(httpServer), list.getSource());
            } finally {
                httpServer.stop(0);
            }
        }

        @Test
        @DisplayName("Should fail on an error status")
        void testErrorStatus() throws Exception {
            HttpServer httpServer = start(500, "oops");
            try (MirrorStatusClient client = new MirrorStatusClient()) {
                assertThrows(MirrorStatusException.class, () -> client.fetch(url(httpServer)));
            } finally {
                httpServer.stop(0);
            }
        }

        @Test
        @DisplayName("Should fail on a malformed body")
        void testMalformedBody() throws Exception {
            HttpServer httpServer = start(200, "<html>maintenance</html>");
            try (MirrorStatusClient client = new MirrorStatusClient()) {
                assertThrows(MirrorStatusException.class, () -> client.fetch(url(httpServer)));
            } finally {
                httpServer.stop(0);
            }
        }

    }

}
