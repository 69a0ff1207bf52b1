package org.muxhttp.server;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.muxhttp.NetTestUtils;
import org.muxhttp.api.impl.HttpRequestWriter;
import org.muxhttp.api.interfaces.IHttpHandler;
import org.muxhttp.client.ClientResponse;
import org.muxhttp.client.MuxClient;
import org.muxhttp.framing.Frame;
import org.muxhttp.framing.FrameCodec;
import org.muxhttp.framing.FrameFormat;
import org.muxhttp.framing.StreamReassembler;
import org.muxhttp.infrastructure.config.ServerConfig;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WebServerIntegrationTest {

    private static final String FUTURE = "Wed, 21 Oct 2099 07:28:00 GMT";

    @TempDir
    Path root;

    private MuxServer server;
    private byte[] big;

    @BeforeEach
    void startServer() throws Exception {
        Files.writeString(root.resolve("test.html"), "<html><body>test</body></html>");
        Files.writeString(root.resolve("private.html"), "<html>secret</html>");
        big = new byte[5000];
        for (int i = 0; i < big.length; i++) big[i] = (byte) ('A' + i % 26);
        Files.write(root.resolve("big.html"), big);

        ServerConfig cfg = new ServerConfig();
        cfg.rootDir = root.toString();
        server = MuxServer.webServer(cfg);
        server.start(0);
    }

    @AfterEach
    void stopServer() throws Exception {
        if (server != null) server.close();
    }

    private static byte[] request(String path, String version, Integer streamId) {
        return HttpRequestWriter.serialize("GET", path, version, Map.of("Host", "localhost"), null, streamId);
    }

    @Test
    @DisplayName("1) existing file -> 200 with body and standard headers")
    void okForExistingFile() throws Exception {
        try (MuxClient client = new MuxClient("127.0.0.1", server.port())) {
            ClientResponse r = client.get("/test.html");

            assertEquals(200, r.status());
            assertEquals("HTTP/1.1 200 OK", r.statusLine());
            assertEquals("<html><body>test</body></html>", r.bodyText());
            assertEquals("text/html", r.header("Content-Type"));
            assertEquals("TestServer/1.0", r.header("Server"));
            assertNotNull(r.header("Date"));
            assertNotNull(r.header("Last-Modified"));
        }
    }

    @Test
    @DisplayName("2) If-Modified-Since after modification -> 304 without body")
    void notModified() throws Exception {
        try (MuxClient client = new MuxClient("127.0.0.1", server.port())) {
            ClientResponse r = client.get("/test.html", Map.of("If-Modified-Since", FUTURE));

            assertEquals(304, r.status());
            assertEquals(0, r.body().length);
            assertNull(r.header("Content-Length"));
        }
    }

    @Test
    @DisplayName("3) restricted file -> 403")
    void forbidden() throws Exception {
        try (MuxClient client = new MuxClient("127.0.0.1", server.port())) {
            ClientResponse r = client.get("/private.html");
            assertEquals(403, r.status());
            assertEquals("<h1>403 Forbidden</h1>", r.bodyText());
        }
    }

    @Test
    @DisplayName("4) missing file -> 404")
    void notFound() throws Exception {
        try (MuxClient client = new MuxClient("127.0.0.1", server.port())) {
            ClientResponse r = client.get("/nonexistent.html");
            assertEquals(404, r.status());
            assertEquals("<h1>404 Not Found</h1>", r.bodyText());
        }
    }

    @Test
    @DisplayName("5) HTTP/1.0 -> 505")
    void versionNotSupported() throws Exception {
        byte[] raw = NetTestUtils.sendRaw(server.port(), "GET /test.html HTTP/1.0\r\nHost: localhost\r\n\r\n");
        ClientResponse r = ClientResponse.parse(raw);

        assertEquals(505, r.status());
        assertEquals("HTTP/1.1 505 HTTP Version Not Supported", r.statusLine());
        assertEquals("<h1>505 HTTP Version Not Supported</h1>", r.bodyText());
    }

    @Test
    @DisplayName("6) one connection serves several plain requests")
    void persistentPlainRequests() throws Exception {
        try (MuxClient client = new MuxClient("127.0.0.1", server.port())) {
            assertEquals(200, client.get("/").status());
            assertEquals(404, client.get("/missing.html").status());
            assertEquals(200, client.get("/test.html?x=1").status());
        }
    }

    @Test
    @DisplayName("7) multiplexed streams each get their own response")
    void multiplexedStreams() throws Exception {
        try (MuxClient client = new MuxClient("127.0.0.1", server.port())) {
            Map<Integer, ClientResponse> res = client.getAll(
                    List.of("/test.html", "/big.html", "/private.html", "/nonexistent.html"));

            assertEquals(4, res.size());
            assertEquals("<html><body>test</body></html>", res.get(1).bodyText());
            assertArrayEquals(big, res.get(2).body());
            assertEquals(403, res.get(3).status());
            assertEquals(404, res.get(4).status());
        }
    }

    @Test
    @DisplayName("8) framed response never exceeds the frame limit and ends once")
    void framesRespectLimit() throws Exception {
        FrameCodec codec = new FrameCodec(FrameFormat.LENGTH_PREFIXED, 1024);
        try (Socket s = new Socket("127.0.0.1", server.port())) {
            s.setSoTimeout(10_000);
            s.getOutputStream().write(request("/big.html", "HTTP/1.1", 3));
            s.shutdownOutput();

            InputStream in = s.getInputStream();
            int frames = 0;
            int ends = 0;
            Frame f;
            while ((f = codec.read(in)) != null) {
                assertEquals(3, f.streamId());
                assertTrue(f.length() <= 1024);
                frames++;
                if (f.end()) ends++;
            }
            assertTrue(frames >= 5, "5000 body bytes need at least 5 frames, got " + frames);
            assertEquals(1, ends);
        }
    }

    @Test
    @DisplayName("9) stream id given before the request line is honoured")
    void streamIdPreamble() throws Exception {
        byte[] raw = NetTestUtils.sendRaw(server.port(), "STREAM-ID: 5\r\nGET /test.html HTTP/1.1\r\n\r\n");

        FrameCodec codec = new FrameCodec(FrameFormat.LENGTH_PREFIXED, 1024);
        StreamReassembler r = new StreamReassembler();
        InputStream in = new ByteArrayInputStream(raw);
        Frame f;
        while ((f = codec.read(in)) != null) r.accept(f);

        assertTrue(r.isComplete(5));
        assertEquals(200, ClientResponse.parse(r.payload(5)).status());
    }

    @Test
    @DisplayName("10) malformed request is dropped and the next one is served")
    void malformedRequestDropped() throws Exception {
        byte[] raw = NetTestUtils.sendRaw(server.port(),
                "garbage\r\n\r\nGET /test.html HTTP/1.1\r\nHost: localhost\r\n\r\n");
        InputStream in = new ByteArrayInputStream(raw);

        ClientResponse r = ClientResponse.read(in);
        assertNotNull(r);
        assertEquals(200, r.status());
        assertNull(ClientResponse.read(in), "nothing is sent for the malformed request");
    }

    @Test
    @DisplayName("11) connection closes once the client is done and responses are out")
    void connectionClosesAfterHalfClose() throws Exception {
        try (MuxClient client = new MuxClient("127.0.0.1", server.port())) {
            assertEquals(200, client.get("/test.html").status());
            client.finishSending();
            assertTrue(NetTestUtils.waitUntil(() -> server.openConnections() == 0, 5000));
        }
    }

    @Test
    @DisplayName("12) slow stream does not hold back a fast one")
    void noHeadOfLineBlocking() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        IHttpHandler handler = (req, res) -> {
            if (req.path().equals("/slow")) {
                release.await(10, TimeUnit.SECONDS);
                res.body("slow");
            } else {
                res.body("fast");
            }
        };
        MuxServer custom = new MuxServer("Custom", new ServerConfig(), handler);
        custom.start(0);
        FrameCodec codec = new FrameCodec(FrameFormat.LENGTH_PREFIXED, 1024);
        try (Socket s = new Socket("127.0.0.1", custom.port())) {
            s.setSoTimeout(10_000);
            OutputStream out = s.getOutputStream();
            out.write(request("/slow", "HTTP/1.1", 1));
            out.write(request("/fast", "HTTP/1.1", 2));
            out.flush();

            InputStream in = s.getInputStream();
            StreamReassembler r = new StreamReassembler();
            while (!r.isComplete(2)) {
                Frame f = codec.read(in);
                assertNotNull(f);
                assertEquals(2, f.streamId(), "slow stream answered before it was released");
                r.accept(f);
            }
            assertEquals("fast", ClientResponse.parse(r.payload(2)).bodyText());

            release.countDown();
            while (!r.isComplete(1)) {
                Frame f = codec.read(in);
                assertNotNull(f);
                r.accept(f);
            }
            assertEquals("slow", ClientResponse.parse(r.payload(1)).bodyText());
        } finally {
            release.countDown();
            custom.close();
        }
    }

    @Test
    @DisplayName("13) handler failure -> 500 with the detail")
    void handlerFailureIs500() throws Exception {
        MuxServer failing = new MuxServer("Failing", new ServerConfig(), (req, res) -> {
            throw new IOException("disk unavailable");
        });
        failing.start(0);
        try (MuxClient client = new MuxClient("127.0.0.1", failing.port())) {
            ClientResponse r = client.get("/test.html");

            assertEquals(500, r.status());
            assertEquals("<h1>500 Internal Server Error</h1><p>disk unavailable</p>", r.bodyText());
            // connection survives a failed request
            assertEquals(500, client.get("/again").status());
        } finally {
            failing.close();
        }
    }

    @Test
    @DisplayName("14) requests with a body are split correctly")
    void bodyIsConsumed() throws Exception {
        try (Socket s = new Socket("127.0.0.1", server.port())) {
            s.setSoTimeout(10_000);
            OutputStream out = s.getOutputStream();
            out.write(("POST /test.html HTTP/1.1\r\nContent-Length: 11\r\n\r\nGET / HTTP/"
                    + "GET /nonexistent.html HTTP/1.1\r\n\r\n").getBytes(StandardCharsets.ISO_8859_1));
            s.shutdownOutput();

            InputStream in = s.getInputStream();
            ClientResponse first = ClientResponse.read(in);
            ClientResponse second = ClientResponse.read(in);
            assertNotNull(first);
            assertNotNull(second);
            // plain responses carry no ordering guarantee
            assertEquals(List.of(200, 404), List.of(first.status(), second.status()).stream().sorted().toList());
            assertNull(ClientResponse.read(in));
        }
    }
}
