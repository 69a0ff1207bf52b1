package org.muxhttp.client;

import org.muxhttp.api.impl.HttpRequestWriter;
import org.muxhttp.framing.Frame;
import org.muxhttp.framing.FrameCodec;
import org.muxhttp.framing.FrameFormat;
import org.muxhttp.framing.StreamFramer;
import org.muxhttp.framing.StreamReassembler;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Client for the multiplexing server and proxy. One instance is one connection;
 * requests can be sent plain (one at a time) or as a batch of streams whose framed
 * responses are reassembled in whatever order they come back.
 * <p>
 * Not thread-safe.
 */
public final class MuxClient implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(MuxClient.class.getName());

    private static final String VERSION = "HTTP/1.1";

    private final String host;
    private final int port;
    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final FrameCodec codec;

    public MuxClient(String host, int port) throws IOException {
        this(host, port, StreamFramer.DEFAULT_MAX_PAYLOAD, 10_000);
    }

    public MuxClient(String host, int port, int maxFramePayload, int readTimeoutMs) throws IOException {
        this.host = host;
        this.port = port;
        this.codec = new FrameCodec(FrameFormat.LENGTH_PREFIXED, maxFramePayload);
        this.socket = new Socket();
        socket.connect(new InetSocketAddress(host, port), readTimeoutMs);
        socket.setSoTimeout(readTimeoutMs);
        this.in = new BufferedInputStream(socket.getInputStream());
        this.out = socket.getOutputStream();
    }

    /** Plain GET; waits for the response before returning. */
    public ClientResponse get(String path) throws IOException {
        return get(path, Map.of());
    }

    public ClientResponse get(String path, Map<String, String> extraHeaders) throws IOException {
        HttpRequestWriter.send(out, HttpRequestWriter.serialize("GET", path, VERSION,
                headers(extraHeaders), null, null));
        ClientResponse r = ClientResponse.read(in);
        if (r == null) throw new EOFException("connection closed before a response");
        return r;
    }

    /**
     * Sends every path as its own stream (ids 1..n, in list order) before reading
     * anything, then collects frames until each stream has ended.
     *
     * @return responses keyed by stream id, in completion order
     */
    public Map<Integer, ClientResponse> getAll(List<String> paths) throws IOException {
        Map<Integer, String> streams = new LinkedHashMap<>();
        for (int i = 0; i < paths.size(); i++) {
            streams.put(i + 1, paths.get(i));
        }
        return getAll(streams, Map.of());
    }

    public Map<Integer, ClientResponse> getAll(Map<Integer, String> streams, Map<String, String> extraHeaders)
            throws IOException {
        for (Map.Entry<Integer, String> e : streams.entrySet()) {
            HttpRequestWriter.send(out, HttpRequestWriter.serialize("GET", e.getValue(), VERSION,
                    headers(extraHeaders), null, e.getKey()));
        }

        StreamReassembler reassembler = new StreamReassembler();
        int remaining = streams.size();
        while (remaining > 0) {
            Frame f = codec.read(in);
            if (f == null) throw new EOFException(remaining + " stream(s) still open at end of connection");
            if (reassembler.accept(f)) {
                remaining--;
                LOGGER.fine("[Client] stream " + f.streamId() + " complete");
            }
        }

        Map<Integer, ClientResponse> responses = new LinkedHashMap<>();
        for (Map.Entry<Integer, byte[]> e : reassembler.completed().entrySet()) {
            responses.put(e.getKey(), ClientResponse.parse(e.getValue()));
        }
        return responses;
    }

    /** Signals the server that no more requests follow; responses can still be read. */
    public void finishSending() throws IOException {
        socket.shutdownOutput();
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    private Map<String, String> headers(Map<String, String> extra) {
        Map<String, String> h = new LinkedHashMap<>();
        h.put("Host", host + ":" + port);
        h.putAll(extra);
        return h;
    }
}
