package org.muxhttp.client;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A response as seen by the client: status line, headers, body. */
public final class ClientResponse {

    // fallback for malformed status lines
    private static final int STATUS_UNKNOWN = -1;

    private final int status;
    private final String statusLine;
    private final Map<String, String> headers;
    private final byte[] body;

    private ClientResponse(String statusLine, Map<String, String> headers, byte[] body) {
        this.statusLine = statusLine;
        this.status = statusCodeOf(statusLine);
        this.headers = Collections.unmodifiableMap(headers);
        this.body = body;
    }

    /** Parses one complete message, e.g. the reassembled payload of a stream. */
    public static ClientResponse parse(byte[] message) throws IOException {
        ClientResponse r = read(new ByteArrayInputStream(message));
        if (r == null) throw new EOFException("empty response");
        return r;
    }

    /**
     * Reads one response off a connection. The body length comes from Content-Length;
     * without it (e.g. 304) the body is empty.
     *
     * @return null if the stream ended before a status line
     */
    public static ClientResponse read(InputStream in) throws IOException {
        String statusLine = readLine(in);
        if (statusLine == null) return null;

        Map<String, String> headers = new LinkedHashMap<>();
        String line;
        while ((line = readLine(in)) != null && !line.isEmpty()) {
            int i = line.indexOf(':');
            if (i > 0) {
                headers.put(line.substring(0, i).trim().toLowerCase(), line.substring(i + 1).trim());
            }
        }

        int len;
        try {
            len = Integer.parseInt(headers.getOrDefault("content-length", "0"));
        } catch (NumberFormatException e) {
            throw new IOException("bad Content-Length: " + headers.get("content-length"), e);
        }
        byte[] body = in.readNBytes(len);
        if (body.length < len) throw new EOFException("response body truncated");
        return new ClientResponse(statusLine, headers, body);
    }

    public int status() { return status; }
    public String statusLine() { return statusLine; }

    /** Case-insensitive; null when absent. */
    public String header(String name) {
        return headers.get(name.toLowerCase());
    }

    public byte[] body() { return body.clone(); }

    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return statusLine + " (" + body.length + " body bytes)";
    }

    /** Parses numeric HTTP status code or returns -1 if invalid. */
    private static int statusCodeOf(String statusLine) {
        String[] parts = statusLine.split(" ");
        if (parts.length >= 2) {
            try {
                return Integer.parseInt(parts[1]);
            } catch (NumberFormatException e) {
                return STATUS_UNKNOWN;
            }
        }
        return STATUS_UNKNOWN;
    }

    private static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int prev = -1, b;
        while ((b = in.read()) != -1) {
            if (prev == '\r' && b == '\n') {
                byte[] bytes = buf.toByteArray();
                return new String(bytes, 0, Math.max(0, bytes.length - 1), StandardCharsets.ISO_8859_1);
            }
            buf.write(b);
            prev = b;
        }
        return buf.size() == 0 ? null : new String(buf.toByteArray(), StandardCharsets.ISO_8859_1);
    }
}
