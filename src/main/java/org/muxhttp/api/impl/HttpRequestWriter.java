package org.muxhttp.api.impl;

import org.muxhttp.api.interfaces.http.HttpRequest;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/** Request-side wire formatting, shared by the proxy relay and the client. */
public final class HttpRequestWriter {

    private HttpRequestWriter() {}

    /**
     * Request line and headers exactly as parsed, then the body. The stream id is
     * not part of {@link HttpRequest#headers()}, so it is never forwarded.
     */
    public static byte[] serialize(HttpRequest req) {
        return serialize(req.method(), req.path(), req.version(), req.headers(), req.body(), null);
    }

    /**
     * @param streamId when non-null, a {@code STREAM-ID} header is written right after the request line
     */
    public static byte[] serialize(String method, String path, String version,
                                   Map<String, String> headers, byte[] body, Integer streamId) {
        StringBuilder sb = new StringBuilder(128);
        sb.append(method).append(' ').append(path).append(' ').append(version).append("\r\n");
        if (streamId != null) {
            sb.append(RequestParser.STREAM_ID).append(": ").append(streamId).append("\r\n");
        }
        if (headers != null) {
            for (Map.Entry<String, String> e : headers.entrySet()) {
                sb.append(e.getKey()).append(": ").append(e.getValue()).append("\r\n");
            }
        }
        sb.append("\r\n");

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(sb.toString().getBytes(StandardCharsets.ISO_8859_1));
        if (body != null && body.length > 0) {
            out.writeBytes(body);
        }
        return out.toByteArray();
    }

    public static void send(OutputStream out, byte[] request) throws IOException {
        out.write(request);
        out.flush(); // ensure transmission completeness
    }
}
