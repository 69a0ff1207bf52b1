package org.muxhttp.api.impl;

import org.muxhttp.infrastructure.util.HttpDates;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

/** Serialises a built response: status line, headers, blank line, body. */
public final class HttpResponseWriter {

    private HttpResponseWriter() {}

    public static byte[] serialize(HttpResponseImpl res, String serverName, Instant now) {
        Map<String, String> h = res.headers();
        h.putIfAbsent("Date", HttpDates.format(now));
        h.putIfAbsent("Server", serverName);

        byte[] body = res.body();
        if (res.status() == 304) {
            body = new byte[0]; // never a body, never a length
        } else {
            h.putIfAbsent("Content-Length", String.valueOf(body.length));
            if (body.length > 0) {
                h.putIfAbsent("Content-Type", "text/html");
            }
        }

        StringBuilder head = new StringBuilder(128);
        head.append("HTTP/1.1 ").append(res.status()).append(' ').append(res.reason()).append("\r\n");
        for (Map.Entry<String, String> e : h.entrySet()) {
            head.append(e.getKey()).append(": ").append(e.getValue()).append("\r\n");
        }
        head.append("\r\n"); // end headers

        ByteArrayOutputStream out = new ByteArrayOutputStream(head.length() + body.length);
        out.writeBytes(head.toString().getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(body);
        return out.toByteArray();
    }
}
